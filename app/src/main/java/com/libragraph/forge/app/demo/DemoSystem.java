package com.libragraph.forge.app.demo;

import com.libragraph.forge.core.lifecycle.SystemConstructor;
import com.libragraph.forge.core.system.SystemMap;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * The application's system: a {@code ticker} followed by a {@code scratch}
 * directory. Fresh component instances are built on every reset.
 */
@ApplicationScoped
public class DemoSystem implements SystemConstructor {

    private static final Logger log = Logger.getLogger(DemoSystem.class);

    @ConfigProperty(name = "forge.demo.tick-interval", defaultValue = "PT1S")
    Duration tickInterval;

    @ConfigProperty(name = "forge.demo.scratch-root")
    Optional<String> scratchRoot;

    @Override
    public SystemMap create(Optional<SystemMap> previous) {
        log.debugf("Constructing demo system (previous: %s)",
                previous.map(p -> p.names().toString()).orElse("none"));
        Path root = Path.of(scratchRoot.orElseGet(() -> System.getProperty("java.io.tmpdir")));
        return SystemMap.builder()
                .add("ticker", new TickerComponent(tickInterval))
                .add("scratch", new ScratchDirectoryComponent(root))
                .build();
    }
}
