package com.libragraph.forge.app;

import com.libragraph.forge.core.lifecycle.LifecycleSupervisor;
import com.libragraph.forge.core.system.SystemMap;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Process entry point. Starts the system once, then blocks until shutdown is
 * requested. The running system is stopped when the supervisor bean is disposed.
 * Exits with status 1 if the initial start fails.
 */
@QuarkusMain
public class ForgeMain implements QuarkusApplication {

    private static final Logger log = Logger.getLogger(ForgeMain.class);

    @Inject
    LifecycleSupervisor supervisor;

    @Override
    public int run(String... args) {
        try {
            SystemMap system = supervisor.reset();
            log.infof("System started: %s", system.names());
        } catch (RuntimeException e) {
            log.fatalf(e, "Failed to start system: %s", e.getMessage());
            return 1;
        }
        Quarkus.waitForExit();
        return 0;
    }
}
