package com.libragraph.forge.app.demo;

import com.libragraph.forge.core.lifecycle.SystemLifecycle;
import com.libragraph.forge.core.system.SystemMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DemoSystemTest {

    @TempDir
    Path root;

    private DemoSystem demoSystem() {
        DemoSystem demo = new DemoSystem();
        demo.tickInterval = Duration.ofMillis(10);
        demo.scratchRoot = Optional.of(root.toString());
        return demo;
    }

    @Test
    void buildsTickerThenScratch() {
        SystemMap system = demoSystem().create(Optional.empty());

        assertThat(system.startOrder()).containsExactly("ticker", "scratch");
        assertThat(system.get("ticker")).containsInstanceOf(TickerComponent.class);
        assertThat(system.get("scratch")).containsInstanceOf(ScratchDirectoryComponent.class);
    }

    @Test
    void buildsFreshInstancesEachTime() {
        DemoSystem demo = demoSystem();
        SystemMap first = demo.create(Optional.empty());
        SystemMap second = demo.create(Optional.of(first));

        assertThat(second.get("ticker").orElseThrow()).isNotSameAs(first.get("ticker").orElseThrow());
    }

    @Test
    void startsAndStopsAsSystem() {
        SystemMap started = SystemLifecycle.start(demoSystem().create(Optional.empty()));
        ScratchDirectoryComponent scratch = (ScratchDirectoryComponent) started.get("scratch").orElseThrow();
        assertThat(scratch.directory()).hasValueSatisfying(dir -> assertThat(dir).startsWith(root));

        SystemMap stopped = SystemLifecycle.stop(started);

        assertThat(((TickerComponent) stopped.get("ticker").orElseThrow()).isRunning()).isFalse();
        assertThat(scratch.directory()).isEmpty();
    }
}
