package com.libragraph.forge.core.runtime;

import com.libragraph.forge.core.lifecycle.LifecycleSupervisor;
import com.libragraph.forge.core.lifecycle.SystemConstructor;
import com.libragraph.forge.core.status.StatusChangedEvent;
import com.libragraph.forge.core.status.StatusRegister;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Exposes the process-wide {@link StatusRegister} and {@link LifecycleSupervisor}
 * as beans. The supervisor's default constructor is the application's
 * {@link SystemConstructor} bean, if it has exactly one.
 * <p>
 * Every status change is re-fired as a CDI {@link StatusChangedEvent}.
 */
@ApplicationScoped
public class ForgeProducer {

    private static final Logger log = Logger.getLogger(ForgeProducer.class);

    @Inject
    Event<StatusChangedEvent> statusEvent;

    @Inject
    Instance<SystemConstructor> constructors;

    @Produces
    @Singleton
    public StatusRegister statusRegister() {
        StatusRegister register = new StatusRegister();
        register.addListener(outcome ->
                statusEvent.fire(new StatusChangedEvent(outcome, outcome.recordedAt())));
        return register;
    }

    @Produces
    @Singleton
    public LifecycleSupervisor lifecycleSupervisor(StatusRegister statusRegister) {
        if (constructors.isResolvable()) {
            return new LifecycleSupervisor(statusRegister, constructors.get());
        }
        log.info("No SystemConstructor bean found; reset() requires an explicit constructor");
        return new LifecycleSupervisor(statusRegister);
    }

    void shutdown(@Disposes LifecycleSupervisor supervisor) {
        if (supervisor.current().isEmpty()) {
            return;
        }
        try {
            supervisor.stop();
        } catch (Exception e) {
            log.warn("Error stopping system during shutdown", e);
        }
    }
}
