package com.libragraph.forge.core.status;

import java.time.Instant;

/**
 * Fired via CDI whenever the {@link StatusRegister} records a new {@link Outcome}.
 */
public record StatusChangedEvent(
        Outcome outcome,
        Instant timestamp
) {}
