package com.libragraph.forge.core.status;

/**
 * Synchronous callback run after every {@link StatusRegister#set(Outcome)}.
 */
@FunctionalInterface
public interface StatusListener {

    void onStatusChanged(Outcome outcome);
}
