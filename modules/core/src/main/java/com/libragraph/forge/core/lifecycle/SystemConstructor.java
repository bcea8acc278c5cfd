package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.system.SystemMap;

import java.util.Optional;

/**
 * Builds the next system from the previous one (absent on the first reset).
 * The returned system must not be started yet.
 */
@FunctionalInterface
public interface SystemConstructor {

    SystemMap create(Optional<SystemMap> previous) throws Exception;
}
