/**
 * Shared utilities for all Forge modules.
 *
 * <p>Contains {@link com.libragraph.forge.util.PropertyFiles} (properties loading) and {@link com.libragraph.forge.util.Html} (markup escaping).
 * No framework dependencies; pure Java.
 */
package com.libragraph.forge.util;
