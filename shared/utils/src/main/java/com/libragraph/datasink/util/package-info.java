/**
 * Shared utilities for all datasink modules.
 *
 * <p>Contains {@link com.libragraph.datasink.util.ContentHash} (BLAKE3-128 via commons-codec)
 * and {@link com.libragraph.datasink.util.Deadline}. No framework dependencies.
 */
package com.libragraph.datasink.util;
