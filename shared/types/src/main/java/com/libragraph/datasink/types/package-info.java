/**
 * Pure Java value types shared across all datasink modules.
 *
 * <p>No framework dependencies.
 */
package com.libragraph.datasink.types;
