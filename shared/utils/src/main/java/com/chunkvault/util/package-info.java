/**
 * Shared value types for all chunkvault modules.
 *
 * <p>Contains {@link com.chunkvault.util.ContentHash} (BLAKE3-256).
 * No framework dependencies, only commons-codec for hashing.
 */
package com.chunkvault.util;
