/**
 * Shared utilities for all Finder modules.
 *
 * <p>Contains {@link com.libragraph.finder.util.ContentHash} (BLAKE3-128) and the
 * {@link com.libragraph.finder.util.buffer buffer layer} (BinaryData, RamBuffer).
 * No framework dependencies, only commons-codec for hashing.
 */
package com.libragraph.finder.util;
