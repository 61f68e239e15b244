/**
 * Shared utilities for all Sift modules.
 *
 * <p>Contains {@link com.libragraph.sift.util.ContentHash} (BLAKE3-128),
 * {@link com.libragraph.sift.util.ContentRef} and the
 * {@link com.libragraph.sift.util.buffer buffer layer} (BinaryData, Buffer, ByteRegion).
 * No framework dependencies.
 */
package com.libragraph.sift.util;
