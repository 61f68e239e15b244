/**
 * Pure Java value types shared across all Sift modules.
 *
 * <p>ContentHash, ContentRef and the buffer types live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.sift.types;
