/**
 * Pure Java value types shared across all Finder modules.
 *
 * <p>Holds the format verdicts and entry kinds. ContentHash and buffer types live in
 * {@code shared/utils}. This module has no dependencies.
 */
package com.libragraph.finder.types;
