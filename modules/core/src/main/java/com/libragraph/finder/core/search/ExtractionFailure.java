package com.libragraph.finder.core.search;

import java.nio.file.Path;

/**
 * A matched member that could not be written to the extraction directory.
 * The search itself continued past it.
 */
public record ExtractionFailure(String memberName, String location, Path directory, String message) {
}
