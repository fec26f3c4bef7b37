package com.libragraph.finder.formats.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Context information about a byte source being classified or opened.
 *
 * @param filename       display name, used in log and error messages
 * @param mediaTypeHint  advisory media type from an external source; never decides the format
 */
public record FileContext(
        String filename,
        Optional<String> mediaTypeHint
) {
    public static FileContext of(String filename) {
        return new FileContext(filename, Optional.empty());
    }

    public static FileContext of(Path path) {
        Path name = path.getFileName();
        return of(name != null ? name.toString() : path.toString());
    }

    public FileContext withMediaTypeHint(String mediaType) {
        return new FileContext(filename, Optional.ofNullable(mediaType));
    }
}
