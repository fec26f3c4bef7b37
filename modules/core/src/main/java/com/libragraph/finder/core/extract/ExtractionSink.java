package com.libragraph.finder.core.extract;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes matched member content to a directory, never overwriting existing files.
 *
 * <p>Only the member's base name is used. A clash with an existing file is resolved by
 * numbering the stem: {@code report.txt}, {@code report_1.txt}, {@code report_2.txt}.
 */
@ApplicationScoped
public class ExtractionSink {

    private static final Logger log = Logger.getLogger(ExtractionSink.class);

    static final int MAX_ATTEMPTS = 10_000;

    /**
     * Writes the content and returns the file it landed in.
     *
     * @param directory  target directory, created if missing
     * @param memberName member path inside its container
     * @throws IOException if the directory cannot be created or no file can be written
     */
    public Path extract(Path directory, String memberName, byte[] content) throws IOException {
        Files.createDirectories(directory);

        String fileName = baseName(memberName);
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        Path target = directory.resolve(fileName);
        for (int counter = 1; counter <= MAX_ATTEMPTS; counter++) {
            try {
                Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.debugf("Extracted %s to %s (%d bytes)", memberName, target, content.length);
                return target;
            } catch (FileAlreadyExistsException e) {
                target = directory.resolve(stem + "_" + counter + extension);
            }
        }
        throw new IOException("No free file name for " + fileName + " in " + directory
                + " after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Last path segment, with either separator. Names that would escape the
     * directory become {@code unnamed}.
     */
    static String baseName(String memberName) {
        String normalized = memberName.replace('\\', '/');
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return "unnamed";
        }
        return name;
    }
}
