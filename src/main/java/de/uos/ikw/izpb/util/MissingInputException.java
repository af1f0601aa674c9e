package de.uos.ikw.izpb.util;

import java.nio.file.Path;

/**
 * Raised when an input the analysis cannot run without (PRN list, article corpus) is missing.
 */
public class MissingInputException extends RuntimeException {
    private final Path path;

    public MissingInputException(String what, Path path) {
        super(what + " not found at " + path.toAbsolutePath());
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
