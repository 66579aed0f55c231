package org.l5xexport.l5x;

import java.nio.file.Path;

public class L5xNotFoundException extends L5xException {

    private final Path path;

    public L5xNotFoundException(Path path) {
        super("File not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NOT_FOUND;
    }
}
