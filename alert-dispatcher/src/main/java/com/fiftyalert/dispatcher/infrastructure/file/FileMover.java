package com.fiftyalert.dispatcher.infrastructure.file;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Replaces {@code target} with {@code source}.
 */
@FunctionalInterface
interface FileMover {

    void move(Path source, Path target) throws IOException;

    /**
     * Atomic rename, falling back to a plain replace where the filesystem cannot rename atomically.
     */
    static FileMover atomic() {
        return (source, target) -> {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        };
    }
}
