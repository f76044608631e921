package com.arccatalog.service.integrity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Answers whether a card's file is present. Replaceable in tests.
 */
@FunctionalInterface
public interface FileExistenceChecker {

    boolean exists(String filePath) throws IOException;

    static FileExistenceChecker local() {
        return filePath -> filePath != null && Files.exists(Path.of(filePath));
    }
}
