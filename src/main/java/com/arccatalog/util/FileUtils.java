package com.arccatalog.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Utility class for file manipulation.
 */
public class FileUtils {

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.jpg").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        // ".gitignore" (i == 0) is a hidden file without extension
        if (i > 0) {
            return fileName.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * Converts a path relative to {@code root} into an archive entry name with forward slashes.
     */
    public static String toEntryName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Recursively deletes a directory tree. Missing paths are ignored.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
        }
    }

    /**
     * Sums the size of every regular file below {@code root}.
     */
    public static TreeSize measureTree(Path root) throws IOException {
        TreeSize size = new TreeSize();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    size.bytes += attrs.size();
                    size.files++;
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return size;
    }

    public static final class TreeSize {
        private long bytes;
        private int files;

        public static TreeSize of(long bytes, int files) {
            TreeSize size = new TreeSize();
            size.bytes = bytes;
            size.files = files;
            return size;
        }

        public long getBytes() { return bytes; }
        public int getFiles() { return files; }
    }
}
