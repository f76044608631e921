package com.arccatalog.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Splits an archive into numbered part files and joins them back.
 * Parts are named {@code <base>.arc.part01}, {@code <base>.arc.part02}, ...; concatenating them in
 * order reproduces the original archive byte for byte.
 */
public class PartFiles {

    public static final String PART_MARKER = ".arc.part";
    private static final Pattern PART_NAME = Pattern.compile("^(.+)\\.arc\\.part(\\d+)$");
    private static final int BUFFER_SIZE = 64 * 1024;

    private PartFiles() {
    }

    public static boolean isPartFile(Path path) {
        return path != null && path.getFileName() != null
                && PART_NAME.matcher(path.getFileName().toString()).matches();
    }

    /**
     * Strips a trailing {@code .arc} or {@code .zip} from an archive file name.
     */
    public static String baseName(String fileName) {
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".arc") || lower.endsWith(".zip")) {
            return fileName.substring(0, fileName.length() - 4);
        }
        return fileName;
    }

    public static String partName(String base, int index) {
        return base + PART_MARKER + String.format("%02d", index);
    }

    /**
     * Splits {@code file} into exactly {@code partCount} parts of {@code ceil(size / partCount)} bytes.
     * Trailing parts of a small file are empty. The original file is deleted once every part is written.
     *
     * @return the part files in order
     */
    public static List<Path> split(Path file, int partCount) throws IOException {
        if (partCount < 1) {
            throw new IllegalArgumentException("Part count must be at least 1: " + partCount);
        }
        long size = Files.size(file);
        long partSize = (size + partCount - 1) / partCount;
        String base = baseName(file.getFileName().toString());
        Path dir = file.toAbsolutePath().getParent();

        List<Path> parts = new ArrayList<>(partCount);
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            for (int i = 1; i <= partCount; i++) {
                Path part = dir.resolve(partName(base, i));
                try (OutputStream out = Files.newOutputStream(part)) {
                    long remaining = partSize;
                    while (remaining > 0) {
                        int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                        if (read < 0) {
                            break;
                        }
                        out.write(buffer, 0, read);
                        remaining -= read;
                    }
                }
                parts.add(part);
            }
        } catch (IOException e) {
            for (Path part : parts) {
                Files.deleteIfExists(part);
            }
            throw e;
        }

        Files.delete(file);
        return parts;
    }

    /**
     * Concatenates every part of the sequence {@code anyPart} belongs to into {@code target},
     * replacing it. The parts are kept; {@code target} is deleted if merging fails.
     *
     * @throws IOException if {@code anyPart} is not a part file or the sequence is not contiguous from 01
     */
    public static Path merge(Path anyPart, Path target) throws IOException {
        Matcher matcher = PART_NAME.matcher(anyPart.getFileName().toString());
        if (!matcher.matches()) {
            throw new IOException("Not a part file: " + anyPart);
        }
        String base = matcher.group(1);
        Path dir = anyPart.toAbsolutePath().getParent();

        List<Path> parts = listParts(dir, base);
        for (int i = 0; i < parts.size(); i++) {
            if (partNumber(parts.get(i)) != i + 1) {
                throw new IOException("Part sequence incomplete for " + base + ": expected part " + (i + 1));
            }
        }
        if (parts.isEmpty()) {
            throw new IOException("Part sequence incomplete for " + base + ": no parts found");
        }

        try (OutputStream out = Files.newOutputStream(target)) {
            for (Path part : parts) {
                try (InputStream in = Files.newInputStream(part)) {
                    in.transferTo(out);
                }
            }
        } catch (IOException e) {
            Files.deleteIfExists(target);
            throw e;
        }
        return target;
    }

    /**
     * Deletes the parts of {@code base} in {@code dir} numbered above {@code lastPart}.
     *
     * @return the deleted parts
     */
    public static List<Path> deletePartsAfter(Path dir, String base, int lastPart) throws IOException {
        List<Path> deleted = new ArrayList<>();
        for (Path part : listParts(dir, base)) {
            if (partNumber(part) > lastPart) {
                Files.delete(part);
                deleted.add(part);
            }
        }
        return deleted;
    }

    private static List<Path> listParts(Path dir, String base) throws IOException {
        String prefix = base + PART_MARKER;
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && PART_NAME.matcher(name).matches();
                    })
                    .sorted((a, b) -> Integer.compare(partNumber(a), partNumber(b)))
                    .collect(Collectors.toList());
        }
    }

    private static int partNumber(Path part) {
        Matcher matcher = PART_NAME.matcher(part.getFileName().toString());
        return matcher.matches() ? Integer.parseInt(matcher.group(2)) : Integer.MAX_VALUE;
    }
}
