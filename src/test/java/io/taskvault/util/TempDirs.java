package io.taskvault.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Temporary roots created by one test, removed together once it finishes.
 */
public final class TempDirs {
    private final List<Path> roots = new ArrayList<>();

    public Path create(String prefix) throws IOException {
        Path root = Files.createTempDirectory(prefix);
        roots.add(root);
        return root;
    }

    public void deleteAll() throws IOException {
        try {
            for (Path root : roots) {
                deleteRecursively(root);
            }
        } finally {
            roots.clear();
        }
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
