package com.arincdelta.jdbc.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    private static final Path CLASSPATH_CACHE_DIR = initClasspathCacheDir();

    /** Snapshot fixtures shipped under {@code src/test/resources/snapshots}. */
    public static Path snapshot(String fileName) {
        try {
            return resolveResource("classpath:snapshots/" + fileName);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to resolve snapshot fixture: " + fileName, ex);
        }
    }

    public static String calciteOperand(Path path) {
        return path.toAbsolutePath().toString().replace("\\", "\\\\");
    }

    public static Path resolveResource(String path) throws IOException {
        if (path.startsWith("classpath:")) {
            String resourceName = path.substring("classpath:".length());
            return extractClasspathResource(resourceName);
        }
        return Path.of(path).toAbsolutePath().normalize();
    }

    private static Path initClasspathCacheDir() {
        try {
            Path dir = Files.createTempDirectory("arincdelta_test_resources");
            dir.toFile().deleteOnExit();
            return dir;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create classpath cache directory", ex);
        }
    }

    private static Path extractClasspathResource(String resourceName) throws IOException {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized)) {
            if (in == null) {
                throw new IOException("Missing classpath resource: " + normalized);
            }
            Path target = CLASSPATH_CACHE_DIR.resolve(normalized).normalize();
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            return target;
        }
    }
}
