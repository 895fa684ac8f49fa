package com.sifinder.store;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the store name for an indexed directory: a readable base name plus a short stable hash
 * of the absolute path, so the same directory always maps to the same store.
 */
public final class IndexNames {
    static final int HASH_LENGTH = 6;

    private IndexNames() {
    }

    public static String forDirectory(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        return readableName(normalized) + "_" + pathHash(normalized.toString());
    }

    static String readableName(Path normalized) {
        Path fileName = normalized.getFileName();
        if (fileName == null || fileName.toString().isBlank()) {
            return "root";
        }
        String readable = fileName.toString()
                .replaceAll("[^A-Za-z0-9._-]", "_")
                .replaceFirst("^\\.+", "");
        return readable.isEmpty() ? "root" : readable;
    }

    static String pathHash(String absolutePath) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(absolutePath.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 unavailable", e);
        }
    }
}
