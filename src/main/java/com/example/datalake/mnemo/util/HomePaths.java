package com.example.datalake.mnemo.util;

import java.nio.file.Path;

public final class HomePaths {

    private HomePaths() {
    }

    /**
     * Expands a leading {@code ~} to the user's home directory and normalises the result.
     */
    public static Path expand(String raw) {
        String trimmed = raw.trim();
        if (trimmed.equals("~")) {
            return Path.of(System.getProperty("user.home")).toAbsolutePath().normalize();
        }
        if (trimmed.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), trimmed.substring(2)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }
}
