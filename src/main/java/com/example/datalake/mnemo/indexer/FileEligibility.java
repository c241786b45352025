package com.example.datalake.mnemo.indexer;

import com.example.datalake.mnemo.config.MnemoProperties;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which directories the walk enters and which files get indexed. File checks run
 * cheapest first: extension, sensitive path, size; the binary probe needs the content and
 * happens after reading.
 */
public class FileEligibility {

    public enum Verdict {
        ELIGIBLE,
        WRONG_EXTENSION,
        SENSITIVE,
        TOO_LARGE
    }

    private final Set<String> extensions;
    private final Set<String> skipDirs;
    private final List<String> sensitivePatterns;
    private final long maxFileBytes;

    public FileEligibility(MnemoProperties.Indexer config) {
        this.extensions = config.getExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toUnmodifiableSet());
        this.skipDirs = Set.copyOf(config.getSkipDirs());
        this.sensitivePatterns = config.getSensitivePatterns().stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
        this.maxFileBytes = config.getMaxFileBytes();
    }

    /**
     * Hidden and tool-generated directories are never entered.
     */
    public boolean shouldDescend(Path dir) {
        Path name = dir.getFileName();
        if (name == null) {
            return true;
        }
        String s = name.toString();
        return !s.startsWith(".") && !skipDirs.contains(s);
    }

    public Verdict check(Path file, long sizeBytes) {
        if (!extensions.contains(extensionOf(file))) {
            return Verdict.WRONG_EXTENSION;
        }
        if (isSensitive(file)) {
            return Verdict.SENSITIVE;
        }
        if (sizeBytes > maxFileBytes) {
            return Verdict.TOO_LARGE;
        }
        return Verdict.ELIGIBLE;
    }

    public boolean isSensitive(Path file) {
        String path = file.toString().toLowerCase(Locale.ROOT);
        return sensitivePatterns.stream().anyMatch(path::contains);
    }

    /**
     * A NUL byte within the first {@code probeBytes} marks the content as binary.
     */
    public static boolean looksBinary(byte[] content, int probeBytes) {
        int limit = Math.min(content.length, probeBytes);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lower-cased suffix including the dot; dotfiles such as {@code .env} have none.
     */
    static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot <= 0 ? "" : s.substring(dot).toLowerCase(Locale.ROOT);
    }
}
