package com.example.datalake.mnemo.embedding;

import com.example.datalake.mnemo.config.MnemoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Deletes stale model-runtime directories (native libraries, JIT caches) left in the temp
 * directory. Used when the model fails with a full disk.
 */
@Slf4j
@Component
public class CacheDirectoryJanitor {

    private final Path tempDir;
    private final List<String> prefixes;

    @Autowired
    public CacheDirectoryJanitor(MnemoProperties properties) {
        this(Path.of(System.getProperty("java.io.tmpdir")), properties.getEmbedding().getCacheDirPrefixes());
    }

    public CacheDirectoryJanitor(Path tempDir, List<String> prefixes) {
        this.tempDir = tempDir;
        this.prefixes = List.copyOf(prefixes);
    }

    /**
     * @return number of directories removed
     */
    public int purge() {
        if (prefixes.isEmpty() || !Files.isDirectory(tempDir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(tempDir, this::isCacheDirectory)) {
            for (Path dir : entries) {
                try {
                    if (FileSystemUtils.deleteRecursively(dir)) {
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("[encoder] Could not delete cache directory {} – {}", dir, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("[encoder] Could not list temp directory {} – {}", tempDir, e.getMessage());
        }
        log.info("[encoder] Purged {} cache directories under {}", removed, tempDir);
        return removed;
    }

    private boolean isCacheDirectory(Path path) {
        if (!Files.isDirectory(path)) {
            return false;
        }
        String name = path.getFileName().toString();
        return prefixes.stream().anyMatch(name::startsWith);
    }
}
