package com.example.datalake.mnemo.service;

import com.example.datalake.mnemo.config.MnemoProperties;
import com.example.datalake.mnemo.util.HomePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the head of each tracked project's README.md.
 */
@Slf4j
@Component
public class ProjectContextReader {

    static final String README = "README.md";

    private final int readmeChars;

    public ProjectContextReader(MnemoProperties properties) {
        this.readmeChars = properties.getContext().getReadmeChars();
    }

    /**
     * @return one {@code [path] text} entry per project with a readable README, in input order
     */
    public Mono<List<String>> read(List<String> projectPaths) {
        return Flux.fromIterable(projectPaths)
                .concatMap(path -> Mono.fromCallable(() -> readHead(path))
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.debug("[injector] Failed to read project context for {} – {}", path, e.getMessage());
                            return Mono.empty();
                        }))
                .collectList();
    }

    private String readHead(String projectPath) throws IOException {
        Path readme = HomePaths.expand(projectPath).resolve(README);
        if (!Files.isRegularFile(readme)) {
            return null;
        }
        char[] buffer = new char[readmeChars];
        int filled = 0;
        try (Reader reader = Files.newBufferedReader(readme, StandardCharsets.UTF_8)) {
            int n;
            while (filled < buffer.length && (n = reader.read(buffer, filled, buffer.length - filled)) != -1) {
                filled += n;
            }
        }
        return "[" + projectPath + "] " + new String(buffer, 0, filled);
    }
}
