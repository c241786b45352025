package com.example.datalake.mnemo.controller;

import com.example.datalake.mnemo.service.EmbeddingStore;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final EmbeddingStore embeddingStore;

    @GetMapping
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "up",
                "vectorIndex", embeddingStore.vectorMode().name().toLowerCase(Locale.ROOT))));
    }
}
