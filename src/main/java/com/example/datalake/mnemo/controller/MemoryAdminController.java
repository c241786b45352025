package com.example.datalake.mnemo.controller;

import com.example.datalake.mnemo.exception.DuplicateKnowledgeException;
import com.example.datalake.mnemo.exception.InvalidOwnerException;
import com.example.datalake.mnemo.indexer.FileIndexer;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.FileSearchHit;
import com.example.datalake.mnemo.model.IndexRunResult;
import com.example.datalake.mnemo.model.IndexStatus;
import com.example.datalake.mnemo.request.KnowledgeItemRequest;
import com.example.datalake.mnemo.request.KnowledgeUpdateRequest;
import com.example.datalake.mnemo.response.ContextResponse;
import com.example.datalake.mnemo.response.CreatedResponse;
import com.example.datalake.mnemo.response.KnowledgeItemResponse;
import com.example.datalake.mnemo.service.KnowledgeStore;
import com.example.datalake.mnemo.service.MemoryInjector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
@Tag(name = "Memory", description = "Knowledge items, file index and context preview")
public class MemoryAdminController {

    private static final int MAX_LIMIT = 100;

    private final KnowledgeStore knowledgeStore;
    private final FileIndexer fileIndexer;
    private final MemoryInjector memoryInjector;

    @Operation(summary = "File index status")
    @GetMapping("/index/status")
    public Mono<IndexStatus> indexStatus() {
        return fileIndexer.getStatus();
    }

    @Operation(summary = "Run an incremental file index now")
    @PostMapping("/index/run")
    public Mono<ResponseEntity<IndexRunResult>> runIndex() {
        return fileIndexer.runIncremental()
                .map(result -> result.isAlreadyRunning()
                        ? ResponseEntity.status(HttpStatus.CONFLICT).body(result)
                        : ResponseEntity.ok(result));
    }

    @Operation(summary = "Search indexed files")
    @GetMapping("/files/search")
    public Mono<List<FileSearchHit>> searchFiles(@RequestParam("q") String query,
                                                 @RequestParam(defaultValue = "5") int limit,
                                                 @RequestParam(name = "path", required = false) String pathFilter) {
        return fileIndexer.search(query, clamp(limit), pathFilter);
    }

    @Operation(summary = "List knowledge items of one type, newest first")
    @GetMapping("/{ownerId}/knowledge")
    public Mono<List<KnowledgeItemResponse>> listKnowledge(@PathVariable long ownerId,
                                                           @RequestParam("type") String type,
                                                           @RequestParam(defaultValue = "20") int limit,
                                                           @RequestParam(defaultValue = "0.0") double minConfidence) {
        return knowledgeStore.getByType(ownerId, parseType(type), clamp(limit), minConfidence)
                .map(items -> items.stream().map(KnowledgeItemResponse::from).toList())
                .onErrorMap(InvalidOwnerException.class, this::badRequest);
    }

    @Operation(summary = "Add a knowledge item")
    @PostMapping("/{ownerId}/knowledge")
    public Mono<ResponseEntity<CreatedResponse>> addKnowledge(@PathVariable long ownerId,
                                                              @Valid @RequestBody KnowledgeItemRequest request) {
        double confidence = request.confidence() == null ? 1.0 : request.confidence();
        return knowledgeStore.addItem(ownerId, request.type(), request.content(), request.metadata(), confidence)
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(id)))
                .onErrorMap(DuplicateKnowledgeException.class,
                        e -> new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e))
                .onErrorMap(InvalidOwnerException.class, this::badRequest)
                .onErrorMap(IllegalArgumentException.class, this::badRequest);
    }

    @Operation(summary = "Update content and/or metadata of a knowledge item")
    @PutMapping("/{ownerId}/knowledge/{id}")
    public Mono<ResponseEntity<Void>> updateKnowledge(@PathVariable long ownerId,
                                                      @PathVariable long id,
                                                      @RequestBody KnowledgeUpdateRequest request) {
        return knowledgeStore.update(ownerId, id, request.content(), request.metadata())
                .map(updated -> updated
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build())
                .onErrorMap(DuplicateKnowledgeException.class,
                        e -> new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e))
                .onErrorMap(InvalidOwnerException.class, this::badRequest)
                .onErrorMap(IllegalArgumentException.class, this::badRequest);
    }

    @Operation(summary = "Delete a knowledge item")
    @DeleteMapping("/{ownerId}/knowledge/{id}")
    public Mono<ResponseEntity<Void>> deleteKnowledge(@PathVariable long ownerId, @PathVariable long id) {
        return knowledgeStore.delete(ownerId, id)
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build())
                .onErrorMap(InvalidOwnerException.class, this::badRequest);
    }

    @Operation(summary = "Preview the memory block for a message")
    @GetMapping("/{ownerId}/context")
    public Mono<ContextResponse> context(@PathVariable long ownerId,
                                         @RequestParam(name = "message", defaultValue = "") String message) {
        return memoryInjector.buildContext(ownerId, message)
                .map(block -> new ContextResponse(ownerId, block))
                .onErrorMap(InvalidOwnerException.class, this::badRequest);
    }

    private EntityType parseType(String raw) {
        try {
            return EntityType.fromCode(raw);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private ResponseStatusException badRequest(Throwable e) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
