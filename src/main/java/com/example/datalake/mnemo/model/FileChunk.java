package com.example.datalake.mnemo.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class FileChunk {

    Long id;

    String path;

    int chunkIndex;

    String contentText;

    Long embeddingId;

    /**
     * Source file modification time, epoch millis.
     */
    long fileMtime;

    OffsetDateTime indexedAt;
}
