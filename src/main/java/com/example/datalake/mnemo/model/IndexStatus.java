package com.example.datalake.mnemo.model;

import java.time.OffsetDateTime;
import java.util.List;

public record IndexStatus(
        long fileCount,
        long chunkCount,
        OffsetDateTime lastIndexedAt,
        List<String> roots,
        List<String> extensions,
        boolean enabled,
        String vectorMode
) {
}
