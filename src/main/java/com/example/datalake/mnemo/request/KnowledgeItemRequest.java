package com.example.datalake.mnemo.request;

import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.KnowledgeMetadata;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record KnowledgeItemRequest(
        @NotNull(message = "Entity type is required") EntityType type,
        @NotBlank(message = "Content is required") String content,
        KnowledgeMetadata metadata,
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidence
) {
}
