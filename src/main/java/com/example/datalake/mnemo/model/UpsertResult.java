package com.example.datalake.mnemo.model;

import java.util.List;

public record UpsertResult(List<Long> insertedIds, int skipped) {

    public UpsertResult {
        insertedIds = List.copyOf(insertedIds);
    }

    public int inserted() {
        return insertedIds.size();
    }
}
