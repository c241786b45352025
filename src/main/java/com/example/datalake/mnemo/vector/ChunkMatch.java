package com.example.datalake.mnemo.vector;

public record ChunkMatch(String path, int chunkIndex, String contentText, double distance) {
}
