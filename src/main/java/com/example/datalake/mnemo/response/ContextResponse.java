package com.example.datalake.mnemo.response;

/**
 * @param block memory block, empty when nothing relevant is stored
 */
public record ContextResponse(long ownerId, String block) {
}
