package com.example.datalake.mnemo.response;

public record CreatedResponse(long id) {
}
