package com.example.tuckshop.infrastructure.adapter.in.web.dto;

public record DeleteResponse(
        boolean success,
        String id
) {
    public static DeleteResponse of(String id) {
        return new DeleteResponse(true, id);
    }
}
