package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StockErrorResponse(
        String type,
        String itemName,
        String message,
        Integer requested,
        Integer available
) {}
