package com.trendscope.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
