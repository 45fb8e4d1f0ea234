package com.trendscope.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AnalyseRequest(
        @NotNull(message = "Text is required")
        @Size(max = 10000, message = "Text must not exceed 10000 characters")
        String text,

        @JsonAlias("no_filter")
        Boolean noFilter
) {}
