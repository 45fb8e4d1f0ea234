package com.trendscope.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record FrequencyRequest(
        @NotEmpty(message = "At least one post is required")
        @Size(max = 5000, message = "A batch must not exceed 5000 posts")
        List<String> posts,

        @JsonAlias("no_filter")
        Boolean noFilter
) {}
