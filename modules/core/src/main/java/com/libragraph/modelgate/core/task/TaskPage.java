package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TaskPage(
        @JsonProperty("items") List<TaskSummary> items,
        @JsonProperty("total") long total,
        @JsonProperty("page") int page,
        @JsonProperty("page_size") int pageSize
) {}
