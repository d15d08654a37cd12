package com.ospicorp.opscopilot.assistant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.opscopilot.analytics.model.Metric;
import java.util.List;
import java.util.Map;

/** Summary handed to an external answering service. */
public record AnswerContext(
    List<Metric> metrics,
    List<String> actions,
    @JsonProperty("recent_rows") List<Map<String, Object>> recentRows
) {}
