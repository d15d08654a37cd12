package com.ospicorp.opscopilot.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CopilotResponse(
    String answer,
    List<Metric> metrics,
    List<TableView> evidence,
    List<TableView> charts,
    List<String> actions,
    @JsonProperty("has_expenses") boolean hasExpenses,
    List<String> schema
) {}
