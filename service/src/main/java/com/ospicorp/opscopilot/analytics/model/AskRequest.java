package com.ospicorp.opscopilot.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AskRequest(@JsonProperty("dataset_id") @NotBlank String datasetId, String question) {}
