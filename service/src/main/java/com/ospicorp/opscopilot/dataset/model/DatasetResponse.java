package com.ospicorp.opscopilot.dataset.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DatasetResponse(
    @JsonProperty("dataset_id") String datasetId,
    int rows,
    @JsonProperty("file_id") String fileId,
    String filename,
    @JsonProperty("uploaded_at") String uploadedAt
) {}
