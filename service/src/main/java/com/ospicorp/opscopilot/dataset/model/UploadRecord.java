package com.ospicorp.opscopilot.dataset.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadRecord(
    @JsonProperty("file_id") String fileId,
    String filename,
    @JsonProperty("stored_name") String storedName,
    @JsonProperty("uploaded_at") String uploadedAt
) {}
