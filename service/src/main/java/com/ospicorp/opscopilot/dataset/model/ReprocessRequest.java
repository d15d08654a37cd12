package com.ospicorp.opscopilot.dataset.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ReprocessRequest(@JsonProperty("file_id") @NotBlank String fileId) {}
