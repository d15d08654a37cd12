package com.ospicorp.opscopilot.dataset.model;

import java.util.List;

public record UploadsResponse(List<UploadRecord> uploads) {}
