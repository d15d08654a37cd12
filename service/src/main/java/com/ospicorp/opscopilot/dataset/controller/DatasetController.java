package com.ospicorp.opscopilot.dataset.controller;

import com.ospicorp.opscopilot.dataset.model.DatasetResponse;
import com.ospicorp.opscopilot.dataset.model.ReprocessRequest;
import com.ospicorp.opscopilot.dataset.model.UploadsResponse;
import com.ospicorp.opscopilot.dataset.service.DatasetService;
import com.ospicorp.opscopilot.web.InvalidParameterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Datasets")
public class DatasetController {
  private final DatasetService datasets;

  public DatasetController(DatasetService datasets) {
    this.datasets = datasets;
  }

  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Upload a CSV export",
      description = "Stores the file, normalizes it and registers a new dataset.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dataset registered",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = DatasetResponse.class))),
      @ApiResponse(responseCode = "400", description = "Not a usable CSV")
  })
  public DatasetResponse upload(@RequestPart("file") MultipartFile file) {
    byte[] contents;
    try {
      contents = file.getBytes();
    } catch (IOException ex) {
      throw InvalidParameterException.of("Unable to read upload: " + ex.getMessage(),
          InvalidParameterException.UNREADABLE_CSV);
    }
    return datasets.upload(file.getOriginalFilename(), contents);
  }

  @GetMapping("/uploads")
  @Operation(summary = "List recent uploads", description = "Newest first.")
  public UploadsResponse uploads() {
    return new UploadsResponse(datasets.listUploads());
  }

  @PostMapping("/reprocess")
  @Operation(summary = "Reprocess a stored upload",
      description = "Re-reads a stored file and registers it under a new dataset id.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dataset registered",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = DatasetResponse.class))),
      @ApiResponse(responseCode = "404", description = "Upload or stored file not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public DatasetResponse reprocess(@Valid @RequestBody ReprocessRequest request) {
    return datasets.reprocess(request.fileId());
  }
}
