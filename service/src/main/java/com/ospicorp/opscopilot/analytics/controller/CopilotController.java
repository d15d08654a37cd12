package com.ospicorp.opscopilot.analytics.controller;

import com.ospicorp.opscopilot.analytics.model.AskRequest;
import com.ospicorp.opscopilot.analytics.model.CopilotResponse;
import com.ospicorp.opscopilot.analytics.model.TableView;
import com.ospicorp.opscopilot.analytics.service.CopilotService;
import com.ospicorp.opscopilot.analytics.service.MetricWindow;
import com.ospicorp.opscopilot.web.CsvHttpMessageConverter;
import com.ospicorp.opscopilot.web.InvalidParameterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Copilot")
public class CopilotController {
  private static final String DATASET_ID_REGEX = "^[A-Za-z0-9-]{1,64}$";

  private final CopilotService copilot;

  public CopilotController(CopilotService copilot) {
    this.copilot = copilot;
  }

  @PostMapping("/ask")
  @Operation(summary = "Ask about a dataset",
      description = "Returns an answer with headline metrics, evidence tables, charts and actions.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Answer",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CopilotResponse.class))),
      @ApiResponse(responseCode = "404", description = "Dataset not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CopilotResponse ask(@Valid @RequestBody AskRequest request) {
    return copilot.ask(request.datasetId(), request.question());
  }

  @GetMapping("/datasets/{id}/windows/{window}")
  @Tag(name = "Data")
  @Operation(summary = "Export a metric window",
      description = "One derived table as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Derived table",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = TableView.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unknown window or format"),
      @ApiResponse(responseCode = "404", description = "Dataset not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<TableView> window(
      @PathVariable @Pattern(regexp = DATASET_ID_REGEX)
      @Parameter(description = "Dataset identifier") String id,
      @PathVariable @Parameter(description = "Window name", example = "weekly-revenue") String window,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MetricWindow metricWindow = MetricWindow.fromSlug(window)
        .orElseThrow(() -> InvalidParameterException.of(
            "Invalid window. Supported values: " + MetricWindow.supportedSlugs() + ".",
            InvalidParameterException.UNKNOWN_WINDOW));
    MediaType contentType = selectMediaType(format, accept);
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(copilot.window(id, metricWindow));
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw InvalidParameterException.of("Invalid format value. Supported values: json,csv.",
          InvalidParameterException.UNKNOWN_FORMAT);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
