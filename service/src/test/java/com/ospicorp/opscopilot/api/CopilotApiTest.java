package com.ospicorp.opscopilot.api;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CopilotApiTest {
  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  @Autowired
  private TestRestTemplate rest;

  @Test
  void uploadThenAskReturnsFullAnswer() {
    Map<String, Object> dataset = upload(new ClassPathResource("fixtures/sales.csv"));
    assertThat(dataset.get("rows")).isEqualTo(12);
    assertThat(dataset.get("filename")).isEqualTo("sales.csv");

    ResponseEntity<Map<String, Object>> response = post("/v1/ask",
        Map.of("dataset_id", dataset.get("dataset_id"), "question", "What should I reorder?"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = Objects.requireNonNull(response.getBody());
    assertThat(body.get("answer"))
        .isEqualTo("Gadget is your most urgent reorder: only 4 on hand with 5.4 units/day demand.");
    assertThat(body.get("has_expenses")).isEqualTo(Boolean.TRUE);
    assertThat(body).containsKeys("metrics", "evidence", "charts", "actions", "schema");

    @SuppressWarnings("unchecked")
    List<Map<String, Object>> metrics = (List<Map<String, Object>>) body.get("metrics");
    assertThat(metrics.get(0)).containsEntry("label", "Total revenue").containsEntry("value", "$2,350");

    @SuppressWarnings("unchecked")
    List<String> actions = (List<String>) body.get("actions");
    assertThat(actions.get(0)).isEqualTo("Reorder Gadget: only 4 on hand with ~5.4/day demand.");
  }

  @Test
  void uploadsAreListedAndCanBeReprocessed() {
    Map<String, Object> dataset = upload(new ClassPathResource("fixtures/sales.csv"));

    ResponseEntity<Map<String, Object>> listing =
        rest.exchange("/v1/uploads", HttpMethod.GET, null, JSON_MAP);
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> uploads =
        (List<Map<String, Object>>) Objects.requireNonNull(listing.getBody()).get("uploads");
    assertThat(uploads.get(0).get("file_id")).isEqualTo(dataset.get("file_id"));
    assertThat(uploads.get(0)).containsKeys("filename", "stored_name", "uploaded_at");

    ResponseEntity<Map<String, Object>> reprocessed =
        post("/v1/reprocess", Map.of("file_id", dataset.get("file_id")));
    assertThat(reprocessed.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = Objects.requireNonNull(reprocessed.getBody());
    assertThat(body.get("file_id")).isEqualTo(dataset.get("file_id"));
    assertThat(body.get("dataset_id")).isNotEqualTo(dataset.get("dataset_id"));
  }

  @Test
  void windowExportsAsJsonOrCsv() {
    String id = (String) upload(new ClassPathResource("fixtures/sales.csv")).get("dataset_id");

    ResponseEntity<Map<String, Object>> json = rest.exchange(
        "/v1/datasets/" + id + "/windows/weekly-revenue", HttpMethod.GET, null, JSON_MAP);
    assertThat(json.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(json.getBody()).containsEntry("title", "Weekly revenue trend")
        .containsEntry("columns", List.of("week", "revenue"));

    ResponseEntity<String> csv = rest.getForEntity(
        "/v1/datasets/" + id + "/windows/daily-financials?format=csv", String.class);
    assertThat(csv.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(Objects.requireNonNull(csv.getHeaders().getContentType())
        .isCompatibleWith(MediaType.valueOf("text/csv"))).isTrue();
    assertThat(csv.getBody()).startsWith("date,revenue,expenses,net_income")
        .contains("2024-03-01,390.0,130.0,260.0");

    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.valueOf("text/csv")));
    ResponseEntity<String> negotiated = rest.exchange(
        "/v1/datasets/" + id + "/windows/reorder-list", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);
    assertThat(negotiated.getBody())
        .startsWith("item,sku,category,avg_daily_units,inventory_on_hand,weeks_of_cover");
  }

  @Test
  void invalidParametersCarryErrorCodes() {
    String id = (String) upload(new ClassPathResource("fixtures/sales.csv")).get("dataset_id");

    ResponseEntity<Map<String, Object>> window = rest.exchange(
        "/v1/datasets/" + id + "/windows/forecast", HttpMethod.GET, null, JSON_MAP);
    assertThat(window.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(window.getBody()).containsEntry("errorCode", 2005)
        .containsEntry("error", "Invalid window. Supported values: weekly-revenue,daily-financials,"
            + "trending-items,reorder-list,anomalies.")
        .containsEntry("moreInfo", "https://docs.ops-copilot.dev/errors/2005");

    ResponseEntity<Map<String, Object>> format = rest.exchange(
        "/v1/datasets/" + id + "/windows/anomalies?format=xml", HttpMethod.GET, null, JSON_MAP);
    assertThat(format.getBody()).containsEntry("errorCode", 2006);

    ResponseEntity<Map<String, Object>> question =
        post("/v1/ask", Map.of("dataset_id", id, "question", "  "));
    assertThat(question.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(question.getBody()).containsEntry("errorCode", 2004);
  }

  @Test
  void nonCsvUploadIsRejected() {
    ResponseEntity<Map<String, Object>> response = uploadEntity(named("notes.txt", "date,revenue\n"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2001)
        .containsEntry("error", "Only CSV files are supported.")
        .containsEntry("path", "/v1/upload");
  }

  @Test
  void csvWithoutKnownColumnsIsRejected() {
    ResponseEntity<Map<String, Object>> response = uploadEntity(named("misc.csv", "colour,size\nred,9\n"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2002);
  }

  @Test
  void unknownDatasetAndUploadAreNotFound() {
    ResponseEntity<Map<String, Object>> ask =
        post("/v1/ask", Map.of("dataset_id", "does-not-exist", "question", "hello"));
    assertThat(ask.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(Objects.requireNonNull(ask.getHeaders().getContentType()).toString())
        .contains("application/problem+json");
    assertThat(ask.getBody()).containsEntry("detail", "Dataset not found.");

    ResponseEntity<Map<String, Object>> reprocess = post("/v1/reprocess", Map.of("file_id", "nope"));
    assertThat(reprocess.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(reprocess.getBody()).containsEntry("detail", "Upload not found.");
  }

  @Test
  void healthReportsOk() {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/v1/health", HttpMethod.GET, null, JSON_MAP);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("status", "ok").containsKey("time");
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isNotBlank();
  }

  private Map<String, Object> upload(Resource file) {
    ResponseEntity<Map<String, Object>> response = uploadEntity(file);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    return Objects.requireNonNull(response.getBody());
  }

  private ResponseEntity<Map<String, Object>> uploadEntity(Resource file) {
    MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
    parts.add("file", file);
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.MULTIPART_FORM_DATA);
    return rest.exchange("/v1/upload", HttpMethod.POST, new HttpEntity<>(parts, headers), JSON_MAP);
  }

  private ResponseEntity<Map<String, Object>> post(String path, Map<String, Object> body) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return rest.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), JSON_MAP);
  }

  private static Resource named(String filename, String contents) {
    return new ByteArrayResource(contents.getBytes(StandardCharsets.UTF_8)) {
      @Override
      public String getFilename() {
        return filename;
      }
    };
  }
}
