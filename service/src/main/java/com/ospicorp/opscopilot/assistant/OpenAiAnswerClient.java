package com.ospicorp.opscopilot.assistant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Phrases answers through the OpenAI Responses API. Stays inert until an API key is set.
 */
@Service
public class OpenAiAnswerClient implements ExternalAnswerService {
  private static final Logger log = LoggerFactory.getLogger(OpenAiAnswerClient.class);

  static final String INSTRUCTIONS = "You are an AI ops copilot for a small business. "
      + "Answer the question using the provided summary. "
      + "Be concise, mention 1-2 key numbers, and end with one action.\n";

  private final RestTemplate restTemplate;
  private final ObjectMapper mapper;
  private final String url;
  private final String apiKey;
  private final String model;
  private final double temperature;

  public OpenAiAnswerClient(RestTemplate restTemplate, ObjectMapper mapper,
      @Value("${copilot.openai.url:https://api.openai.com/v1/responses}") String url,
      @Value("${copilot.openai.api-key:}") String apiKey,
      @Value("${copilot.openai.model:gpt-4o-mini}") String model,
      @Value("${copilot.openai.temperature:0.2}") double temperature) {
    this.restTemplate = restTemplate;
    this.mapper = mapper;
    this.url = url;
    this.apiKey = apiKey;
    this.model = model;
    this.temperature = temperature;
  }

  public boolean isConfigured() {
    return StringUtils.hasText(apiKey);
  }

  @Override
  public Optional<String> answer(String question, AnswerContext context) {
    if (!isConfigured()) {
      return Optional.empty();
    }
    try {
      String prompt = buildPrompt(question, context);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("model", model);
      body.put("input", prompt);
      body.put("temperature", temperature);

      HttpHeaders headers = new HttpHeaders();
      headers.setContentType(MediaType.APPLICATION_JSON);
      headers.setBearerAuth(apiKey);
      log.debug("Calling answer model {} with prompt of {} chars", model, prompt.length());

      ResponseEntity<JsonNode> response = restTemplate.exchange(url, HttpMethod.POST,
          new HttpEntity<>(body, headers), JsonNode.class);
      Optional<String> text = outputText(response.getBody());
      if (text.isEmpty()) {
        log.warn("Answer model {} returned no output text", model);
      }
      return text;
    } catch (RestClientException | JsonProcessingException ex) {
      log.warn("Answer model call failed, keeping rule-based answer: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  String buildPrompt(String question, AnswerContext context) throws JsonProcessingException {
    return INSTRUCTIONS
        + "Question: " + question + "\n"
        + "Summary: " + mapper.writeValueAsString(context);
  }

  static Optional<String> outputText(JsonNode body) {
    if (body == null) {
      return Optional.empty();
    }
    JsonNode direct = body.path("output_text");
    if (direct.isTextual() && StringUtils.hasText(direct.asText())) {
      return Optional.of(direct.asText());
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode output : body.path("output")) {
      for (JsonNode content : output.path("content")) {
        if ("output_text".equals(content.path("type").asText())) {
          text.append(content.path("text").asText(""));
        }
      }
    }
    return StringUtils.hasText(text) ? Optional.of(text.toString().strip()) : Optional.empty();
  }
}
