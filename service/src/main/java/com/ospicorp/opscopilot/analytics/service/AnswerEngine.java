package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rule-based responder. Rules are tried in order and the first one that both matches the
 * question and produces an answer wins.
 */
public final class AnswerEngine {
  static final String DEFAULT_ANSWER =
      "Here's a quick read: check the evidence panels for weekly trends, anomalies, and reorder risks.";

  private final List<AnswerRule> rules;

  public AnswerEngine() {
    this(List.of(QuestionIntent.values()));
  }

  public AnswerEngine(List<? extends AnswerRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public String answer(String question, NormalizedTable table) {
    String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
    for (AnswerRule rule : rules) {
      if (!rule.matches(q)) {
        continue;
      }
      Optional<String> answer = rule.respond(table);
      if (answer.isPresent()) {
        return answer.get();
      }
    }
    return DEFAULT_ANSWER;
  }
}
