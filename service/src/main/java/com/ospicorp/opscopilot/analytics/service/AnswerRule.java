package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.Optional;

/**
 * One keyword-routed answer. {@link #respond} may decline with an empty result, in which
 * case the next rule is tried.
 */
public interface AnswerRule {

  boolean matches(String question);

  Optional<String> respond(NormalizedTable table);
}
