package com.ospicorp.opscopilot.assistant;

import java.util.Optional;

/**
 * Remote phrasing of a copilot answer. Implementations return empty when they are not
 * configured or the call fails; callers then keep the rule-based answer.
 */
public interface ExternalAnswerService {

  Optional<String> answer(String question, AnswerContext context);
}
