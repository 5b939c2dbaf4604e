package com.flamingo.ai.studyplanner.service.pipeline;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Runs every external call inside its own fresh context: a new chat memory and a new agent built
 * on it. The context is torn down after the call whether it succeeds or not, so two calls never
 * see each other's history, even for the same stage and course.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IsolationManager {

  public static final String MDC_KEY = "extractionContextId";

  // A single structured-extraction exchange is system + user + answer.
  private static final int MEMORY_WINDOW = 4;

  private final AgentFactory agentFactory;
  private final Set<String> activeContexts = ConcurrentHashMap.newKeySet();

  /**
   * Invokes {@code call} with a newly built agent inside a disposable context.
   *
   * @param agentType the AI service interface to build
   * @param call the work to run against the agent
   * @return whatever {@code call} returns
   */
  public <A, T> T withFreshContext(Class<A> agentType, IsolatedCall<A, T> call) {
    ExtractionContext context = ExtractionContext.open(agentType.getSimpleName(), MEMORY_WINDOW);
    activeContexts.add(context.id());
    MDC.put(MDC_KEY, context.id());
    log.debug("Opened context {} for {}", context.id(), context.agentType());
    try {
      A agent = agentFactory.create(agentType, context.memory());
      return call.call(agent, context);
    } finally {
      context.memory().clear();
      activeContexts.remove(context.id());
      MDC.remove(MDC_KEY);
      log.debug("Discarded context {}", context.id());
    }
  }

  public int activeContextCount() {
    return activeContexts.size();
  }

  /** Work executed against a freshly built agent. */
  @FunctionalInterface
  public interface IsolatedCall<A, T> {
    T call(A agent, ExtractionContext context);
  }
}
