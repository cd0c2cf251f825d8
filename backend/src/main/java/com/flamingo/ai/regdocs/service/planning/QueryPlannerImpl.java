package com.flamingo.ai.regdocs.service.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.regdocs.agent.SearchPlanningAgent;
import com.flamingo.ai.regdocs.domain.model.SearchPlan;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class QueryPlannerImpl implements QueryPlanner {

  static final String SEARCH_QUERIES_FIELD = "search_queries";

  private final SearchPlanningAgent agent;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "research.plan", description = "Time to plan search queries")
  @CircuitBreaker(name = "openai", fallbackMethod = "planFallback")
  public SearchPlan plan(String substanceName, List<String> sourceNames) {
    try {
      String raw = agent.planQueries(substanceName, sourceNames.toString());
      JsonNode root = objectMapper.readTree(raw);
      if (root == null || !root.isObject()) {
        throw new IllegalStateException("Planner response is not a JSON object");
      }

      JsonNode mapping = root.has(SEARCH_QUERIES_FIELD) ? root.get(SEARCH_QUERIES_FIELD) : root;
      if (!mapping.isObject()) {
        throw new IllegalStateException("search_queries is not an object");
      }

      Map<String, String> queries = new LinkedHashMap<>();
      for (String source : sourceNames) {
        JsonNode term = mapping.get(source);
        if (term != null && term.isTextual() && !term.asText().isBlank()) {
          queries.put(source, term.asText().strip());
        } else {
          log.debug("Planner omitted {}, searching by substance name", source);
          queries.put(source, substanceName);
        }
      }
      log.info("Generated search queries for {}: {}", substanceName, queries);
      return new SearchPlan(queries, true);

    } catch (Exception e) {
      log.warn("Error generating search queries for {}: {}", substanceName, e.getMessage());
      return fallbackPlan(substanceName, sourceNames);
    }
  }

  @SuppressWarnings("unused")
  private SearchPlan planFallback(String substanceName, List<String> sourceNames, Throwable t) {
    log.warn("Query planning fallback triggered for {}: {}", substanceName, t.getMessage());
    return fallbackPlan(substanceName, sourceNames);
  }

  /** One generic web-search style query per source. */
  SearchPlan fallbackPlan(String substanceName, List<String> sourceNames) {
    meterRegistry.counter("research.planner.fallback").increment();
    Map<String, String> queries = new LinkedHashMap<>();
    for (String source : sourceNames) {
      queries.put(
          source,
          "\"%s\" approval filetype:pdf site:%s"
              .formatted(substanceName, SourceDomains.domainFor(source)));
    }
    return new SearchPlan(queries, false);
  }
}
