package com.flamingo.ai.regdocs.service.source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lookup of {@link SourceStrategy} by source name. Names without a dedicated strategy resolve to
 * the {@link GenericSourceStrategy}.
 */
@Component
@Slf4j
public class SourceStrategyRegistry {

  private final Map<String, SourceStrategy> byName = new LinkedHashMap<>();
  private final GenericSourceStrategy genericStrategy;

  public SourceStrategyRegistry(
      List<SourceStrategy> strategies, GenericSourceStrategy genericStrategy) {
    this.genericStrategy = genericStrategy;
    for (SourceStrategy strategy : strategies) {
      if (strategy != genericStrategy) {
        byName.put(strategy.sourceName(), strategy);
      }
    }
    log.debug("Registered source strategies: {}", byName.keySet());
  }

  public SourceStrategy resolve(String sourceName) {
    SourceStrategy strategy = byName.get(sourceName);
    if (strategy == null) {
      log.warn("No specific search method for {}, using generic search", sourceName);
      return genericStrategy;
    }
    return strategy;
  }
}
