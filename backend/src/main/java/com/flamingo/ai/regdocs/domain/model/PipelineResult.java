package com.flamingo.ai.regdocs.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.regdocs.domain.enums.PipelineStatus;
import java.util.List;
import lombok.Builder;

/**
 * Aggregate outcome of one research run. Built once per run and never modified afterwards.
 *
 * <p>Counters satisfy {@code totalDownloaded <= totalRelevant <= totalFound}; they are null on
 * error results.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResult(
    PipelineStatus status,
    @JsonProperty("api") String substance,
    @JsonProperty("api_slug") String slug,
    String message,
    @JsonProperty("total_found") Integer totalFound,
    @JsonProperty("total_relevant") Integer totalRelevant,
    @JsonProperty("total_downloaded") Integer totalDownloaded,
    List<DownloadedFile> hits,
    @JsonProperty("download_all_url") String downloadAllUrl,
    @JsonProperty("debug_info") PipelineDebugInfo debugInfo) {

  public PipelineResult {
    hits = hits == null ? List.of() : List.copyOf(hits);
  }

  public boolean isError() {
    return status == PipelineStatus.ERROR;
  }
}
