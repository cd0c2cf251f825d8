package com.flamingo.ai.regdocs.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/** Trace of one run: search terms used and per-stage counters. Null fields are omitted. */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineDebugInfo(
    @JsonProperty("sources_searched") List<String> sourcesSearched,
    @JsonProperty("search_queries") Map<String, String> searchQueries,
    @JsonProperty("ai_planned") Boolean aiPlanned,
    @JsonProperty("pdf_candidates_found") Integer candidatesFound,
    @JsonProperty("relevant_pdfs_found") Integer relevantFound,
    @JsonProperty("files_downloaded") Integer filesDownloaded,
    @JsonProperty("error_type") String errorType,
    String error) {}
