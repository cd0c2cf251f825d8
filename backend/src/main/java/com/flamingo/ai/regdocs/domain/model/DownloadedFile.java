package com.flamingo.ai.regdocs.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A candidate that was fetched and written to storage. */
public record DownloadedFile(
    String source,
    String title,
    String filename,
    @JsonProperty("url") String storedUrl,
    @JsonProperty("original_url") String originalUrl,
    @JsonProperty("size_bytes") long sizeBytes) {}
