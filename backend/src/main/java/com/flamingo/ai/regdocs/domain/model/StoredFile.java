package com.flamingo.ai.regdocs.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A PDF already present in a substance's storage directory. */
public record StoredFile(String filename, String url, @JsonProperty("size_bytes") long sizeBytes) {}
