package com.flamingo.ai.regdocs.domain.model;

/** A named regulatory source and the listing/search page the crawl starts from. */
public record SourceConfig(String name, String url) {}
