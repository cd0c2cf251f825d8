package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * EMA European Public Assessment Reports. The configured URL is a medicine listing with filters
 * already applied; the search term goes into its full-text parameter and matching medicine pages
 * are followed to their PDFs.
 */
@Component
@Slf4j
public class EparSourceStrategy extends AbstractSourceStrategy {

  static final String NAME = "EPAR";
  private static final List<String> PAGE_KEYWORDS = List.of("epar", "assessment");

  public EparSourceStrategy(WebFetcher webFetcher, RegDocsConfig config) {
    super(webFetcher, config);
  }

  @Override
  public String sourceName() {
    return NAME;
  }

  @Override
  public List<PdfCandidate> search(SourceConfig source, String searchTerm, String substanceName) {
    String searchUrl = withFullTextQuery(source.url(), searchTerm);
    log.info("EMA EPAR search URL: {}", searchUrl);
    return fetchPage(searchUrl)
        .map(
            listing ->
                walkListing(
                    listing,
                    searchUrl,
                    substanceName,
                    anchor ->
                        LinkRelevance.mentionsAny(anchor.text(), substanceName, PAGE_KEYWORDS),
                    false))
        .orElse(List.of());
  }

  static String withFullTextQuery(String listingUrl, String searchTerm) {
    String separator = listingUrl.contains("?") ? "&" : "?";
    return listingUrl
        + separator
        + "search_api_fulltext="
        + URLEncoder.encode(searchTerm, StandardCharsets.UTF_8);
  }
}
