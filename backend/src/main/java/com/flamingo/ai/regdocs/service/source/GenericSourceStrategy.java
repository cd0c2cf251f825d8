package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Fallback for sources without a dedicated strategy. Scans the landing page for PDF links; when
 * the page holds none it is treated as a directory and its relevant internal links are followed
 * one level.
 */
@Component
@Slf4j
public class GenericSourceStrategy extends AbstractSourceStrategy {

  static final String NAME = "*";

  public GenericSourceStrategy(WebFetcher webFetcher, RegDocsConfig config) {
    super(webFetcher, config);
  }

  @Override
  public String sourceName() {
    return NAME;
  }

  @Override
  public List<PdfCandidate> search(SourceConfig source, String searchTerm, String substanceName) {
    log.info("Generic search of {} for {}", source.name(), substanceName);
    return fetchPage(source.url())
        .map(page -> scan(page, source.url(), substanceName))
        .orElse(List.of());
  }

  private List<PdfCandidate> scan(Document page, String url, String substanceName) {
    List<PdfCandidate> direct = pdfCandidatesOn(page, url, substanceName);
    if (!direct.isEmpty()) {
      return cap(direct);
    }
    log.debug("No PDF links on {}, following internal links", url);
    return walkListing(
        page,
        url,
        substanceName,
        anchor -> LinkRelevance.isPotentiallyRelevant(anchor.text(), substanceName),
        false);
  }
}
