package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * FDA drug approvals database. Only anchors naming the substance are followed; the approval
 * letters and reviews live on the linked product pages.
 */
@Component
public class FdaApprovalsSourceStrategy extends AbstractSourceStrategy {

  static final String NAME = "FDA-Approvals";

  public FdaApprovalsSourceStrategy(WebFetcher webFetcher, RegDocsConfig config) {
    super(webFetcher, config);
  }

  @Override
  public String sourceName() {
    return NAME;
  }

  @Override
  public List<PdfCandidate> search(SourceConfig source, String searchTerm, String substanceName) {
    return fetchPage(source.url())
        .map(
            listing ->
                walkListing(
                    listing,
                    source.url(),
                    substanceName,
                    anchor -> LinkRelevance.mentionsAny(anchor.text(), substanceName, List.of()),
                    false))
        .orElse(List.of());
  }
}
