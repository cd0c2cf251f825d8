package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.util.List;
import org.springframework.stereotype.Component;

/** EMA product-specific bioequivalence guidance listing, matched on guidance keywords. */
@Component
public class EmaPsbgSourceStrategy extends AbstractSourceStrategy {

  static final String NAME = "EMA-PSBG";
  private static final List<String> GUIDANCE_KEYWORDS =
      List.of("guidance", "bioequivalence", "product-specific");

  public EmaPsbgSourceStrategy(WebFetcher webFetcher, RegDocsConfig config) {
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
                    anchor ->
                        LinkRelevance.mentionsAny(anchor.text(), substanceName, GUIDANCE_KEYWORDS),
                    true))
        .orElse(List.of());
  }
}
