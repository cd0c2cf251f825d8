package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.util.List;
import org.springframework.stereotype.Component;

/** FDA product-specific guidance database. */
@Component
public class FdaPsbgSourceStrategy extends AbstractSourceStrategy {

  static final String NAME = "FDA-PSBG";
  private static final List<String> LINK_KEYWORDS = List.of("guidance");

  public FdaPsbgSourceStrategy(WebFetcher webFetcher, RegDocsConfig config) {
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
                        LinkRelevance.mentionsAny(anchor.text(), substanceName, LINK_KEYWORDS),
                    true))
        .orElse(List.of());
  }
}
