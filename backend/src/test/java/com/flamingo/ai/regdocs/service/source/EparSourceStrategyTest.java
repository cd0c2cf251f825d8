package com.flamingo.ai.regdocs.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import com.flamingo.ai.regdocs.http.FetchResponse;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EparSourceStrategy")
class EparSourceStrategyTest {

  private static final String LISTING = "https://www.ema.europa.eu/en/medicines/search?type=epar";
  private static final String SEARCH = LISTING + "&search_api_fulltext=ibuprofen";
  private static final String DETAIL = "https://www.ema.europa.eu/en/medicines/human/EPAR/ibu-teva";

  @Mock private WebFetcher webFetcher;

  private EparSourceStrategy strategy;

  @BeforeEach
  void setUp() {
    strategy = new EparSourceStrategy(webFetcher, new RegDocsConfig());
  }

  @Test
  void shouldFollowMatchingMedicinePages_andCollectTheirPdfs() {
    // Given
    when(webFetcher.get(eq(SEARCH), any(Duration.class)))
        .thenReturn(
            html(
                SEARCH,
                """
                <a href="/en/medicines/human/EPAR/ibu-teva">Ibuprofen Teva</a>
                <a href="/en/about-us">About us</a>
                <a href="https://elsewhere.org/ibuprofen">Ibuprofen elsewhere</a>
                <a href="/en/documents/ibuprofen-leaflet.pdf">Ibuprofen leaflet</a>
                """));
    when(webFetcher.get(eq(DETAIL), any(Duration.class)))
        .thenReturn(
            html(
                DETAIL,
                """
                <a href="/documents/ibu-teva-epar-public-assessment-report_en.pdf">
                  Public assessment report</a>
                <a href="/documents/other/newsletter.pdf">Newsletter</a>
                """));

    // When
    List<PdfCandidate> found =
        strategy.search(new SourceConfig("EPAR", LISTING), "ibuprofen", "Ibuprofen");

    // Then
    assertThat(found)
        .containsExactly(
            new PdfCandidate(
                "https://www.ema.europa.eu/documents/ibu-teva-epar-public-assessment-report_en.pdf",
                "Public assessment report",
                null,
                DETAIL));
    verify(webFetcher, never()).get(eq("https://elsewhere.org/ibuprofen"), any(Duration.class));
  }

  @Test
  void shouldReturnEmpty_whenListingIsUnavailable() {
    when(webFetcher.get(eq(SEARCH), any(Duration.class)))
        .thenReturn(new FetchResponse(503, "text/html", new byte[0], SEARCH));

    assertThat(strategy.search(new SourceConfig("EPAR", LISTING), "ibuprofen", "Ibuprofen"))
        .isEmpty();
  }

  @Test
  void shouldAppendEncodedFullTextParameter() {
    assertThat(EparSourceStrategy.withFullTextQuery("https://x.org/search", "ibuprofen tablets"))
        .isEqualTo("https://x.org/search?search_api_fulltext=ibuprofen+tablets");
    assertThat(EparSourceStrategy.withFullTextQuery("https://x.org/search?a=1", "ibuprofen"))
        .isEqualTo("https://x.org/search?a=1&search_api_fulltext=ibuprofen");
  }

  static FetchResponse html(String url, String body) {
    return new FetchResponse(
        200, "text/html; charset=UTF-8", body.getBytes(StandardCharsets.UTF_8), url);
  }
}
