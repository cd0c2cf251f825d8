package com.flamingo.ai.regdocs.service.download;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PdfFilenames")
class PdfFilenamesTest {

  @Test
  void shouldPreferDecodedUrlBasename() {
    assertThat(
            PdfFilenames.derive(
                "https://www.ema.europa.eu/documents/Ibuprofen%20EPAR.pdf?download=1", "Title"))
        .isEqualTo("Ibuprofen EPAR.pdf");
    assertThat(PdfFilenames.derive("https://x.org/files/LABEL.PDF", null)).isEqualTo("LABEL.PDF");
  }

  @Test
  void shouldSanitizeTitle_whenUrlHasNoPdfBasename() {
    assertThat(
            PdfFilenames.derive(
                "https://x.org/download?id=42", "Ibuprofen: Public Assessment Report (EPAR)"))
        .isEqualTo("Ibuprofen-Public-Assessment-Report-EPAR.pdf");
  }

  @Test
  void shouldTruncateLongTitlesTo50Characters() {
    String title = "Summary of product characteristics ".repeat(4);

    String filename = PdfFilenames.derive("https://x.org/view/123", title);

    assertThat(filename).endsWith(".pdf");
    assertThat(filename.length()).isEqualTo(50 + ".pdf".length());
  }

  @Test
  void shouldUseHashName_whenNoTitle() {
    String url = "https://x.org/view/123";

    assertThat(PdfFilenames.derive(url, "  "))
        .isEqualTo("document_" + Math.floorMod(url.hashCode(), 10000) + ".pdf");
    assertThat(PdfFilenames.derive(url, "???")).startsWith("document_");
  }

  @Test
  void shouldNotLetUrlEscapesReachOtherDirectories() {
    assertThat(PdfFilenames.derive("https://x.org/a/..%2F..%2Fevil.pdf", null))
        .doesNotContain("/");
  }

  @Test
  void shouldSuffixTakenNames() {
    assertThat(PdfFilenames.unique("report.pdf", Set.of())).isEqualTo("report.pdf");
    assertThat(PdfFilenames.unique("report.pdf", Set.of("report.pdf", "report-2.pdf")))
        .isEqualTo("report-3.pdf");
  }
}
