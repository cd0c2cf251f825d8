package com.flamingo.ai.regdocs.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.regdocs.domain.enums.PipelineStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PipelineResult JSON")
class PipelineResultTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void shouldSerializeWithWireNames() throws Exception {
    // Given
    DownloadedFile hit =
        new DownloadedFile(
            "EPAR",
            "Assessment report",
            "report.pdf",
            "/static/ibuprofen/report.pdf",
            "https://example.org/report.pdf",
            1234L);
    PipelineResult result =
        PipelineResult.builder()
            .status(PipelineStatus.COMPLETED)
            .substance("Ibuprofen")
            .slug("ibuprofen")
            .totalFound(1)
            .totalRelevant(1)
            .totalDownloaded(1)
            .hits(List.of(hit))
            .downloadAllUrl("/api/research/ibuprofen/download-all")
            .debugInfo(
                PipelineDebugInfo.builder()
                    .sourcesSearched(List.of("EPAR"))
                    .searchQueries(Map.of("EPAR", "ibuprofen"))
                    .candidatesFound(1)
                    .build())
            .build();

    // When
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

    // Then
    assertThat(json.get("status").asText()).isEqualTo("completed");
    assertThat(json.get("api").asText()).isEqualTo("Ibuprofen");
    assertThat(json.get("api_slug").asText()).isEqualTo("ibuprofen");
    assertThat(json.get("total_downloaded").asInt()).isEqualTo(1);
    assertThat(json.get("download_all_url").asText())
        .isEqualTo("/api/research/ibuprofen/download-all");
    assertThat(json.has("message")).isFalse();

    JsonNode first = json.get("hits").get(0);
    assertThat(first.get("url").asText()).isEqualTo("/static/ibuprofen/report.pdf");
    assertThat(first.get("original_url").asText()).isEqualTo("https://example.org/report.pdf");
    assertThat(first.get("size_bytes").asLong()).isEqualTo(1234L);

    JsonNode debug = json.get("debug_info");
    assertThat(debug.get("pdf_candidates_found").asInt()).isEqualTo(1);
    assertThat(debug.has("error_type")).isFalse();
  }

  @Test
  void shouldDefensivelyCopyHits() {
    List<DownloadedFile> hits = new ArrayList<>();
    PipelineResult result =
        PipelineResult.builder().status(PipelineStatus.COMPLETED).hits(hits).build();

    hits.add(new DownloadedFile("EPAR", "t", "f.pdf", "/static/x/f.pdf", "https://x/f.pdf", 1L));

    assertThat(result.hits()).isEmpty();
  }

  @Test
  void shouldDefaultToEmptyHits_whenNoneGiven() {
    PipelineResult result = PipelineResult.builder().status(PipelineStatus.ERROR).build();

    assertThat(result.hits()).isEmpty();
    assertThat(result.isError()).isTrue();
  }
}
