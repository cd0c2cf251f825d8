package com.flamingo.ai.regdocs.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.StoredFile;
import com.flamingo.ai.regdocs.exception.InvalidSubstanceNameException;
import com.flamingo.ai.regdocs.exception.SubstanceFilesNotFoundException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentStorageService")
class DocumentStorageServiceTest {

  @TempDir Path storageRoot;

  private DocumentStorageService storageService;

  @BeforeEach
  void setUp() {
    RegDocsConfig config = new RegDocsConfig();
    config.getStorage().setRoot(storageRoot.toString());
    storageService = new DocumentStorageService(config);
  }

  @Test
  void shouldListOnlyPdfs_sortedByName() throws Exception {
    // Given
    Path dir = storageService.prepareDirectory("ibuprofen");
    Files.writeString(dir.resolve("b-label.pdf"), "bb");
    Files.writeString(dir.resolve("a-epar.PDF"), "a");
    Files.writeString(dir.resolve("notes.txt"), "ignored");

    // When
    List<StoredFile> files = storageService.listFiles("ibuprofen");

    // Then
    assertThat(files)
        .containsExactly(
            new StoredFile("a-epar.PDF", "/static/ibuprofen/a-epar.PDF", 1),
            new StoredFile("b-label.pdf", "/static/ibuprofen/b-label.pdf", 2));
    assertThat(storageService.fileCount("ibuprofen")).isEqualTo(2);
  }

  @Test
  void shouldReturnEmptyListing_forUnknownSlug() {
    assertThat(storageService.listFiles("paracetamol")).isEmpty();
    assertThat(storageService.fileCount("paracetamol")).isZero();
  }

  @Test
  void shouldWriteZipOfStoredPdfs() throws Exception {
    // Given
    Path dir = storageService.prepareDirectory("ibuprofen");
    Files.writeString(dir.resolve("epar.pdf"), "%PDF epar");
    Files.writeString(dir.resolve("psbg.pdf"), "%PDF psbg");

    // When
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    storageService.writeArchive("ibuprofen", out);

    // Then
    List<String> entries = new ArrayList<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(out.toByteArray()))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.add(entry.getName() + "=" + new String(zip.readAllBytes()));
      }
    }
    assertThat(entries).containsExactly("epar.pdf=%PDF epar", "psbg.pdf=%PDF psbg");
    assertThat(storageService.archiveFileName("ibuprofen")).isEqualTo("ibuprofen_documents.zip");
  }

  @Test
  void shouldRefuseArchive_whenNothingStored() {
    storageService.prepareDirectory("ibuprofen");

    assertThatThrownBy(() -> storageService.writeArchive("ibuprofen", new ByteArrayOutputStream()))
        .isInstanceOf(SubstanceFilesNotFoundException.class);
  }

  @Test
  void shouldDeleteStoredPdfs() throws Exception {
    Path dir = storageService.prepareDirectory("ibuprofen");
    Files.writeString(dir.resolve("epar.pdf"), "x");

    assertThat(storageService.deleteFiles("ibuprofen")).isEqualTo(1);
    assertThat(storageService.listFiles("ibuprofen")).isEmpty();
    assertThatThrownBy(() -> storageService.deleteFiles("unknown"))
        .isInstanceOf(SubstanceFilesNotFoundException.class);
  }

  @Test
  void shouldRejectSlugsThatEscapeTheStorageRoot() {
    assertThatThrownBy(() -> storageService.listFiles("../etc"))
        .isInstanceOf(InvalidSubstanceNameException.class);
    assertThatThrownBy(() -> storageService.prepareDirectory("Ibuprofen"))
        .isInstanceOf(InvalidSubstanceNameException.class);
  }

  @Test
  void shouldBuildPublicUrls() {
    assertThat(storageService.publicUrl("ibuprofen", "epar.pdf"))
        .isEqualTo("/static/ibuprofen/epar.pdf");
    assertThat(storageService.downloadAllUrl("ibuprofen"))
        .isEqualTo("/api/research/ibuprofen/download-all");
  }
}
