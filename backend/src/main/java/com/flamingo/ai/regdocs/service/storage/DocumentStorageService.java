package com.flamingo.ai.regdocs.service.storage;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.StoredFile;
import com.flamingo.ai.regdocs.exception.InvalidSubstanceNameException;
import com.flamingo.ai.regdocs.exception.SubstanceFilesNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Filesystem layout for downloaded documents: one directory per substance slug under the storage
 * root, served under the public prefix.
 */
@Service
@Slf4j
public class DocumentStorageService {

  private static final Pattern VALID_SLUG = Pattern.compile("[a-z0-9][a-z0-9-]*");

  private final RegDocsConfig config;

  public DocumentStorageService(RegDocsConfig config) {
    this.config = config;
  }

  /** Creates the substance directory if missing and returns it. */
  public Path prepareDirectory(String slug) {
    Path dir = directoryFor(slug);
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create storage directory " + dir, e);
    }
    return dir;
  }

  /**
   * Lists the PDFs stored for a slug, sorted by filename.
   *
   * @return empty list when nothing has been stored yet
   */
  public List<StoredFile> listFiles(String slug) {
    Path dir = directoryFor(slug);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    return pdfsIn(dir).stream()
        .map(path -> new StoredFile(fileName(path), publicUrl(slug, fileName(path)), sizeOf(path)))
        .toList();
  }

  public int fileCount(String slug) {
    Path dir = directoryFor(slug);
    return Files.isDirectory(dir) ? pdfsIn(dir).size() : 0;
  }

  /**
   * Streams every stored PDF of a slug as a ZIP archive.
   *
   * @throws SubstanceFilesNotFoundException if the slug has no stored PDFs
   */
  public void writeArchive(String slug, OutputStream out) throws IOException {
    Path dir = directoryFor(slug);
    List<Path> files = Files.isDirectory(dir) ? pdfsIn(dir) : List.of();
    if (files.isEmpty()) {
      throw new SubstanceFilesNotFoundException(slug);
    }
    ZipOutputStream zip = new ZipOutputStream(out);
    for (Path file : files) {
      zip.putNextEntry(new ZipEntry(fileName(file)));
      Files.copy(file, zip);
      zip.closeEntry();
    }
    zip.finish();
    log.info("Archived {} files for substance {}", files.size(), slug);
  }

  public String archiveFileName(String slug) {
    return validate(slug) + "_documents.zip";
  }

  /**
   * Removes every stored PDF of a slug.
   *
   * @return number of files deleted
   * @throws SubstanceFilesNotFoundException if the slug has no directory
   */
  public int deleteFiles(String slug) {
    Path dir = directoryFor(slug);
    if (!Files.isDirectory(dir)) {
      throw new SubstanceFilesNotFoundException(slug);
    }
    int deleted = 0;
    for (Path file : pdfsIn(dir)) {
      try {
        Files.delete(file);
        deleted++;
      } catch (IOException e) {
        log.warn("Failed to delete {}: {}", file, e.getMessage());
      }
    }
    log.info("Deleted {} files for substance {}", deleted, slug);
    return deleted;
  }

  public String publicUrl(String slug, String filename) {
    return trimTrailingSlash(config.getStorage().getPublicPrefix())
        + "/"
        + validate(slug)
        + "/"
        + filename;
  }

  /** Public URL of a file inside a directory created by {@link #prepareDirectory}. */
  public String publicUrl(Path directory, String filename) {
    return publicUrl(directory.getFileName().toString(), filename);
  }

  public String downloadAllUrl(String slug) {
    return config.getStorage().getDownloadAllPath().replace("{slug}", validate(slug));
  }

  Path directoryFor(String slug) {
    return Path.of(config.getStorage().getRoot()).resolve(validate(slug));
  }

  private static String validate(String slug) {
    if (slug == null || !VALID_SLUG.matcher(slug).matches()) {
      throw new InvalidSubstanceNameException(slug);
    }
    return slug;
  }

  private static List<Path> pdfsIn(Path dir) {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> fileName(p).toLowerCase(Locale.ROOT).endsWith(".pdf"))
          .sorted(Comparator.comparing(DocumentStorageService::fileName))
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
  }

  private static String fileName(Path path) {
    return path.getFileName().toString();
  }

  private static long sizeOf(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read size of " + path, e);
    }
  }

  private static String trimTrailingSlash(String prefix) {
    return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
  }
}
