package com.flamingo.ai.regdocs.service.download;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Derives safe on-disk filenames for downloaded PDFs. */
public final class PdfFilenames {

  private static final int MAX_TITLE_LENGTH = 50;
  private static final Pattern UNSAFE_TITLE_CHARS =
      Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern SEPARATOR_RUNS = Pattern.compile("[-\\s]+");
  private static final Pattern UNSAFE_FILENAME_CHARS =
      Pattern.compile("[\\\\/:*?\"<>|\\x00-\\x1f]");

  private PdfFilenames() {}

  /**
   * Prefers the URL's basename when it names a PDF, then a slug of the title, then a name derived
   * from the URL hash.
   */
  public static String derive(String url, String title) {
    String basename = basename(url);
    if (basename.toLowerCase(Locale.ROOT).endsWith(".pdf") && basename.length() > ".pdf".length()) {
      return basename;
    }
    if (title != null && !title.isBlank()) {
      String safeTitle = UNSAFE_TITLE_CHARS.matcher(title.strip()).replaceAll("");
      safeTitle = SEPARATOR_RUNS.matcher(safeTitle).replaceAll("-");
      if (safeTitle.length() > MAX_TITLE_LENGTH) {
        safeTitle = safeTitle.substring(0, MAX_TITLE_LENGTH);
      }
      if (!safeTitle.isEmpty() && !safeTitle.equals("-")) {
        return safeTitle + ".pdf";
      }
    }
    return "document_" + Math.floorMod(url.hashCode(), 10000) + ".pdf";
  }

  /** Appends -2, -3, ... before the extension until the name is not in {@code taken}. */
  public static String unique(String filename, Set<String> taken) {
    if (!taken.contains(filename)) {
      return filename;
    }
    int dot = filename.lastIndexOf('.');
    String stem = dot > 0 ? filename.substring(0, dot) : filename;
    String extension = dot > 0 ? filename.substring(dot) : "";
    int counter = 2;
    String candidate;
    do {
      candidate = stem + "-" + counter++ + extension;
    } while (taken.contains(candidate));
    return candidate;
  }

  static String basename(String url) {
    String path = url;
    int cut = indexOfAny(path, '?', '#');
    if (cut >= 0) {
      path = path.substring(0, cut);
    }
    String name = path.substring(path.lastIndexOf('/') + 1);
    try {
      name = URLDecoder.decode(name.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      // keep the raw segment when it carries a malformed escape
    }
    return UNSAFE_FILENAME_CHARS.matcher(name).replaceAll("_");
  }

  private static int indexOfAny(String s, char a, char b) {
    int i = s.indexOf(a);
    int j = s.indexOf(b);
    if (i < 0) {
      return j;
    }
    return j < 0 ? i : Math.min(i, j);
  }
}
