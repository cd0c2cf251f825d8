package com.flamingo.ai.regdocs.domain.model;

import com.flamingo.ai.regdocs.exception.InvalidSubstanceNameException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A substance name as typed by the user, its normalised form and the slug used as storage key.
 *
 * <p>Normalisation trims the input and strips common salt-form suffixes so that searches match the
 * active ingredient ("Ibuprofen HCL" becomes "Ibuprofen"). The slug is a pure function of the
 * normalised name.
 */
public record SubstanceQuery(String rawName, String normalizedName, String slug) {

  private static final List<String> SALT_SUFFIXES =
      List.of(" hcl", " hydrochloride", " sulfate", " sodium", " potassium");

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

  public static SubstanceQuery of(String rawName) {
    if (rawName == null || rawName.isBlank()) {
      throw new InvalidSubstanceNameException(rawName);
    }
    String normalized = normalize(rawName);
    String slug = slugify(normalized);
    if (normalized.isEmpty() || slug.isEmpty()) {
      throw new InvalidSubstanceNameException(rawName);
    }
    return new SubstanceQuery(rawName, normalized, slug);
  }

  static String normalize(String name) {
    String clean = name.strip();
    for (String suffix : SALT_SUFFIXES) {
      if (clean.toLowerCase(Locale.ROOT).endsWith(suffix)) {
        clean = clean.substring(0, clean.length() - suffix.length()).strip();
      }
    }
    return clean;
  }

  /** Lowercases and collapses every run of non-alphanumeric characters into one hyphen. */
  public static String slugify(String name) {
    String slug = NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
    int start = 0;
    int end = slug.length();
    while (start < end && slug.charAt(start) == '-') {
      start++;
    }
    while (end > start && slug.charAt(end - 1) == '-') {
      end--;
    }
    return slug.substring(start, end);
  }
}
