package com.flamingo.ai.regdocs.http;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Response of a single GET request.
 *
 * @param statusCode HTTP status after redirects
 * @param contentType Content-Type header, empty when absent
 * @param body response body, never null
 * @param url requested URL
 */
public record FetchResponse(int statusCode, String contentType, byte[] body, String url) {

  public FetchResponse {
    contentType = contentType == null ? "" : contentType;
    body = body == null ? new byte[0] : body;
  }

  public boolean isOk() {
    return statusCode == 200;
  }

  public boolean isPdf() {
    return contentType.toLowerCase(Locale.ROOT).startsWith("application/pdf");
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
