package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.http.FetchResponse;
import com.flamingo.ai.regdocs.http.WebFetcher;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Base class for source strategies.
 *
 * <p>Provides the primitives every source uses: fetching and parsing a page, resolving anchors to
 * absolute URLs, extracting PDF anchors and following one level of internal links. Failures at
 * page level degrade to "no candidates from this page".
 */
@Slf4j
public abstract class AbstractSourceStrategy implements SourceStrategy {

  protected static final String DEFAULT_TITLE = "Document";

  protected final WebFetcher webFetcher;
  protected final RegDocsConfig config;

  protected AbstractSourceStrategy(WebFetcher webFetcher, RegDocsConfig config) {
    this.webFetcher = webFetcher;
    this.config = config;
  }

  protected int perSourceCap() {
    return config.getCrawler().getPerSourceCap();
  }

  /**
   * Fetches and parses a page. Empty when the server does not answer 200 or the fetch fails.
   *
   * @param url absolute page URL, also used as base URI for relative hrefs
   */
  protected Optional<Document> fetchPage(String url) {
    try {
      FetchResponse response = webFetcher.get(url, config.getHttp().getPageTimeout());
      if (!response.isOk()) {
        log.debug("Skipping {} (status {})", url, response.statusCode());
        return Optional.empty();
      }
      return Optional.of(Jsoup.parse(new ByteArrayInputStream(response.body()), null, url));
    } catch (IOException | RuntimeException e) {
      log.warn("Error fetching page {}: {}", url, e.getMessage());
      return Optional.empty();
    }
  }

  /** Anchors with an href, resolved against the page. Anchors that do not resolve are dropped. */
  protected List<Anchor> anchors(Document page) {
    List<Anchor> anchors = new ArrayList<>();
    for (Element link : page.select("a[href]")) {
      String absolute = link.absUrl("href");
      if (absolute.isEmpty()) {
        continue;
      }
      anchors.add(new Anchor(absolute, link.text().strip()));
    }
    return anchors;
  }

  /**
   * Fetches a page and returns its potentially relevant PDF anchors as candidates.
   *
   * @param url page to scan
   * @param substanceName substance name for the relevance heuristic
   */
  protected List<PdfCandidate> extractPdfsFromPage(String url, String substanceName) {
    return fetchPage(url).map(page -> pdfCandidatesOn(page, url, substanceName)).orElse(List.of());
  }

  protected List<PdfCandidate> pdfCandidatesOn(Document page, String url, String substanceName) {
    List<PdfCandidate> candidates = new ArrayList<>();
    for (Anchor anchor : anchors(page)) {
      if (!LinkRelevance.isPdfLink(anchor.href())) {
        continue;
      }
      String title = anchor.titleOrDefault();
      if (LinkRelevance.isPotentiallyRelevant(title + " " + anchor.href(), substanceName)) {
        candidates.add(new PdfCandidate(anchor.href(), title, null, url));
      }
    }
    return candidates;
  }

  /**
   * Walks the anchors of a listing page. Matching PDF anchors become candidates directly when
   * {@code acceptDirectPdfs} is set; other matching internal links are followed one level and
   * scanned for PDFs. Stops once the per-source cap is reached.
   */
  protected List<PdfCandidate> walkListing(
      Document listing,
      String listingUrl,
      String substanceName,
      Predicate<Anchor> matches,
      boolean acceptDirectPdfs) {
    List<PdfCandidate> found = new ArrayList<>();
    String host = hostOf(listingUrl);
    for (Anchor anchor : anchors(listing)) {
      if (found.size() >= perSourceCap()) {
        break;
      }
      if (!matches.test(anchor)) {
        continue;
      }
      if (LinkRelevance.isPdfLink(anchor.href())) {
        if (acceptDirectPdfs) {
          found.add(new PdfCandidate(anchor.href(), anchor.titleOrDefault(), null, listingUrl));
        }
        continue;
      }
      if (!sameHost(anchor.href(), host) || isSelfLink(anchor.href(), listingUrl)) {
        continue;
      }
      found.addAll(extractPdfsFromPage(anchor.href(), substanceName));
    }
    return cap(found);
  }

  protected List<PdfCandidate> cap(List<PdfCandidate> candidates) {
    return candidates.size() > perSourceCap()
        ? List.copyOf(candidates.subList(0, perSourceCap()))
        : candidates;
  }

  static String hostOf(String url) {
    try {
      String host = URI.create(url).getHost();
      return host == null ? "" : host.toLowerCase(Locale.ROOT);
    } catch (IllegalArgumentException e) {
      return "";
    }
  }

  static boolean sameHost(String url, String host) {
    return !host.isEmpty() && host.equals(hostOf(url));
  }

  private static boolean isSelfLink(String href, String pageUrl) {
    int fragment = href.indexOf('#');
    String withoutFragment = fragment >= 0 ? href.substring(0, fragment) : href;
    return withoutFragment.isEmpty() || withoutFragment.equals(pageUrl);
  }

  /** A resolved anchor: absolute href and stripped visible text. */
  protected record Anchor(String href, String text) {

    String titleOrDefault() {
      return text.isEmpty() ? DEFAULT_TITLE : text;
    }
  }
}
