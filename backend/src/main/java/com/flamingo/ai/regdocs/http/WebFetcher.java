package com.flamingo.ai.regdocs.http;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.exception.ResourceFetchException;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Blocking GET client shared by the crawler, the text extraction engine and the download manager.
 * Follows redirects and identifies itself with a browser-like User-Agent, since several
 * regulatory sites reject unknown clients.
 *
 * <p>Owns its connection pool; the pool is released when the bean is destroyed.
 */
@Component
@Slf4j
public class WebFetcher {

  private final ConnectionProvider connectionProvider;
  private final WebClient webClient;

  public WebFetcher(RegDocsConfig config) {
    RegDocsConfig.Http http = config.getHttp();
    this.connectionProvider =
        ConnectionProvider.builder("regdocs-http").maxConnections(http.getMaxConnections()).build();
    HttpClient httpClient =
        HttpClient.create(connectionProvider)
            .followRedirect(true)
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis());
    this.webClient =
        WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(http.getMaxInMemoryBytes()))
            .build();
    log.info(
        "Web fetcher initialized: maxConnections={}, maxInMemoryBytes={}",
        http.getMaxConnections(),
        http.getMaxInMemoryBytes());
  }

  /**
   * Issues a GET and returns whatever status the server answered with.
   *
   * @param url absolute URL
   * @param timeout response timeout for the whole exchange
   * @return the response, including non-2xx ones
   * @throws ResourceFetchException when no response was received
   */
  public FetchResponse get(String url, Duration timeout) {
    try {
      FetchResponse response =
          webClient
              .get()
              .uri(toUri(url))
              .exchangeToMono(
                  clientResponse ->
                      clientResponse
                          .bodyToMono(byte[].class)
                          .defaultIfEmpty(new byte[0])
                          .map(
                              body ->
                                  new FetchResponse(
                                      clientResponse.statusCode().value(),
                                      clientResponse
                                          .headers()
                                          .contentType()
                                          .map(MediaType::toString)
                                          .orElse(""),
                                      body,
                                      url)))
              .timeout(timeout)
              .block();
      if (response == null) {
        throw new ResourceFetchException(url, -1);
      }
      log.debug("GET {} -> {} ({} bytes)", url, response.statusCode(), response.body().length);
      return response;
    } catch (ResourceFetchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ResourceFetchException(url, e);
    }
  }

  /**
   * GETs a URL and fails unless the server answered 200.
   *
   * @throws ResourceFetchException on a non-200 status or transport failure
   */
  public FetchResponse getOk(String url, Duration timeout) {
    FetchResponse response = get(url, timeout);
    if (!response.isOk()) {
      throw new ResourceFetchException(url, response.statusCode());
    }
    return response;
  }

  private static URI toUri(String url) {
    try {
      return URI.create(url);
    } catch (IllegalArgumentException e) {
      // hrefs scraped from HTML may carry unencoded spaces or brackets
      return UriComponentsBuilder.fromUriString(url).encode().build().toUri();
    }
  }

  @PreDestroy
  public void close() {
    log.debug("Disposing web fetcher connection pool");
    connectionProvider.dispose();
  }
}
