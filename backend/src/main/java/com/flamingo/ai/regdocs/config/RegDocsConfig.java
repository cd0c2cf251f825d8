package com.flamingo.ai.regdocs.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document discovery pipeline. */
@Configuration
@ConfigurationProperties(prefix = "regdocs")
@Getter
@Setter
public class RegDocsConfig {

  private Sources sources = new Sources();
  private Crawler crawler = new Crawler();
  private Extraction extraction = new Extraction();
  private Relevance relevance = new Relevance();
  private Download download = new Download();
  private Http http = new Http();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Sources {
    /** Spring resource location of the {@code name;url} source table. */
    private String registryLocation = "classpath:research_resources.txt";
  }

  @Getter
  @Setter
  public static class Crawler {
    /** Maximum number of PDF candidates kept per source. */
    private int perSourceCap = 10;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** A tier's text is accepted when its stripped length exceeds this value. */
    private int minChars = 100;

    /** Pause before each sample extraction, to stay under source-side rate limits. */
    private long throttleMs = 1000;

    private int maxPages = 3;
    private int ocrDpi = 300;
    private String ocrLanguage = "eng";

    /** Directory holding Tesseract language data; empty uses the TESSDATA_PREFIX default. */
    private String tessdataPath = "";
  }

  @Getter
  @Setter
  public static class Relevance {
    private int batchSize = 5;

    /** Verdicts must have a confidence strictly greater than this value. */
    private double confidenceThreshold = 0.3;

    private int maxSampleChars = 3000;
    private long batchDelayMs = 1000;
  }

  @Getter
  @Setter
  public static class Download {
    private int batchSize = 3;
  }

  @Getter
  @Setter
  public static class Http {
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
            + " Chrome/91.0.4472.124 Safari/537.36";
    private Duration pageTimeout = Duration.ofSeconds(30);
    private Duration pdfTimeout = Duration.ofSeconds(60);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private int maxInMemoryBytes = 100 * 1024 * 1024; // 100 MB
    private int maxConnections = 50;
  }

  @Getter
  @Setter
  public static class Storage {
    /** Root directory; each substance gets a {@code <root>/<slug>} sub-directory. */
    private String root = "static";

    private String publicPrefix = "/static";
    private String downloadAllPath = "/api/research/{slug}/download-all";
  }
}
