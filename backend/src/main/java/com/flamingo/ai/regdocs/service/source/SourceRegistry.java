package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Static table of regulatory sources, read once from a {@code name;url} text file.
 *
 * <p>A missing file leaves the registry empty; the pipeline then finishes with no documents rather
 * than failing.
 */
@Component
@Slf4j
public class SourceRegistry {

  private final Map<String, SourceConfig> sources;

  @Autowired
  public SourceRegistry(RegDocsConfig config, ResourceLoader resourceLoader) {
    this(load(resourceLoader.getResource(config.getSources().getRegistryLocation())));
    log.info("Loaded {} research sources: {}", sources.size(), String.join(", ", sources.keySet()));
  }

  private SourceRegistry(Map<String, SourceConfig> sources) {
    this.sources = Collections.unmodifiableMap(sources);
  }

  /** Reads the registry from a {@code name;url} resource. */
  public static SourceRegistry from(Resource resource) {
    return new SourceRegistry(load(resource));
  }

  public static SourceRegistry of(List<SourceConfig> entries) {
    Map<String, SourceConfig> map = new LinkedHashMap<>();
    entries.forEach(e -> map.put(e.name(), e));
    return new SourceRegistry(map);
  }

  public List<SourceConfig> sources() {
    return List.copyOf(sources.values());
  }

  public List<String> sourceNames() {
    return new ArrayList<>(sources.keySet());
  }

  public Optional<SourceConfig> find(String name) {
    return Optional.ofNullable(sources.get(name));
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }

  private static Map<String, SourceConfig> load(Resource resource) {
    Map<String, SourceConfig> loaded = new LinkedHashMap<>();
    if (resource == null || !resource.exists()) {
      log.warn("Research resources file not found: {}", resource);
      return loaded;
    }
    try (InputStream in = resource.getInputStream();
        BufferedReader reader =
            new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        parseLine(line).ifPresent(source -> loaded.put(source.name(), source));
      }
    } catch (IOException e) {
      log.error("Error loading research sources from {}: {}", resource, e.getMessage());
    }
    return loaded;
  }

  static Optional<SourceConfig> parseLine(String rawLine) {
    String line = rawLine.strip();
    if (line.isEmpty() || line.startsWith("#")) {
      return Optional.empty();
    }
    int separator = line.indexOf(';');
    if (separator < 0) {
      return Optional.empty();
    }
    String name = line.substring(0, separator).strip();
    String url = line.substring(separator + 1).strip();
    if (name.isEmpty() || url.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new SourceConfig(name, url));
  }
}
