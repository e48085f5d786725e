package com.cario.scholar.app.service;

import com.cario.scholar.app.prompt.PromptConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/**
 * Loads prompt files from {@code s3://bucket/key} or any Spring resource location ({@code
 * classpath:}, {@code file:}). YAML is tried first, then JSON. Loaded prompts are kept for the
 * lifetime of the process.
 */
@Log4j2
public class PromptLoaderService {

  private static final String S3_PREFIX = "s3://";

  private final ResourceLoader resourceLoader;
  private final S3Client s3Client;

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();
  private final Map<String, PromptConfig> loaded = new ConcurrentHashMap<>();

  /**
   * @param s3Client may be null when AWS is disabled; {@code s3://} locations then fail to load
   */
  public PromptLoaderService(ResourceLoader resourceLoader, S3Client s3Client) {
    this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    this.s3Client = s3Client;
  }

  public PromptConfig load(String location) {
    return loaded.computeIfAbsent(location, this::read);
  }

  private PromptConfig read(String location) {
    String raw = location.startsWith(S3_PREFIX) ? readS3(location) : readResource(location);

    PromptConfig cfg;
    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      cfg = new PromptConfig();
      cfg.setSystemTemplate(asString(map.get("system")));
      cfg.setUserTemplate(asString(map.get("user")));
      cfg.setRules(toStringMap(map.get("rules")));
      log.info("prompt.loaded location={} format=yaml", location);
    } catch (IOException yamlErr) {
      log.warn("prompt.yaml parse failed location={} err={}", location, yamlErr.getMessage());
      try {
        cfg = jsonMapper.readValue(raw, PromptConfig.class);
      } catch (IOException e) {
        log.error("prompt.load failed location={}", location, e);
        throw new RuntimeException("Failed to parse prompt " + location, e);
      }
      if (cfg.getRules() == null) {
        cfg.setRules(Map.of());
      }
      log.info("prompt.loaded location={} format=json", location);
    }
    cfg.validate(location);
    return cfg;
  }

  private String readS3(String location) {
    if (s3Client == null) {
      throw new IllegalStateException("S3 is disabled, cannot load " + location);
    }
    String path = location.substring(S3_PREFIX.length());
    int slash = path.indexOf('/');
    if (slash <= 0 || slash == path.length() - 1) {
      throw new IllegalArgumentException("Invalid s3 location: " + location);
    }
    String bucket = path.substring(0, slash);
    String key = path.substring(slash + 1);
    try {
      ResponseBytes<?> bytes =
          s3Client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
      return bytes.asString(StandardCharsets.UTF_8);
    } catch (RuntimeException e) {
      log.error("prompt.load failed location={}", location, e);
      throw new RuntimeException("Failed to load prompts from " + location, e);
    }
  }

  private String readResource(String location) {
    Resource resource = resourceLoader.getResource(location);
    try (InputStream in = resource.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("prompt.load failed location={}", location, e);
      throw new RuntimeException("Failed to load prompts from " + location, e);
    }
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  private static Map<String, String> toStringMap(Object node) {
    if (!(node instanceof Map<?, ?> src)) {
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : src.entrySet()) {
      out.put(Objects.toString(e.getKey(), ""), e.getValue() == null ? null : e.getValue().toString());
    }
    return out;
  }
}
