package com.notelinker.engine.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/** Settings for the linking engine, bound from the {@code linker.*} namespace. */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "linker")
public class ApplicationProperties {

  /** Raises the engine's own loggers to DEBUG at startup. */
  private boolean debugLogging;

  /** Default run mode when a request does not say. */
  private boolean forceModeDefault;

  /** Age after which an existing pair score is re-scored in smart mode. */
  private Duration freshnessWindow = Duration.ofDays(7);

  @Valid private Vault vault = new Vault();
  @Valid private Thresholds thresholds = new Thresholds();
  @Valid private Links links = new Links();
  @Valid private Batch batch = new Batch();
  @Valid private Embedding embedding = new Embedding();
  @Valid private Llm llm = new Llm();
  @Valid private Cache cache = new Cache();
  @Valid private Failures failures = new Failures();
  @Valid private Tags tags = new Tags();
  @Valid private Retry retry = new Retry();

  @Data
  public static class Vault {
    private String root = "./vault";
    /** Sub-path of the root scanned by default; empty means the whole vault. */
    private String defaultScanPath = "";
    private List<String> excludedFolders = new ArrayList<>();
    private List<String> excludedPatterns = new ArrayList<>();
  }

  @Data
  public static class Thresholds {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarity = 0.7;

    @Min(0)
    @Max(10)
    private int minAiScore = 7;
  }

  @Data
  public static class Links {
    @Min(1)
    @Max(50)
    private int maxPerNote = 10;
  }

  @Data
  public static class Batch {
    @Min(1)
    @Max(50)
    private int scoringSize = 10;

    @Min(1)
    @Max(20)
    private int taggingSize = 5;

    @Min(1)
    @Max(100)
    private int embeddingSize = 16;
  }

  @Data
  public static class Embedding {
    private String apiUrl = "https://api.jina.ai/v1/embeddings";
    private String apiKey;
    private String model = "jina-embeddings-v3";
    private int maxChars = 8000;
    private Duration timeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Llm {
    /** One of openai, anthropic, gemini, bedrock, ollama or custom. */
    private String provider = "openai";

    private String apiUrl;
    private String apiKey;
    private String model;
    private String awsRegion = "us-east-1";
    private int maxTokens = 10000;
    private int scoringMaxChars = 1000;
    private int taggingMaxChars = 1000;
    private Duration timeout = Duration.ofSeconds(300);
    private String scoringPrompt;
    private String taggingPrompt;
  }

  @Data
  public static class Cache {
    private String path = "./data/linker-cache.sql";
    private boolean persistent = true;
  }

  @Data
  public static class Failures {
    private Duration retention = Duration.ofDays(30);
  }

  @Data
  public static class Tags {
    private boolean enabled = true;

    @Min(1)
    private int minTags = 3;

    @Min(1)
    private int maxTags = 5;
  }

  @Data
  public static class Retry {
    @Min(1)
    private int maxAttempts = 3;

    private Duration baseDelay = Duration.ofSeconds(1);
  }
}
