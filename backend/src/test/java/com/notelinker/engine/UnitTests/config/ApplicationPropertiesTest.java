package com.notelinker.engine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest(classes = ApplicationProperties.class)
@EnableConfigurationProperties(ApplicationProperties.class)
@TestPropertySource(
    properties = {
      "linker.force-mode-default=true",
      "linker.freshness-window=3d",
      "linker.vault.root=/tmp/test-vault",
      "linker.vault.excluded-folders=templates,archive",
      "linker.thresholds.similarity=0.75",
      "linker.thresholds.min-ai-score=6",
      "linker.links.max-per-note=4",
      "linker.batch.scoring-size=8",
      "linker.llm.provider=anthropic",
      "linker.llm.timeout=45s",
      "linker.cache.persistent=false",
      "linker.retry.base-delay=250ms"
    })
public class ApplicationPropertiesTest {

  @Autowired private ApplicationProperties applicationProperties;

  @Test
  public void testPropertiesLoading() {
    assertTrue(applicationProperties.isForceModeDefault());
    assertEquals(Duration.ofDays(3), applicationProperties.getFreshnessWindow());
    assertEquals("/tmp/test-vault", applicationProperties.getVault().getRoot());
    assertEquals(
        List.of("templates", "archive"), applicationProperties.getVault().getExcludedFolders());
    assertEquals(0.75, applicationProperties.getThresholds().getSimilarity());
    assertEquals(6, applicationProperties.getThresholds().getMinAiScore());
    assertEquals(4, applicationProperties.getLinks().getMaxPerNote());
    assertEquals(8, applicationProperties.getBatch().getScoringSize());
  }

  @Test
  public void testNestedDurationsAndFlags() {
    assertEquals("anthropic", applicationProperties.getLlm().getProvider());
    assertEquals(Duration.ofSeconds(45), applicationProperties.getLlm().getTimeout());
    assertFalse(applicationProperties.getCache().isPersistent());
    assertEquals(Duration.ofMillis(250), applicationProperties.getRetry().getBaseDelay());
  }

  @Test
  public void testDefaults() {
    ApplicationProperties props = new ApplicationProperties();
    assertFalse(props.isForceModeDefault());
    assertEquals(Duration.ofDays(7), props.getFreshnessWindow());
    assertEquals(0.7, props.getThresholds().getSimilarity());
    assertEquals(7, props.getThresholds().getMinAiScore());
    assertEquals(10, props.getLinks().getMaxPerNote());
    assertEquals(10, props.getBatch().getScoringSize());
    assertEquals(5, props.getBatch().getTaggingSize());
    assertEquals("openai", props.getLlm().getProvider());
    assertNull(props.getLlm().getApiKey());
    assertEquals("jina-embeddings-v3", props.getEmbedding().getModel());
    assertTrue(props.getCache().isPersistent());
    assertEquals(3, props.getRetry().getMaxAttempts());
    assertEquals(Duration.ofDays(30), props.getFailures().getRetention());
  }
}
