package com.notelinker.engine.service.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.gateway.PairScoreResult;
import com.notelinker.engine.dto.gateway.ScoringPair;
import com.notelinker.engine.dto.gateway.TagResult;
import com.notelinker.engine.dto.gateway.TaggingNote;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.TransientException;
import com.notelinker.engine.fixtures.TestFixtures;
import com.notelinker.engine.service.remote.ErrorClassifier;
import com.notelinker.engine.service.remote.RemoteCallExecutor;
import com.notelinker.engine.service.remote.RetryPolicy;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemoteModelGateway Tests")
class RemoteModelGatewayTest {

  @Mock private JinaEmbeddingService embeddingService;
  @Mock private LLMServiceSelector llmServiceSelector;
  @Mock private LLMService llm;

  private final List<Long> sleeps = new ArrayList<>();
  private RemoteModelGateway gateway;

  @BeforeEach
  void setUp() {
    ObjectMapper mapper = TestFixtures.objectMapper();
    ApplicationProperties properties = new ApplicationProperties();
    RemoteCallExecutor executor =
        new RemoteCallExecutor(
            new RetryPolicy(3, Duration.ofMillis(10)), new ErrorClassifier(), sleeps::add);
    gateway =
        new RemoteModelGateway(
            embeddingService,
            llmServiceSelector,
            new PromptService(mapper),
            new LLMResponseParser(mapper),
            executor,
            properties);
    lenient().when(llm.getCurrentModelId()).thenReturn("test-model");
  }

  private static ScoringPair pair(String id1, String id2) {
    return ScoringPair.builder()
        .id1(id1)
        .id2(id2)
        .title1(id1)
        .title2(id2)
        .content1("body of " + id1)
        .content2("body of " + id2)
        .similarityScore(0.8)
        .build();
  }

  @Test
  @DisplayName("Should retry a transient scoring failure and parse the eventual reply")
  void shouldRetryScoring() {
    when(llmServiceSelector.getLLMService()).thenReturn(llm);
    when(llm.complete(anyString(), eq(RemoteModelGateway.SCORING_TEMPERATURE), anyInt()))
        .thenThrow(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE))
        .thenReturn("[{\"pair_id\": 1, \"score\": 9, \"reasoning\": \"same topic\"}]");

    List<PairScoreResult> results = gateway.score(List.of(pair("a", "b")), null);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).getId1()).isEqualTo("a");
    assertThat(results.get(0).getId2()).isEqualTo("b");
    assertThat(results.get(0).getScore()).isEqualTo(9.0);
    assertThat(sleeps).hasSize(1);
    verify(llm, times(2)).complete(contains("body of a"), eq(0.3), anyInt());
  }

  @Test
  @DisplayName("Should surface a transient failure once retries are exhausted")
  void shouldGiveUpAfterMaxAttempts() {
    when(llmServiceSelector.getLLMService()).thenReturn(llm);
    when(llm.complete(anyString(), eq(RemoteModelGateway.SCORING_TEMPERATURE), anyInt()))
        .thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

    assertThatThrownBy(() -> gateway.score(List.of(pair("a", "b")), null))
        .isInstanceOf(TransientException.class)
        .satisfies(e -> assertThat(((TransientException) e).getAttempts()).isEqualTo(3));
  }

  @Test
  @DisplayName("Should not call the model when the provider is misconfigured")
  void shouldStopOnConfigurationError() {
    when(llmServiceSelector.getLLMService())
        .thenThrow(ConfigurationException.missingSetting("linker.llm.api-key", "set it"));

    assertThatThrownBy(() -> gateway.score(List.of(pair("a", "b")), null))
        .isInstanceOf(ConfigurationException.class);
    verify(llm, never()).complete(anyString(), eq(0.3), anyInt());
  }

  @Test
  @DisplayName("Should tag at the tagging temperature")
  void shouldTagNotes() {
    when(llmServiceSelector.getLLMService()).thenReturn(llm);
    when(llm.complete(anyString(), eq(RemoteModelGateway.TAGGING_TEMPERATURE), anyInt()))
        .thenReturn("{\"results\": [{\"note_id\": \"n1\", \"tags\": [\"Java\", \"notes\"]}]}");
    TaggingNote note = TaggingNote.builder().id("n1").title("Note").content("text").build();

    List<TagResult> results = gateway.tag(List.of(note), null, 1, 3);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).getId()).isEqualTo("n1");
    assertThat(results.get(0).getTags()).isNotEmpty();
  }

  @Test
  @DisplayName("Should delegate embeddings to the embedding client")
  void shouldEmbed() {
    float[] vector = {0.1f, 0.2f};
    when(embeddingService.embed(List.of("text"))).thenReturn(List.of(vector));

    assertThat(gateway.embed(List.of("text"))).containsExactly(vector);
    verifyNoInteractions(llmServiceSelector);
  }
}
