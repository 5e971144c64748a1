package com.notelinker.engine.service.remote;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.exception.LinkerException;
import com.notelinker.engine.exception.TransientException;

@DisplayName("ErrorClassifier Tests")
class ErrorClassifierTest {

  private final ErrorClassifier classifier = new ErrorClassifier();

  @Nested
  @DisplayName("HTTP status mapping")
  class StatusMapping {

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 404})
    @DisplayName("Should treat client setup errors as configuration failures")
    void shouldMapConfigurationStatuses(int status) {
      LinkerException result = classifier.classifyStatus(status, null);

      assertThat(result).isInstanceOf(ConfigurationException.class);
      assertThat(((ConfigurationException) result).getStatus()).isEqualTo(status);
      assertThat(((ConfigurationException) result).getGuidance()).isNotBlank();
    }

    @Test
    @DisplayName("Should give key guidance for 401")
    void shouldGiveApiKeyGuidance() {
      ConfigurationException result = (ConfigurationException) classifier.classifyStatus(401, "");

      assertThat(result.getMessage()).isEqualTo("Invalid API key");
      assertThat(result.getGuidance()).contains("api-key");
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503, 504, 418})
    @DisplayName("Should treat rate limits, server errors and unknown codes as transient")
    void shouldMapTransientStatuses(int status) {
      LinkerException result = classifier.classifyStatus(status, null);

      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(((TransientException) result).getStatus()).isEqualTo(status);
    }

    @Test
    @DisplayName("Should treat payload too large as a content failure")
    void shouldMapPayloadTooLarge() {
      assertThat(classifier.classifyStatus(413, null)).isInstanceOf(ContentException.class);
    }

    @Test
    @DisplayName("Should include the body detail for unexpected statuses")
    void shouldIncludeDetail() {
      assertThat(classifier.classifyStatus(418, "teapot").getMessage()).contains("(teapot)");
    }
  }

  @Nested
  @DisplayName("Exception mapping")
  class ExceptionMapping {

    @Test
    @DisplayName("Should classify Spring HTTP exceptions by status")
    void shouldClassifyHttpExceptions() {
      HttpClientErrorException unauthorized =
          HttpClientErrorException.create(
              HttpStatus.UNAUTHORIZED,
              "Unauthorized",
              HttpHeaders.EMPTY,
              "{\"error\":\"bad key\"}".getBytes(StandardCharsets.UTF_8),
              StandardCharsets.UTF_8);
      HttpServerErrorException unavailable =
          HttpServerErrorException.create(
              HttpStatus.SERVICE_UNAVAILABLE, "Unavailable", HttpHeaders.EMPTY, null, null);

      assertThat(classifier.classify(unauthorized)).isInstanceOf(ConfigurationException.class);
      assertThat(classifier.classify(unavailable)).isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("Should classify network failures as transient with a transport category")
    void shouldClassifyNetworkFailures() {
      LinkerException timeout =
          classifier.classify(
              new ResourceAccessException("I/O error", new SocketTimeoutException("read")));
      LinkerException dns = classifier.classify(new UnknownHostException("api.example"));

      assertThat(timeout).isInstanceOf(TransientException.class);
      assertThat(((TransientException) timeout).getTransportFailure())
          .isEqualTo(TransportFailure.TIMEOUT);
      assertThat(((TransientException) dns).getTransportFailure()).isEqualTo(TransportFailure.DNS);
    }

    @Test
    @DisplayName("Should pass engine exceptions through unchanged")
    void shouldPassThroughLinkerExceptions() {
      ContentException original = new ContentException("bad", "note-1", "too long");

      assertThat(classifier.classify(original)).isSameAs(original);
    }

    @Test
    @DisplayName("Should wrap anything else as a generic engine failure")
    void shouldWrapUnknownFailures() {
      LinkerException result = classifier.classify(new IllegalStateException("boom"));

      assertThat(result).isExactlyInstanceOf(LinkerException.class);
      assertThat(result.getMessage()).contains("boom");
    }
  }

  @Test
  @DisplayName("Should walk the cause chain to categorize transport failures")
  void shouldCategorizeTransportFailures() {
    assertThat(TransportFailure.from(new RuntimeException(new ConnectException("refused"))))
        .isEqualTo(TransportFailure.UNREACHABLE);
    assertThat(TransportFailure.from(new SocketException("Connection reset")))
        .isEqualTo(TransportFailure.CONNECTION_RESET);
    assertThat(TransportFailure.from(new RuntimeException("plain")))
        .isEqualTo(TransportFailure.UNREACHABLE);
  }
}
