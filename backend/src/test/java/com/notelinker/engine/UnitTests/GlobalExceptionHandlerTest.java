package com.notelinker.engine.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Unit tests for {@link GlobalExceptionHandler}. */
@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Unit Tests")
public class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @Mock private BindingResult bindingResult;

  @InjectMocks private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
    lenient().when(webRequest.getDescription(false)).thenReturn("uri=/api/linking/run");
  }

  @SuppressWarnings("unused")
  private void acceptBody(Object body) {}

  @Nested
  @DisplayName("Error Taxonomy Handling Tests")
  class TaxonomyTests {

    @Test
    @DisplayName("Should return 422 with guidance for configuration problems")
    void shouldHandleConfigurationException() {
      // Given
      ConfigurationException exception =
          new ConfigurationException("Invalid API key", 401, "Check linker.llm.api-key.");

      // When
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleConfigurationException(exception, webRequest);

      // Then
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
      assertThat(response.getBody().getMessage()).isEqualTo("Invalid API key");
      assertThat(response.getBody().getGuidance()).isEqualTo("Check linker.llm.api-key.");
      assertThat(response.getBody().getPath()).isEqualTo("/api/linking/run");
    }

    @Test
    @DisplayName("Should return 409 when another run holds the lock")
    void shouldHandleRunInProgress() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleRunInProgress(
              new RunInProgressException("vault linking"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
      assertThat(response.getBody().getMessage()).contains("vault linking");
      assertThat(response.getBody().getGuidance()).isNull();
    }

    @Test
    @DisplayName("Should return 503 for exhausted transient failures")
    void shouldHandleTransientException() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleTransientException(
              new TransientException("Rate limit exceeded", 429), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
      assertThat(response.getBody().getStatus()).isEqualTo(503);
      assertThat(response.getBody().getError()).isEqualTo("Service Unavailable");
    }

    @Test
    @DisplayName("Should return 404 for unknown resources")
    void shouldHandleResourceNotFound() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleResourceNotFoundException(
              new ResourceNotFoundException("No note at notes/missing.md"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("No note at notes/missing.md");
    }
  }

  @Nested
  @DisplayName("Request Validation Handling Tests")
  class ValidationTests {

    @Test
    @DisplayName("Should collect field errors into the response")
    void shouldHandleValidationErrors() throws Exception {
      // Given
      FieldError fieldError = new FieldError("runRequest", "scanPath", "must not be blank");
      MethodArgumentNotValidException exception =
          new MethodArgumentNotValidException(
              MethodParameter.forExecutable(
                  GlobalExceptionHandlerTest.class.getDeclaredMethod("acceptBody", Object.class),
                  0),
              bindingResult);
      when(bindingResult.getAllErrors()).thenReturn(List.of(fieldError));

      // When
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleValidationExceptions(exception, webRequest);

      // Then
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getError()).isEqualTo("Validation Failed");
      assertThat(response.getBody().getValidationErrors())
          .containsEntry("scanPath", "must not be blank");
    }

    @Test
    @DisplayName("Should map illegal arguments to 400")
    void shouldHandleIllegalArgument() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIllegalArgumentException(
              new IllegalArgumentException("Path escapes the vault root"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage()).isEqualTo("Path escapes the vault root");
    }

    @Test
    @DisplayName("Should report missing static resources as 404")
    void shouldHandleNoResourceFound() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleNoResourceFound(
              new NoResourceFoundException(HttpMethod.GET, "/favicon.ico"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage())
          .isEqualTo("The requested resource was not found");
    }
  }

  @Nested
  @DisplayName("Unexpected Exception Handling Tests")
  class UnexpectedExceptionTests {

    @Test
    @DisplayName("Should hide the exception message by default")
    void shouldHideDebugMessage() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new IllegalStateException("boom"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    @DisplayName("Should include the exception message when debugging outside production")
    void shouldExposeDebugMessage() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new IllegalStateException("boom"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should never include the exception message in production")
    void shouldHideDebugMessageInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new IllegalStateException("boom"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }
}
