package com.notelinker.engine.service.remote;

import java.io.IOException;

import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.exception.LinkerException;
import com.notelinker.engine.exception.TransientException;

/** Maps raw remote-call failures onto the configuration / transient / content taxonomy. */
@Component
public class ErrorClassifier {

  private static final int MAX_BODY_EXCERPT = 200;

  public LinkerException classify(Throwable failure) {
    if (failure instanceof LinkerException) {
      return (LinkerException) failure;
    }
    if (failure instanceof HttpStatusCodeException) {
      HttpStatusCodeException httpFailure = (HttpStatusCodeException) failure;
      return classifyStatus(
          httpFailure.getStatusCode().value(), excerpt(httpFailure.getResponseBodyAsString()));
    }
    if (failure instanceof ResourceAccessException || failure instanceof IOException) {
      return classifyTransport(TransportFailure.from(failure), failure);
    }
    return new LinkerException("Unexpected error: " + failure.getMessage(), failure);
  }

  public LinkerException classifyStatus(int status, String detail) {
    switch (status) {
      case 400:
        return new ConfigurationException(
            "Bad request to API",
            status,
            "The request was rejected. Check that the model name is valid for the configured"
                + " provider." + detailSuffix(detail));
      case 401:
      case 403:
        return new ConfigurationException(
            "Invalid API key",
            status,
            "Check the API key for the configured provider (linker.llm.api-key or"
                + " linker.embedding.api-key).");
      case 404:
        return new ConfigurationException(
            "API endpoint not found",
            status,
            "Check the API URL (linker.llm.api-url or linker.embedding.api-url).");
      case 413:
        return new ContentException("Payload too large", null, "request exceeds provider limit");
      case 429:
        return new TransientException("Rate limit exceeded", status);
      case 500:
      case 502:
      case 503:
      case 504:
        return new TransientException("Server error: " + status, status);
      default:
        return new TransientException(
            "Unexpected error: HTTP " + status + detailSuffix(detail), status);
    }
  }

  public TransientException classifyTransport(TransportFailure category, Throwable cause) {
    return new TransientException(
        "Network error: " + category.getDescription(), 0, category, 0, cause);
  }

  private static String detailSuffix(String detail) {
    return detail == null || detail.isBlank() ? "" : " (" + detail + ")";
  }

  private static String excerpt(String body) {
    if (body == null) {
      return null;
    }
    return body.length() > MAX_BODY_EXCERPT ? body.substring(0, MAX_BODY_EXCERPT) + "…" : body;
  }
}
