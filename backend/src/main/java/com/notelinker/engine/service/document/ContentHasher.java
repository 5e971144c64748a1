package com.notelinker.engine.service.document;

import static java.nio.charset.StandardCharsets.UTF_8;

import org.springframework.stereotype.Component;

import com.google.common.hash.Hashing;

@Component
public class ContentHasher {

  /** Lowercase hex SHA-256 of the text. */
  public String hash(String text) {
    return Hashing.sha256().hashString(text, UTF_8).toString();
  }
}
