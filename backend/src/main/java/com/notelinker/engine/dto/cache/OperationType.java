package com.notelinker.engine.dto.cache;

public enum OperationType {
  EMBEDDING,
  SCORING,
  TAGGING;

  public String dbValue() {
    return name().toLowerCase();
  }

  public static OperationType fromDbValue(String value) {
    return OperationType.valueOf(value.toUpperCase());
  }
}
