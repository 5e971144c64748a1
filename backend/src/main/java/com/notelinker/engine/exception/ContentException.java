package com.notelinker.engine.exception;

import lombok.Getter;

/** One item cannot be processed as sent. The item is skipped and the batch carries on. */
@Getter
public class ContentException extends LinkerException {

  private final String itemId;
  private final String reason;

  public ContentException(String message, String itemId, String reason) {
    super(message);
    this.itemId = itemId;
    this.reason = reason;
  }
}
