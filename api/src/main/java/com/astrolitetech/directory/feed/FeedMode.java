package com.astrolitetech.directory.feed;

import java.util.Locale;

public enum FeedMode {
  /** One shared watermark, read and advanced in separate steps. */
  SHARED,
  /** Polls are serialised and each one reads exactly the window it advances over. */
  ATOMIC;

  public static FeedMode from(String value) {
    if (value == null || value.isBlank()) {
      return SHARED;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
