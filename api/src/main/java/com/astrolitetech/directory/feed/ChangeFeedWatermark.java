package com.astrolitetech.directory.feed;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Boundary between user rows already handed out by the new-users feed and rows not yet seen. Lives
 * only in memory: a restart resets it to the start of the process.
 */
public class ChangeFeedWatermark {

  private final AtomicReference<Instant> value;

  public ChangeFeedWatermark(Instant initial) {
    this.value = new AtomicReference<>(initial);
  }

  public Instant current() {
    return value.get();
  }

  public void advanceTo(Instant next) {
    value.set(next);
  }

  /**
   * Moves the watermark to {@code next} only if it still holds {@code expected}, the instance
   * previously returned by {@link #current()}.
   */
  public boolean compareAndAdvance(Instant expected, Instant next) {
    return value.compareAndSet(expected, next);
  }
}
