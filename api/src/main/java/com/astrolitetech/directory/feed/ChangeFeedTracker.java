package com.astrolitetech.directory.feed;

import com.astrolitetech.directory.model.UserView;
import com.astrolitetech.directory.repository.UserFeedRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Answers "which users registered since the last poll" from one process-wide watermark. */
@Slf4j
public class ChangeFeedTracker {

  private final UserFeedRepository userFeedRepository;
  private final ChangeFeedWatermark watermark;
  private final Clock clock;
  private final FeedMode mode;
  private final Object pollLock = new Object();

  public ChangeFeedTracker(
      UserFeedRepository userFeedRepository,
      ChangeFeedWatermark watermark,
      Clock clock,
      FeedMode mode) {
    this.userFeedRepository = userFeedRepository;
    this.watermark = watermark;
    this.clock = clock;
    this.mode = mode;
    log.info("New-users feed running in {} mode from {}", mode, watermark.current());
  }

  /** Users created after the watermark. Advances the watermark; a failed read leaves it alone. */
  public List<UserView> pollNewUsers() {
    return mode == FeedMode.ATOMIC ? pollAtomically() : pollShared();
  }

  public List<UserView> listAllUsers() {
    return userFeedRepository.findAllNewestFirst();
  }

  public FeedMode getMode() {
    return mode;
  }

  private List<UserView> pollShared() {
    Instant since = watermark.current();
    List<UserView> users = userFeedRepository.findCreatedAfter(since);
    Instant next = Instant.now(clock);
    watermark.advanceTo(next);
    log.debug("Polled {} new user(s) after {}, watermark now {}", users.size(), since, next);
    return users;
  }

  private List<UserView> pollAtomically() {
    synchronized (pollLock) {
      Instant since = watermark.current();
      Instant now = Instant.now(clock);
      Instant upTo = now.isBefore(since) ? since : now;
      List<UserView> users = userFeedRepository.findCreatedBetween(since, upTo);
      if (!watermark.compareAndAdvance(since, upTo)) {
        log.warn("Watermark moved outside the feed while polling ({} .. {}]", since, upTo);
      }
      log.debug("Polled {} new user(s) in ({} .. {}]", users.size(), since, upTo);
      return users;
    }
  }
}
