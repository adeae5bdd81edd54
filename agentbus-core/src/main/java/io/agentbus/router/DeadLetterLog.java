package io.agentbus.router;

import io.agentbus.NotFoundException;
import io.agentbus.bus.Event;
import io.agentbus.bus.EventBus;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-memory record of dead-lettered deliveries with query, count and replay.
 *
 * <p>The DLQ channel is the durable hand-off for failed deliveries; this log is the local view
 * used for inspection and manual replay. It keeps at most {@code capacity} entries, evicting
 * the oldest first. Replaying republishes the original event (same type, payload and
 * correlation id, retry count reset) so every route for that type sees it again, and removes
 * the entry.
 *
 * <p>This class is thread-safe.
 */
public final class DeadLetterLog {
  private static final Logger logger = Logger.getLogger(DeadLetterLog.class.getName());

  private final EventBus eventBus;
  private final int capacity;
  private final LinkedHashMap<String, DeadLetter> entries = new LinkedHashMap<>();

  public DeadLetterLog(EventBus eventBus, int capacity) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
  }

  synchronized void record(DeadLetter deadLetter) {
    entries.put(deadLetter.id(), deadLetter);
    if (entries.size() > capacity) {
      Iterator<Map.Entry<String, DeadLetter>> oldest = entries.entrySet().iterator();
      DeadLetter evicted = oldest.next().getValue();
      oldest.remove();
      logger.log(Level.FINE, "Evicted dead letter {0}", evicted.id());
    }
  }

  /**
   * Queries dead letters, oldest first.
   *
   * @param eventType optional original event type filter ({@code null} for all)
   * @param limit     maximum number of entries to return
   * @return matching dead letters
   */
  public synchronized List<DeadLetter> query(String eventType, int limit) {
    List<DeadLetter> result = new ArrayList<>();
    for (DeadLetter deadLetter : entries.values()) {
      if (result.size() >= limit) {
        break;
      }
      if (eventType == null || deadLetter.originalEvent().type().equals(eventType)) {
        result.add(deadLetter);
      }
    }
    return result;
  }

  /**
   * Counts dead letters, optionally filtered by original event type.
   *
   * @param eventType optional original event type filter ({@code null} for all)
   * @return the number of matching entries
   */
  public synchronized int count(String eventType) {
    if (eventType == null) {
      return entries.size();
    }
    int count = 0;
    for (DeadLetter deadLetter : entries.values()) {
      if (deadLetter.originalEvent().type().equals(eventType)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Republishes one dead letter's original event and removes the entry.
   *
   * @param deadLetterId the dead letter id
   * @return the id of the republished event
   * @throws NotFoundException if no such entry exists
   * @throws io.agentbus.ConnectionException if the bus is disconnected; the entry is kept
   */
  public String replay(String deadLetterId) {
    DeadLetter deadLetter;
    synchronized (this) {
      deadLetter = entries.get(deadLetterId);
    }
    if (deadLetter == null) {
      throw new NotFoundException("Dead letter not found: " + deadLetterId);
    }
    Event original = deadLetter.originalEvent();
    Event replayed = Event.builder(original.type())
        .payload(original.payload())
        .source(original.source())
        .correlationId(original.correlationId())
        .metadata(original.metadata().withRetryCount(0))
        .build();
    eventBus.publishEvent(replayed);
    synchronized (this) {
      entries.remove(deadLetterId);
    }
    logger.log(Level.INFO, "Replayed dead letter {0} as event {1}",
        new Object[]{deadLetterId, replayed.id()});
    return replayed.id();
  }

  /**
   * Replays every dead letter matching the filter, oldest first. Stops at the first publish
   * failure, leaving the remaining entries in place.
   *
   * @param eventType optional original event type filter ({@code null} for all)
   * @return number of entries replayed
   */
  public int replayAll(String eventType) {
    int replayed = 0;
    for (DeadLetter deadLetter : query(eventType, Integer.MAX_VALUE)) {
      try {
        replay(deadLetter.id());
        replayed++;
      } catch (NotFoundException e) {
        logger.log(Level.FINE, "Dead letter {0} already replayed", deadLetter.id());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to replay dead letter " + deadLetter.id(), e);
        break;
      }
    }
    return replayed;
  }

  public synchronized void clear() {
    entries.clear();
  }
}
