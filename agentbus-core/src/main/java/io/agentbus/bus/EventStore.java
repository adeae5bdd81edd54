package io.agentbus.bus;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory record of recently seen events, for debugging and replay.
 *
 * <p>Holds at most {@code capacity} events; the oldest insertion is evicted first. Storing an
 * event whose id is already present replaces it in place without changing its position, so a
 * published event that loops back through the transport is kept once.
 *
 * <p>This class is thread-safe.
 */
public final class EventStore {
  private final int capacity;
  private final LinkedHashMap<String, Event> events;

  public EventStore(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.events = new LinkedHashMap<>(Math.min(capacity, 1024) * 2);
  }

  public synchronized void put(Event event) {
    events.put(event.id(), event);
    if (events.size() > capacity) {
      Iterator<Map.Entry<String, Event>> oldest = events.entrySet().iterator();
      oldest.next();
      oldest.remove();
    }
  }

  public synchronized Optional<Event> get(String eventId) {
    return Optional.ofNullable(events.get(eventId));
  }

  public synchronized List<Event> byCorrelation(String correlationId) {
    List<Event> result = new ArrayList<>();
    for (Event event : events.values()) {
      if (event.correlationId().equals(correlationId)) {
        result.add(event);
      }
    }
    return result;
  }

  public synchronized List<Event> byType(String eventType) {
    List<Event> result = new ArrayList<>();
    for (Event event : events.values()) {
      if (event.type().equals(eventType)) {
        result.add(event);
      }
    }
    return result;
  }

  /**
   * Returns up to {@code limit} of the most recently stored events, newest last.
   *
   * @param limit maximum number of events
   * @return recent events in insertion order
   */
  public synchronized List<Event> recent(int limit) {
    List<Event> all = new ArrayList<>(events.values());
    int from = Math.max(0, all.size() - limit);
    return new ArrayList<>(all.subList(from, all.size()));
  }

  public synchronized int size() {
    return events.size();
  }

  public int capacity() {
    return capacity;
  }

  public synchronized void clear() {
    events.clear();
  }
}
