package com.flamingo.ai.studyplanner.service.progress;

import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Append-only progress log of one run, fanned out to any number of subscribers.
 *
 * <p>Every subscriber gets its own unicast sink, so a slow reader only grows its own buffer and
 * never holds up the pipeline. Events are delivered to each subscriber in publication order. The
 * first event with {@code done} set closes the log: it completes every subscriber and any later
 * publication is ignored.
 */
@Slf4j
public class ProgressBroadcaster {

  private final String runId;
  private final List<ProgressEvent> history = new CopyOnWriteArrayList<>();
  private final List<Sinks.Many<ProgressEvent>> subscribers = new CopyOnWriteArrayList<>();
  private volatile boolean closed;
  private volatile Instant lastEventAt;

  public ProgressBroadcaster(String runId) {
    this.runId = runId;
  }

  /**
   * Appends an event and forwards it to the current subscribers.
   *
   * @return false when the log is already closed and the event was dropped
   */
  public synchronized boolean publish(ProgressEvent event) {
    if (closed) {
      log.debug("Run {} already finished, dropping event from {}", runId, event.agent());
      return false;
    }
    history.add(event);
    lastEventAt = event.timestamp();
    for (Sinks.Many<ProgressEvent> sink : subscribers) {
      Sinks.EmitResult result = sink.tryEmitNext(event);
      if (result.isFailure()) {
        log.debug("Run {} subscriber did not accept event: {}", runId, result);
      }
    }
    if (event.done()) {
      closed = true;
      subscribers.forEach(Sinks.Many::tryEmitComplete);
      subscribers.clear();
    }
    return true;
  }

  /** Events published from now on. */
  public Flux<ProgressEvent> subscribe() {
    return register(false);
  }

  /**
   * Every event published so far followed by the live ones, with nothing lost or repeated in
   * between.
   */
  public Flux<ProgressEvent> subscribeWithHistory() {
    return register(true);
  }

  private synchronized Flux<ProgressEvent> register(boolean withHistory) {
    Sinks.Many<ProgressEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    if (withHistory) {
      history.forEach(sink::tryEmitNext);
    }
    if (closed) {
      sink.tryEmitComplete();
      return sink.asFlux();
    }
    subscribers.add(sink);
    return sink.asFlux().doFinally(signal -> subscribers.remove(sink));
  }

  public List<ProgressEvent> snapshot() {
    return List.copyOf(history);
  }

  public boolean isClosed() {
    return closed;
  }

  /** Timestamp of the latest event, or null before the first one. */
  public Instant lastEventAt() {
    return lastEventAt;
  }

  public int subscriberCount() {
    return subscribers.size();
  }
}
