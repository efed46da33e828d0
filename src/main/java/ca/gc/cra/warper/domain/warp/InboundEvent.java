package ca.gc.cra.warper.domain.warp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Event received from the subscription. An event without payload is a heartbeat or an empty poll tick.
 *
 * @param payload message payload; expected to contain at least {@code uri}
 * @since WARPER 0.1
 */
public record InboundEvent(Optional<Map<String, Object>> payload) {
  private static final InboundEvent HEARTBEAT = new InboundEvent(Optional.empty());

  public InboundEvent {
    payload = Objects.requireNonNullElse(payload, Optional.<Map<String, Object>>empty())
        .map(map -> Collections.unmodifiableMap(new LinkedHashMap<>(map)));
  }

  /**
   * Returns the payload-less event used for poll ticks.
   *
   * @return heartbeat event
   */
  public static InboundEvent heartbeat() {
    return HEARTBEAT;
  }

  /**
   * Wraps a payload.
   *
   * @param payload event payload; must not be {@code null}
   * @return event carrying the payload
   */
  public static InboundEvent of(Map<String, Object> payload) {
    return new InboundEvent(Optional.of(Objects.requireNonNull(payload, "payload")));
  }

  /**
   * Indicates whether this event carries nothing to process.
   *
   * @return {@code true} for heartbeats and poll ticks
   */
  public boolean isHeartbeat() {
    return payload.isEmpty();
  }
}
