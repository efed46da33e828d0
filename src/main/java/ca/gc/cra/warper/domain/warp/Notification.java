package ca.gc.cra.warper.domain.warp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Completion message announced on the publish topic.
 *
 * @param topic destination topic
 * @param type message type, {@value #FILE_TYPE} for reprojected files
 * @param payload inbound payload with {@code uri} replaced and {@code uid} added
 * @since WARPER 0.1
 */
public record Notification(String topic, String type, Map<String, Object> payload) {
  /** Message type used for file announcements. */
  public static final String FILE_TYPE = "file";

  public Notification {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(type, "type");
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(payload, "payload")));
  }

  /**
   * Builds the announcement for a successful result: a copy of the inbound payload whose {@code uri}
   * points at the output and which carries the derived {@code uid}.
   *
   * @param topic destination topic
   * @param result successful work result
   * @return file notification
   * @throws IllegalArgumentException if the result carries no output descriptor
   */
  public static Notification forResult(String topic, WorkResult result) {
    OutputDescriptor output = result.output()
        .orElseThrow(() -> new IllegalArgumentException("result has no output to announce"));
    Map<String, Object> meta = new LinkedHashMap<>(result.item().payload());
    meta.put("uri", output.uri());
    meta.put("uid", output.uid());
    return new Notification(topic, FILE_TYPE, meta);
  }

  /**
   * Returns the announced identifier.
   *
   * @return {@code uid} payload value, or {@code null} when absent
   */
  public String uid() {
    Object uid = payload.get("uid");
    return uid == null ? null : uid.toString();
  }
}
