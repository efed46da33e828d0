/**
 * Kafka adapters for inbound file events and outbound completion notifications.
 * <p>Both directions carry UTF-8 JSON object payloads encoded with Jackson's streaming API.</p>
 *
 * @since WARPER 0.1
 */
package ca.gc.cra.warper.adapter.kafka;
