package acme.services;

import java.util.Map;

/**
 * Receives diagnostic events from {@link AcmeClient}, such as "order created" with the order status.
 */
@FunctionalInterface
public interface AcmeEventRecorder {

    void record(String event, Map<String, ?> fields);
}
