package acme.services;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Writes events at debug level with each field attached as an SLF4J key/value pair.
 */
@Slf4j
public class LoggingEventRecorder implements AcmeEventRecorder {

    @Override
    public void record(String event, Map<String, ?> fields) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final LoggingEventBuilder builder = log.atDebug();
        fields.forEach((key, value) -> builder.addKeyValue(key, (Object) value));
        builder.log("{} {}", event, fields);
    }
}
