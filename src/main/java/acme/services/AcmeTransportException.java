package acme.services;

import java.net.URI;
import org.springframework.lang.Nullable;

/**
 * Connection, TLS or timeout failure before a response was obtained.
 */
public class AcmeTransportException extends AcmeException {

    public AcmeTransportException(String operation, @Nullable URI url, Throwable cause) {
        super(operation, url, String.valueOf(cause.getMessage()), cause);
    }
}
