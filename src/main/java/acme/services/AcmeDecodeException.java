package acme.services;

import java.net.URI;
import org.springframework.lang.Nullable;

/**
 * The response body was not JSON or did not have the expected shape.
 */
public class AcmeDecodeException extends AcmeException {

    public AcmeDecodeException(String operation, @Nullable URI url, String message, @Nullable Throwable cause) {
        super(operation, url, message, cause);
    }
}
