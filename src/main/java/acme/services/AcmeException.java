package acme.services;

import java.net.URI;
import lombok.Getter;
import org.springframework.lang.Nullable;

/**
 * Base of every failure reported while talking to an ACME server.
 */
@Getter
public abstract class AcmeException extends RuntimeException {

    /**
     * The protocol step that failed, such as "fetch nonce"
     */
    private final String operation;
    @Nullable
    private final URI url;

    protected AcmeException(String operation, @Nullable URI url, String message, @Nullable Throwable cause) {
        super("Failed to %s%s: %s".formatted(operation, url != null ? " at " + url : "", message), cause);
        this.operation = operation;
        this.url = url;
    }
}
