package acme.services;

import java.net.URI;
import org.springframework.lang.Nullable;

public class AcmeSigningException extends AcmeException {

    public AcmeSigningException(String operation, @Nullable URI url, Throwable cause) {
        super(operation, url, String.valueOf(cause.getMessage()), cause);
    }
}
