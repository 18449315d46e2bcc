package acme.messages;

import acme.model.Identifier;
import acme.model.Problem;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Order resource, as returned on creation and on finalization.
 *
 * @param status pending, ready, processing, valid, invalid <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">See</a>
 * @param expires
 * @param notBefore
 * @param notAfter
 * @param identifiers
 * @param authorizations
 * @param finalizeUri
 * @param certificate only present once the order is valid
 * @param error
 */
public record OrderResponse(
    String status,
    Instant expires,
    Instant notBefore,
    Instant notAfter,
    List<Identifier> identifiers,
    List<URI> authorizations,
    @JsonProperty("finalize")
    URI finalizeUri,
    URI certificate,
    Problem error
) {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_READY = "ready";
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_VALID = "valid";
    public static final String STATUS_INVALID = "invalid";
}
