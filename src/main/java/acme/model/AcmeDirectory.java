package acme.model;

import java.net.URI;
import java.util.List;
import org.springframework.lang.Nullable;

/**
 * Endpoints published by the CA's directory resource.
 *
 * @param newNonce
 * @param newAccount
 * @param newOrder
 * @param newAuthz used for pre-authorization, not offered by every CA
 * @param revokeCert
 * @param keyChange
 * @param meta
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.1">RFC 8555 7.1.1</a>
 */
public record AcmeDirectory(
    URI newNonce,
    URI newAccount,
    URI newOrder,
    @Nullable
    URI newAuthz,
    @Nullable
    URI revokeCert,
    @Nullable
    URI keyChange,
    @Nullable
    Meta meta
) {

    public record Meta(
        URI termsOfService,
        URI website,
        List<String> caaIdentities,
        boolean externalAccountRequired
    ) {

    }
}
