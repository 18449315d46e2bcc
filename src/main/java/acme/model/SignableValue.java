package acme.model;

import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param jwk account key used to sign
 * @param kid set with the {@link AcmeAccount#kid()} after account creation, otherwise the public jwk is embedded
 * @param nonce
 * @param requestUrl
 * @param value ignored when {@code postAsGet} is set
 * @param postAsGet sign an empty payload, <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.3">RFC 8555 6.3</a>
 */
@Builder
public record SignableValue(
    JWK jwk,
    @Nullable
    String kid,
    String nonce,
    URI requestUrl,
    @Nullable
    Object value,
    boolean postAsGet
) {

    @Override
    public String toString() {
        return "SignableValue[kid=" + kid + ", nonce=" + nonce + ", requestUrl=" + requestUrl
            + ", value=" + value + ", postAsGet=" + postAsGet + "]";
    }
}
