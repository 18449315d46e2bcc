package acme.model;

import com.nimbusds.jose.jwk.JWK;
import lombok.Builder;

/**
 * @param kid the account URL issued by the CA, used as the key ID of every later signed request
 * @param key account key with private material, shared and never modified
 */
@Builder
public record AcmeAccount(
    String kid,
    JWK key
) {

    @Override
    public String toString() {
        // keep private key material out of logs
        return "AcmeAccount[kid=" + kid + "]";
    }
}
