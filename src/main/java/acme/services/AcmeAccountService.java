package acme.services;

import acme.messages.AccountRequest;
import acme.model.AcmeAccount;
import acme.model.AcmeDirectory;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;

@Slf4j
public class AcmeAccountService {

    static final String OPERATION = "register account";

    private final AcmeNonceService nonceService;
    private final SignedRequestService requestService;

    public AcmeAccountService(
        AcmeNonceService nonceService,
        SignedRequestService requestService
    ) {
        this.nonceService = nonceService;
        this.requestService = requestService;
    }

    /**
     * Creates the account bound to {@code accountKey}, or locates it if the server already knows the key.
     *
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.3">RFC 8555 7.3</a>
     */
    public Mono<AcmeAccount> register(AcmeDirectory directory, JWK accountKey) {
        final URI newAccountUrl = directory.newAccount();
        log.debug("Registering account at url={}", newAccountUrl);

        return nonceService.fetch(directory)
            .flatMap(nonce -> requestService.request(accountKey, null, nonce, newAccountUrl,
                AccountRequest.agreeingToTerms()
            ))
            .map(entity -> {
                final String kid = entity.getHeaders().getFirst(HttpHeaders.LOCATION);
                if (kid == null || kid.isBlank()) {
                    throw AcmeProtocolException.missingHeader(OPERATION, newAccountUrl, entity.getStatusCode(),
                        HttpHeaders.LOCATION
                    );
                }
                return AcmeAccount.builder()
                    .kid(kid)
                    .key(accountKey)
                    .build();
            })
            .doOnNext(account -> log.debug("Registered account kid={}", account.kid()));
    }

    /**
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.1">RFC 8555 8.1</a>
     */
    public static String buildKeyAuthorization(JWK accountKey, String token) {
        try {
            return token + "." + accountKey.computeThumbprint();
        } catch (JOSEException e) {
            throw new AcmeSigningException("compute key authorization", null, e);
        }
    }
}
