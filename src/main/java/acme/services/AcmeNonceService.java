package acme.services;

import acme.model.AcmeDirectory;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Draws a fresh nonce for each signed request. Nonces returned by other responses are deliberately not
 * reused, so every subscription performs its own round trip.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.2">RFC 8555 7.2</a>
 */
@Slf4j
public class AcmeNonceService {

    public static final String NONCE_HEADER = "Replay-Nonce";
    static final String OPERATION = "fetch nonce";

    private final WebClient webClient;
    private final AcmeResponses responses;

    public AcmeNonceService(WebClient.Builder webClientBuilder, AcmeResponses responses) {
        webClient = webClientBuilder.build();
        this.responses = responses;
    }

    /**
     * @return the {@value #NONCE_HEADER} value, or an empty string if the server didn't send one.
     * The server is then expected to reject the signed request that uses it with a badNonce problem.
     */
    public Mono<String> fetch(AcmeDirectory directory) {
        final URI newNonceUrl = directory.newNonce();
        log.debug("Fetching nonce from url={}", newNonceUrl);

        return webClient.get()
            .uri(newNonceUrl)
            .retrieve()
            .onStatus(AcmeResponses.notSuccessful(), responses.failedStatus(OPERATION, newNonceUrl))
            .toBodilessEntity()
            .map(entity -> {
                final String nonce = entity.getHeaders().getFirst(NONCE_HEADER);
                if (nonce == null) {
                    log.warn("Response from url={} is missing {} header, using an empty nonce", newNonceUrl,
                        NONCE_HEADER
                    );
                    return "";
                }
                return nonce;
            })
            .onErrorMap(responses.translate(OPERATION, newNonceUrl))
            .doOnNext(nonce -> log.trace("Fetched nonce={}", nonce));
    }
}
