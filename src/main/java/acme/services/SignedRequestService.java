package acme.services;

import acme.model.SignableValue;
import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Sends JWS signed POST requests. The caller supplies the nonce, which is consumed by exactly the one request
 * built from it.
 */
@Slf4j
public class SignedRequestService {

    private final WebClient webClient;
    private final AcmeResponses responses;

    public SignedRequestService(WebClient.Builder webClientBuilder, AcmeResponses responses) {
        webClient = webClientBuilder.clone()
            .filter((request, next) -> {
                log.debug("Starting {} {}", request.method(), request.url());
                return next.exchange(request);
            })
            .build();
        this.responses = responses;
    }

    /**
     * Signs {@code payload} and decodes the JSON response.
     *
     * @param kid null to embed the public key instead, as needed before the account exists
     */
    public <T> Mono<T> requestJson(JWK jwk, @Nullable String kid, String nonce, URI requestUrl, Object payload,
        Class<T> responseClass
    ) {
        return decode(request(jwk, kid, nonce, requestUrl, payload), requestUrl, responseClass);
    }

    /**
     * Signs an empty payload and decodes the JSON response.
     */
    public <T> Mono<T> postAsGetJson(JWK jwk, @Nullable String kid, String nonce, URI requestUrl,
        Class<T> responseClass
    ) {
        return decode(postAsGet(jwk, kid, nonce, requestUrl), requestUrl, responseClass);
    }

    /**
     * Signs {@code payload} and provides the raw response for header and byte extraction.
     */
    public Mono<ResponseEntity<byte[]>> request(JWK jwk, @Nullable String kid, String nonce, URI requestUrl,
        Object payload
    ) {
        Objects.requireNonNull(payload, "payload is required, use postAsGet for an empty payload");
        log.debug("Creating POST for kid={} to url={} payload={}", kid, requestUrl, payload);

        return exchange(signable(jwk, kid, nonce, requestUrl)
            .value(payload)
            .build());
    }

    /**
     * Signs an empty payload and provides the raw response.
     */
    public Mono<ResponseEntity<byte[]>> postAsGet(JWK jwk, @Nullable String kid, String nonce, URI requestUrl) {
        log.debug("Creating POST-as-GET for kid={} to url={}", kid, requestUrl);

        return exchange(signable(jwk, kid, nonce, requestUrl)
            .postAsGet(true)
            .build());
    }

    private static SignableValue.SignableValueBuilder signable(JWK jwk, @Nullable String kid, String nonce,
        URI requestUrl
    ) {
        return SignableValue.builder()
            .jwk(Objects.requireNonNull(jwk, "jwk"))
            .kid(kid)
            .nonce(Objects.requireNonNull(nonce, "nonce"))
            .requestUrl(Objects.requireNonNull(requestUrl, "requestUrl"));
    }

    private Mono<ResponseEntity<byte[]>> exchange(SignableValue signableValue) {
        final URI requestUrl = signableValue.requestUrl();
        final String operation = "send signed request";

        return webClient.post()
            .uri(requestUrl)
            .contentType(JwsMessageWriter.JOSE_JSON)
            .bodyValue(signableValue)
            .retrieve()
            .onStatus(AcmeResponses.notSuccessful(), responses.failedStatus(operation, requestUrl))
            .toEntity(byte[].class)
            .onErrorMap(responses.translate(operation, requestUrl))
            .doOnNext(entity -> log.debug("Response status={} from url={} for kid={}",
                entity.getStatusCode(), requestUrl, signableValue.kid()
            ));
    }

    private <T> Mono<T> decode(Mono<ResponseEntity<byte[]>> response, URI requestUrl, Class<T> responseClass) {
        return response
            .map(entity -> responses.decodeJson(entity.getBody(), responseClass, "decode response", requestUrl))
            .doOnNext(body -> log.trace("Decoded body={} from url={}", body, requestUrl));
    }
}
