package acme.services;

import acme.messages.AuthorizationResponse;
import acme.messages.FinalizeRequest;
import acme.messages.OrderRequest;
import acme.messages.OrderResponse;
import acme.model.AcmeAccount;
import acme.model.AcmeDirectory;
import acme.model.Identifier;
import java.net.URI;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.http.HttpEntity;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * One issuance session against a CA, obtained from {@link AcmeClientFactory#create}. The directory and account
 * are fixed for the life of the client.
 * <p>
 * Every operation is a cold {@link Mono} that fetches its own nonce and then sends exactly one signed request
 * with it, so operations may run concurrently and a failed step can be retried by subscribing again.
 * Nothing is retried internally and the order's progress is not polled.
 */
public class AcmeClient {

    private final AcmeDirectory directory;
    private final AcmeAccount account;
    private final AcmeNonceService nonceService;
    private final SignedRequestService requestService;
    private final AcmeEventRecorder events;

    AcmeClient(AcmeDirectory directory, AcmeAccount account, AcmeNonceService nonceService,
        SignedRequestService requestService, AcmeEventRecorder events
    ) {
        this.directory = directory;
        this.account = account;
        this.nonceService = nonceService;
        this.requestService = requestService;
        this.events = events;
    }

    public AcmeDirectory directory() {
        return directory;
    }

    /**
     * @return the account URL assigned by the CA
     */
    public String kid() {
        return account.kid();
    }

    /**
     * @param domains one DNS identifier is requested per entry, in the given order and including duplicates
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.4">RFC 8555 7.4</a>
     */
    public Mono<OrderResponse> newOrder(List<String> domains) {
        return newOrder(domains, null, null);
    }

    public Mono<OrderResponse> newOrder(List<String> domains, @Nullable Instant notBefore,
        @Nullable Instant notAfter
    ) {
        Objects.requireNonNull(domains, "domains");
        if (domains.isEmpty()) {
            return Mono.error(new IllegalArgumentException("At least one domain is required for an order"));
        }

        final OrderRequest request = OrderRequest.builder()
            .identifiers(domains.stream()
                .map(Identifier::dns)
                .toList())
            .notBefore(notBefore)
            .notAfter(notAfter)
            .build();

        return Mono.defer(() -> {
                events.record("new order request", fields("kid", account.kid(), "domains", domains));
                return nonceService.fetch(directory);
            })
            .flatMap(nonce -> requestService.requestJson(account.key(), account.kid(), nonce, directory.newOrder(),
                request, OrderResponse.class
            ))
            .doOnNext(order -> events.record("order created", fields("status", order.status())));
    }

    public Mono<AuthorizationResponse> fetchAuthorization(URI authorizationUrl) {
        Objects.requireNonNull(authorizationUrl, "authorizationUrl");

        return Mono.defer(() -> {
                events.record("fetch authorization", fields("url", authorizationUrl));
                return nonceService.fetch(directory);
            })
            .flatMap(nonce -> requestService.postAsGetJson(account.key(), account.kid(), nonce, authorizationUrl,
                AuthorizationResponse.class
            ))
            .doOnNext(authz -> events.record("authorization response",
                fields("identifier", authz.identifier(), "status", authz.status())
            ));
    }

    /**
     * Tells the CA that the challenge response is in place and validation may begin.
     *
     * @param domain only used for diagnostics
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.5.1">RFC 8555 7.5.1</a>
     */
    public Mono<Void> triggerChallenge(String domain, URI challengeUrl) {
        Objects.requireNonNull(challengeUrl, "challengeUrl");

        return Mono.defer(() -> {
                events.record("trigger challenge", fields("url", challengeUrl, "domain", domain));
                return nonceService.fetch(directory);
            })
            .flatMap(nonce -> requestService.request(account.key(), account.kid(), nonce, challengeUrl, Map.of()))
            .then();
    }

    /**
     * @param csr DER encoded certificate signing request
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.4">RFC 8555 7.4</a>
     */
    public Mono<OrderResponse> submitCsr(URI finalizeUrl, byte[] csr) {
        Objects.requireNonNull(finalizeUrl, "finalizeUrl");
        final FinalizeRequest request = new FinalizeRequest(encodeCsr(Objects.requireNonNull(csr, "csr")));

        return Mono.defer(() -> {
                events.record("send certificate request", fields("url", finalizeUrl));
                return nonceService.fetch(directory);
            })
            .flatMap(nonce -> requestService.requestJson(account.key(), account.kid(), nonce, finalizeUrl,
                request, OrderResponse.class
            ))
            .doOnNext(order -> events.record("order finalized", fields("status", order.status())));
    }

    /**
     * @return the certificate chain exactly as served, normally PEM
     */
    public Mono<byte[]> downloadCertificate(URI certificateUrl) {
        Objects.requireNonNull(certificateUrl, "certificateUrl");

        return Mono.defer(() -> {
                events.record("download certificate", fields("url", certificateUrl));
                return nonceService.fetch(directory);
            })
            .flatMap(nonce -> requestService.postAsGet(account.key(), account.kid(), nonce, certificateUrl))
            .mapNotNull(HttpEntity::getBody)
            .defaultIfEmpty(new byte[0])
            .doOnNext(chain -> events.record("certificate downloaded", fields("bytes", chain.length)));
    }

    /**
     * @return the content a challenge responder serves for {@code token}
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.1">RFC 8555 8.1</a>
     */
    public String keyAuthorization(String token) {
        return AcmeAccountService.buildKeyAuthorization(account.key(), token);
    }

    static String encodeCsr(byte[] csr) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(csr);
    }

    private static Map<String, Object> fields(Object... keysAndValues) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            fields.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return fields;
    }
}
