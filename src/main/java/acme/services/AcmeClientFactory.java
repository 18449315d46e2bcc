package acme.services;

import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Slf4j
public class AcmeClientFactory {

    private final AcmeDirectoryService directoryService;
    private final AcmeAccountService accountService;
    private final AcmeNonceService nonceService;
    private final SignedRequestService requestService;
    private final AcmeEventRecorder eventRecorder;

    public AcmeClientFactory(AcmeDirectoryService directoryService,
        AcmeAccountService accountService,
        AcmeNonceService nonceService,
        SignedRequestService requestService,
        AcmeEventRecorder eventRecorder
    ) {
        this.directoryService = directoryService;
        this.accountService = accountService;
        this.nonceService = nonceService;
        this.requestService = requestService;
        this.eventRecorder = eventRecorder;
    }

    /**
     * Loads the directory and registers, or looks up, the account for {@code accountKey}.
     * No client is emitted if either step fails.
     *
     * @param accountKey must include the private key
     */
    public Mono<AcmeClient> create(URI directoryUrl, JWK accountKey) {
        Objects.requireNonNull(directoryUrl, "directoryUrl");
        Objects.requireNonNull(accountKey, "accountKey");
        if (!accountKey.isPrivate()) {
            return Mono.error(new IllegalArgumentException("Account key must include the private key"));
        }

        return directoryService.fetch(directoryUrl)
            .flatMap(directory -> accountService.register(directory, accountKey)
                .map(account -> new AcmeClient(directory, account, nonceService, requestService, eventRecorder))
            )
            .doOnNext(client -> log.debug("Created client for directory={} with kid={}", directoryUrl, client.kid()))
            .doOnError(throwable -> log.warn("Unable to create client for directory={}", directoryUrl, throwable));
    }
}
