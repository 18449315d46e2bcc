package acme.services;

import acme.model.AcmeDirectory;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
public class AcmeDirectoryService {

    static final String OPERATION = "load directory";

    private final WebClient webClient;
    private final AcmeResponses responses;

    public AcmeDirectoryService(WebClient.Builder webClientBuilder, AcmeResponses responses) {
        webClient = webClientBuilder.build();
        this.responses = responses;
    }

    /**
     * @return the directory, or an {@link AcmeException} when it can't be retrieved or lacks a required endpoint
     */
    public Mono<AcmeDirectory> fetch(URI directoryUrl) {
        log.debug("Loading directory from url={}", directoryUrl);
        return webClient
            .get()
            .uri(directoryUrl)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(AcmeResponses.notSuccessful(), responses.failedStatus(OPERATION, directoryUrl))
            .toEntity(byte[].class)
            .map(entity -> validate(directoryUrl,
                responses.decodeJson(entity.getBody(), AcmeDirectory.class, OPERATION, directoryUrl)
            ))
            .onErrorMap(responses.translate(OPERATION, directoryUrl))
            .doOnNext(directory -> log.debug("Loaded directory newNonce={} newAccount={} newOrder={}",
                directory.newNonce(), directory.newAccount(), directory.newOrder()
            ));
    }

    private static AcmeDirectory validate(URI directoryUrl, AcmeDirectory directory) {
        requireEndpoint(directoryUrl, "newNonce", directory.newNonce());
        requireEndpoint(directoryUrl, "newAccount", directory.newAccount());
        requireEndpoint(directoryUrl, "newOrder", directory.newOrder());
        return directory;
    }

    private static void requireEndpoint(URI directoryUrl, String name, URI endpoint) {
        if (endpoint == null) {
            throw new AcmeDecodeException(OPERATION, directoryUrl, "directory is missing the " + name + " endpoint", null);
        }
    }
}
