package acme.services;

import acme.config.WebClientConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.lang.Nullable;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Stands in for an ACME server at the exchange level. Request bodies are written with the same codecs as the
 * real client, so signed requests arrive as actual JWS objects.
 */
class StubAcmeServer implements ExchangeFunction {

    static final URI DIRECTORY_URL = URI.create("https://ca/acme/directory");
    static final URI NEW_NONCE_URL = URI.create("https://ca/acme/new-nonce");
    static final URI NEW_ACCOUNT_URL = URI.create("https://ca/acme/new-account");
    static final URI NEW_ORDER_URL = URI.create("https://ca/acme/new-order");
    static final String ACCOUNT_URL = "https://ca/acme/acct/1";

    static final String DIRECTORY_JSON = """
        {"newNonce":"https://ca/acme/new-nonce","newAccount":"https://ca/acme/new-account","newOrder":"https://ca/acme/new-order"}
        """;

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final ExchangeStrategies strategies = ExchangeStrategies.builder()
        .codecs(WebClientConfig.jwsCodecs(objectMapper))
        .build();
    private final Map<String, Function<RecordedRequest, Mono<ClientResponse>>> handlers = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger nonceCounter = new AtomicInteger();

    StubAcmeServer() {
        on(HttpMethod.GET, DIRECTORY_URL, request -> json(HttpStatus.OK, DIRECTORY_JSON));
        on(HttpMethod.GET, NEW_NONCE_URL, request -> respond(HttpStatus.OK,
            Map.of(AcmeNonceService.NONCE_HEADER, "nonce-" + nonceCounter.incrementAndGet()), null
        ));
        on(HttpMethod.POST, NEW_ACCOUNT_URL, request -> respond(HttpStatus.CREATED,
            Map.of(HttpHeaders.LOCATION, ACCOUNT_URL, HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE),
            "{\"status\":\"valid\",\"contact\":[]}".getBytes(StandardCharsets.UTF_8)
        ));
    }

    StubAcmeServer on(HttpMethod method, URI url, Function<RecordedRequest, Mono<ClientResponse>> handler) {
        handlers.put(key(method, url), handler);
        return this;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        final MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
        return request.writeTo(mockRequest, strategies)
            .then(Mono.defer(() -> mockRequest.getBodyAsString().defaultIfEmpty("")))
            .flatMap(body -> {
                final RecordedRequest recorded = new RecordedRequest(request.method(), request.url(),
                    mockRequest.getHeaders(), body
                );
                requests.add(recorded);
                final Function<RecordedRequest, Mono<ClientResponse>> handler =
                    handlers.get(key(request.method(), request.url()));
                return handler != null ? handler.apply(recorded) : respond(HttpStatus.NOT_FOUND, Map.of(), null);
            });
    }

    WebClient.Builder webClientBuilder() {
        return WebClient.builder().exchangeFunction(this);
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    List<RecordedRequest> requestsTo(URI url) {
        return requests.stream()
            .filter(request -> request.url().equals(url))
            .toList();
    }

    List<RecordedRequest> signedRequests() {
        return requests.stream()
            .filter(request -> request.method() == HttpMethod.POST)
            .toList();
    }

    int noncesIssued() {
        return nonceCounter.get();
    }

    void clearRequests() {
        requests.clear();
    }

    AcmeResponses responses() {
        return new AcmeResponses(objectMapper);
    }

    AcmeDirectoryService directoryService() {
        return new AcmeDirectoryService(webClientBuilder(), responses());
    }

    AcmeNonceService nonceService() {
        return new AcmeNonceService(webClientBuilder(), responses());
    }

    SignedRequestService requestService() {
        return new SignedRequestService(webClientBuilder(), responses());
    }

    AcmeAccountService accountService() {
        return new AcmeAccountService(nonceService(), requestService());
    }

    AcmeClientFactory clientFactory(AcmeEventRecorder eventRecorder) {
        return new AcmeClientFactory(directoryService(), accountService(), nonceService(), requestService(),
            eventRecorder
        );
    }

    Mono<ClientResponse> respond(HttpStatus status, Map<String, String> headers, @Nullable byte[] body) {
        final ClientResponse.Builder builder = ClientResponse.create(status, strategies);
        headers.forEach((name, value) -> builder.header(name, value));
        if (body != null) {
            builder.body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)));
        }
        return Mono.just(builder.build());
    }

    Mono<ClientResponse> json(HttpStatus status, String json) {
        return json(status, json, Map.of());
    }

    Mono<ClientResponse> json(HttpStatus status, String json, Map<String, String> headers) {
        final Map<String, String> withContentType = new HashMap<>(headers);
        withContentType.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return respond(status, withContentType, json.getBytes(StandardCharsets.UTF_8));
    }

    Mono<ClientResponse> problem(HttpStatus status, String type, String detail) {
        return respond(status, Map.of(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_PROBLEM_JSON_VALUE),
            """
                {"type":"%s","detail":"%s","status":%d}
                """.formatted(type, detail, status.value()).getBytes(StandardCharsets.UTF_8)
        );
    }

    Mono<ClientResponse> connectionRefused(RecordedRequest request) {
        return Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
            request.method(), request.url(), new HttpHeaders()
        ));
    }

    private static String key(HttpMethod method, URI url) {
        return method.name() + " " + url;
    }
}
