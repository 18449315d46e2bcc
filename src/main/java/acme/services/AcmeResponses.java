package acme.services;

import acme.model.Problem;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.core.codec.EncodingException;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Decodes response bodies and maps transport level errors onto {@link AcmeException} subtypes, so that every
 * protocol step reports failures the same way.
 */
@Slf4j
public class AcmeResponses {

    static final int MAX_BODY_EXCERPT = 512;

    private final ObjectMapper objectMapper;

    public AcmeResponses(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static Predicate<HttpStatusCode> notSuccessful() {
        return status -> !status.is2xxSuccessful();
    }

    /**
     * @throws AcmeDecodeException if the body is empty, not JSON, or not of the given type
     */
    public <T> T decodeJson(@Nullable byte[] body, Class<T> type, String operation, URI url) {
        if (body == null || body.length == 0) {
            throw new AcmeDecodeException(operation, url, "response body was empty", null);
        }
        try {
            final T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new AcmeDecodeException(operation, url, "response body was JSON null", null);
            }
            return value;
        } catch (IOException e) {
            throw new AcmeDecodeException(operation, url,
                "response body is not a valid " + type.getSimpleName() + ": " + e.getMessage(), e
            );
        }
    }

    /**
     * For use with {@code retrieve().onStatus(notSuccessful(), ...)}
     */
    public Function<ClientResponse, Mono<? extends Throwable>> failedStatus(String operation, URI url) {
        return clientResponse -> clientResponse.bodyToMono(byte[].class)
            .map(body -> errorFor(operation, url, clientResponse.statusCode(), body))
            .defaultIfEmpty(AcmeProtocolException.failedStatus(operation, url, clientResponse.statusCode(), null))
            .doOnNext(e -> log.warn("Failed response from url={} during operation={}: {}", url, operation,
                e.getMessage()
            ));
    }

    /**
     * Uses the body as a {@link Problem} when it is one, otherwise keeps an excerpt of it in the message.
     */
    AcmeProtocolException errorFor(String operation, URI url, HttpStatusCode status, @Nullable byte[] body) {
        if (body == null || body.length == 0) {
            return AcmeProtocolException.failedStatus(operation, url, status, null);
        }
        final Problem problem = parseProblem(body, url);
        if (problem != null) {
            return AcmeProtocolException.failedStatus(operation, url, status, problem);
        }
        final String text = new String(body, StandardCharsets.UTF_8).strip();
        if (text.isEmpty()) {
            return AcmeProtocolException.failedStatus(operation, url, status, null);
        }
        return AcmeProtocolException.failedStatusWithBody(operation, url, status,
            text.length() > MAX_BODY_EXCERPT ? text.substring(0, MAX_BODY_EXCERPT) + "..." : text
        );
    }

    @Nullable
    private Problem parseProblem(byte[] body, URI url) {
        try {
            final Problem problem = objectMapper.readValue(body, Problem.class);
            // any JSON object binds, only a type makes it a problem document
            return problem != null && problem.type() != null ? problem : null;
        } catch (IOException e) {
            log.debug("Error response from url={} did not carry a problem document", url, e);
            return null;
        }
    }

    /**
     * For use with {@code onErrorMap} at the end of each request pipeline.
     */
    public Function<Throwable, Throwable> translate(String operation, URI url) {
        return throwable -> {
            if (throwable instanceof AcmeException) {
                return throwable;
            } else if (throwable instanceof EncodingException e) {
                return new AcmeSigningException(operation, url, e.getCause() != null ? e.getCause() : e);
            } else if (throwable instanceof DecodingException e) {
                return new AcmeDecodeException(operation, url, String.valueOf(e.getMessage()), e);
            } else if (throwable instanceof WebClientRequestException e) {
                return new AcmeTransportException(operation, url, e.getCause() != null ? e.getCause() : e);
            } else if (throwable instanceof WebClientResponseException e) {
                return errorFor(operation, url, e.getStatusCode(), e.getResponseBodyAsByteArray());
            }
            return throwable;
        };
    }
}
