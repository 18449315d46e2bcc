package acme.services;

import acme.model.Problem;
import java.net.URI;
import java.util.Objects;
import lombok.Getter;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.Nullable;

/**
 * The server answered, but not as the protocol requires: either a non-success status, usually with a
 * {@link Problem} document, or a response missing an expected header.
 */
@Getter
public class AcmeProtocolException extends AcmeException {

    @Nullable
    private final HttpStatusCode status;
    @Nullable
    private final Problem problem;

    public AcmeProtocolException(String operation, URI url, @Nullable HttpStatusCode status, @Nullable Problem problem,
        String message
    ) {
        super(operation, url, message, null);
        this.status = status;
        this.problem = problem;
    }

    public static AcmeProtocolException failedStatus(String operation, URI url, HttpStatusCode status,
        @Nullable Problem problem
    ) {
        return new AcmeProtocolException(operation, url, status, problem,
            problem != null ?
                "status=%s type=%s detail=%s".formatted(status.value(), problem.type(), problem.detail())
                : "status=" + status.value()
        );
    }

    /**
     * For error responses whose body is not a problem document.
     *
     * @param bodyExcerpt the start of the body as text
     */
    public static AcmeProtocolException failedStatusWithBody(String operation, URI url, HttpStatusCode status,
        String bodyExcerpt
    ) {
        return new AcmeProtocolException(operation, url, status, null,
            "status=%s body=%s".formatted(status.value(), bodyExcerpt)
        );
    }

    public static AcmeProtocolException missingHeader(String operation, URI url, HttpStatusCode status, String header) {
        return new AcmeProtocolException(operation, url, status, null,
            "response with status=%s is missing header %s".formatted(status.value(), header)
        );
    }

    /**
     * The server rejected the request's nonce. Repeating the whole step draws a fresh one.
     */
    public boolean isBadNonce() {
        return problem != null && Objects.equals(problem.type(), Problem.BAD_NONCE);
    }
}
