package acme.model;

import java.util.List;

/**
 * Problem document returned by the CA along with an error status.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.7">RFC 8555 6.7</a>
 */
public record Problem(
    String type,
    String detail,
    Integer status,
    List<Subproblem> subproblems
) {

    public static final String BAD_NONCE = "urn:ietf:params:acme:error:badNonce";

}
