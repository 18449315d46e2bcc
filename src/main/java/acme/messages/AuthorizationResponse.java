package acme.messages;

import acme.model.Challenge;
import acme.model.Identifier;
import java.time.Instant;
import java.util.List;

/**
 *
 * @param status pending, valid, invalid, revoked, deactivated, expired <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">See</a>
 * @param expires
 * @param identifier
 * @param challenges
 * @param wildcard
 */
public record AuthorizationResponse(
    String status,
    Instant expires,
    Identifier identifier,
    List<Challenge> challenges,
    boolean wildcard
) {

}
