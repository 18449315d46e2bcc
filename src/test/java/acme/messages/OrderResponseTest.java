package acme.messages;

import static org.assertj.core.api.Assertions.assertThat;

import acme.model.Identifier;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class OrderResponseTest {

    @Autowired
    private JacksonTester<OrderResponse> json;

    @Test
    void parsesInvalidOrderWithError() throws IOException {
        final OrderResponse order = json.parseObject("""
            {
              "status": "invalid",
              "expires": "2026-10-25T14:09:07.99Z",
              "identifiers": [{"type": "dns", "value": "example.com"}],
              "authorizations": ["https://ca/acme/authz/a1"],
              "finalize": "https://ca/acme/order/o1/finalize",
              "error": {
                "type": "urn:ietf:params:acme:error:unauthorized",
                "detail": "Authorization failed",
                "subproblems": [
                  {
                    "type": "urn:ietf:params:acme:error:dns",
                    "detail": "No TXT record found",
                    "identifier": {"type": "dns", "value": "example.com"}
                  }
                ]
              }
            }
            """);

        assertThat(order.status()).isEqualTo(OrderResponse.STATUS_INVALID);
        assertThat(order.expires()).isEqualTo(Instant.parse("2026-10-25T14:09:07.99Z"));
        assertThat(order.finalizeUri()).isEqualTo(URI.create("https://ca/acme/order/o1/finalize"));
        assertThat(order.error().type()).isEqualTo("urn:ietf:params:acme:error:unauthorized");
        assertThat(order.error().subproblems()).singleElement()
            .satisfies(subproblem -> assertThat(subproblem.identifier()).isEqualTo(Identifier.dns("example.com")));
    }
}
