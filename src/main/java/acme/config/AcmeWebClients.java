package acme.config;

import org.springframework.web.reactive.function.client.WebClient;

/**
 * Hands out {@link WebClient.Builder}s for talking to the ACME server. They are configured apart from the
 * application's shared builder, so the connector, User-Agent and JWS codec stay with the ACME services.
 */
public class AcmeWebClients {

    private final WebClient.Builder template;

    public AcmeWebClients(WebClient.Builder template) {
        this.template = template;
    }

    /**
     * @return a fresh copy that the caller may customize further
     */
    public WebClient.Builder builder() {
        return template.clone();
    }
}
