package acme.model;

import lombok.Builder;

@Builder
public record Identifier(
    String type,
    String value
) {

    public static final String TYPE_DNS = "dns";

    public static Identifier dns(String host) {
        return new Identifier(TYPE_DNS, host);
    }
}
