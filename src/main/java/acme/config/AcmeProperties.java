package acme.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param responseTimeout allowed response time when communicating with the ACME server
 * @param connectTimeout  allowed time to establish a connection to the ACME server
 * @param userAgent       sent with every request as required by
 *                        <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.1">RFC 8555 Sec 6.1</a>
 */
@ConfigurationProperties("acme")
@Validated
public record AcmeProperties(
    @DefaultValue("10s") @NotNull
    Duration responseTimeout,

    @DefaultValue("5s") @NotNull
    Duration connectTimeout,

    @DefaultValue("acme-orchestrator") @NotBlank
    String userAgent
) {

}
