package acme.config;

import acme.services.JwsMessageWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import java.util.function.Consumer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ClientCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration(proxyBeanMethods = false)
public class WebClientConfig {

    private final ObjectMapper objectMapper;
    private final AcmeProperties acmeProperties;

    public WebClientConfig(ObjectMapper objectMapper,
        AcmeProperties acmeProperties
    ) {
        this.objectMapper = objectMapper;
        this.acmeProperties = acmeProperties;
    }

    /**
     * Built from {@link WebClient#builder()} rather than the application's builder, which is left untouched.
     */
    @Bean
    @ConditionalOnMissingBean
    public AcmeWebClients acmeWebClients() {
        return new AcmeWebClients(
            WebClient.builder()
                .clientConnector(
                    new ReactorClientHttpConnector(
                        HttpClient.create()
                            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                                Math.toIntExact(acmeProperties.connectTimeout().toMillis())
                            )
                            .responseTimeout(acmeProperties.responseTimeout())
                    )
                )
                .defaultHeader(HttpHeaders.USER_AGENT, acmeProperties.userAgent())
                .codecs(clientCodecConfigurer -> {
                    clientCodecConfigurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                    clientCodecConfigurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                })
                .codecs(jwsCodecs(objectMapper))
        );
    }

    /**
     * Registers the {@link JwsMessageWriter} that signs request bodies.
     */
    public static Consumer<ClientCodecConfigurer> jwsCodecs(ObjectMapper objectMapper) {
        return clientCodecConfigurer -> clientCodecConfigurer.customCodecs().register(
            new JwsMessageWriter(objectMapper)
        );
    }
}
