package acme.config;

import acme.services.AcmeAccountService;
import acme.services.AcmeClientFactory;
import acme.services.AcmeDirectoryService;
import acme.services.AcmeEventRecorder;
import acme.services.AcmeNonceService;
import acme.services.AcmeResponses;
import acme.services.CsrFactory;
import acme.services.LoggingEventRecorder;
import acme.services.SignedRequestService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Provides {@link AcmeClientFactory} and the services behind it. Each bean backs off when the application
 * defines its own.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(AcmeProperties.class)
@Import(WebClientConfig.class)
public class AcmeAutoConfiguration {

    /**
     * Override to route client events elsewhere than the log.
     */
    @Bean
    @ConditionalOnMissingBean
    public AcmeEventRecorder acmeEventRecorder() {
        return new LoggingEventRecorder();
    }

    @Bean
    @ConditionalOnMissingBean
    public AcmeResponses acmeResponses(ObjectMapper objectMapper) {
        return new AcmeResponses(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public AcmeDirectoryService acmeDirectoryService(AcmeWebClients webClients, AcmeResponses responses) {
        return new AcmeDirectoryService(webClients.builder(), responses);
    }

    @Bean
    @ConditionalOnMissingBean
    public AcmeNonceService acmeNonceService(AcmeWebClients webClients, AcmeResponses responses) {
        return new AcmeNonceService(webClients.builder(), responses);
    }

    @Bean
    @ConditionalOnMissingBean
    public SignedRequestService signedRequestService(AcmeWebClients webClients, AcmeResponses responses) {
        return new SignedRequestService(webClients.builder(), responses);
    }

    @Bean
    @ConditionalOnMissingBean
    public AcmeAccountService acmeAccountService(AcmeNonceService nonceService,
        SignedRequestService requestService
    ) {
        return new AcmeAccountService(nonceService, requestService);
    }

    @Bean
    @ConditionalOnMissingBean
    public AcmeClientFactory acmeClientFactory(AcmeDirectoryService directoryService,
        AcmeAccountService accountService,
        AcmeNonceService nonceService,
        SignedRequestService requestService,
        AcmeEventRecorder eventRecorder
    ) {
        return new AcmeClientFactory(directoryService, accountService, nonceService, requestService, eventRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    public CsrFactory csrFactory() {
        return new CsrFactory();
    }
}
