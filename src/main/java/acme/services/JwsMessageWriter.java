package acme.services;

import acme.model.SignableValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader.Builder;
import com.nimbusds.jose.JWSObjectJSON;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.EncodingException;
import org.springframework.http.MediaType;
import org.springframework.http.ReactiveHttpOutputMessage;
import org.springframework.http.codec.HttpMessageWriter;
import reactor.core.publisher.Mono;

/**
 * Writes a {@link SignableValue} as a flattened JWS JSON object.
 * Signing failures are reported as {@link EncodingException} so that the exchange does not wrap them as
 * request failures.
 */
@Slf4j
public class JwsMessageWriter implements HttpMessageWriter<SignableValue> {

    public static final MediaType JOSE_JSON = MediaType.parseMediaType("application/jose+json");
    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.5">Replay Protection</a>
     */
    public static final String NONCE_SIGN_HEADER = "nonce";
    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.4">Request URL Integrity</a>
     */
    public static final String URL_SIGN_HEADER = "url";

    private final ObjectMapper objectMapper;

    public JwsMessageWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @NotNull
    @Override
    public List<MediaType> getWritableMediaTypes() {
        return List.of(JOSE_JSON);
    }

    @Override
    public boolean canWrite(ResolvableType elementType, MediaType mediaType) {
        return SignableValue.class.isAssignableFrom(elementType.toClass())
            && JOSE_JSON.equals(mediaType);
    }

    @Override
    public Mono<Void> write(Publisher<? extends SignableValue> inputStream, ResolvableType elementType, MediaType mediaType,
        ReactiveHttpOutputMessage message, Map<String, Object> hints) {

        return Mono.from(inputStream)
            .flatMap(signableValue -> {
                log.trace("Signing and serializing value={}", signableValue.value());
                try {
                    final byte[] body = sign(signableValue).getBytes(StandardCharsets.UTF_8);
                    return message.writeWith(Mono.just(message.bufferFactory().wrap(body)));
                } catch (JsonProcessingException | JOSEException e) {
                    log.warn("Failed to sign/write the value={}", signableValue, e);
                    return Mono.error(new EncodingException("Failed to sign request to " + signableValue.requestUrl(), e));
                }
            });
    }

    String sign(SignableValue signableValue) throws JsonProcessingException, JOSEException {
        final JWSObjectJSON jwsObjectJSON = new JWSObjectJSON(payloadOf(signableValue));

        final JWK jwk = signableValue.jwk();
        final Builder headerBuilder = new Builder(algorithmFor(jwk))
            .customParam(NONCE_SIGN_HEADER, signableValue.nonce())
            .customParam(URL_SIGN_HEADER, signableValue.requestUrl().toString());
        if (signableValue.kid() != null) {
            log.trace("Using kid={} in signing header", signableValue.kid());
            headerBuilder.keyID(signableValue.kid());
        }
        else {
            headerBuilder.jwk(jwk.toPublicJWK());
        }
        jwsObjectJSON.sign(headerBuilder.build(), signerFor(jwk));

        final String serialized = jwsObjectJSON.serializeFlattened();
        log.trace("Serialized to JWS object={}", serialized);
        return serialized;
    }

    private Payload payloadOf(SignableValue signableValue) throws JsonProcessingException, JOSEException {
        if (signableValue.postAsGet()) {
            return new Payload("");
        }
        final Object value = signableValue.value();
        if (value == null) {
            throw new JOSEException("Missing payload for request to " + signableValue.requestUrl());
        }
        return value instanceof String s ?
            new Payload(s)
            : new Payload(objectMapper.writeValueAsBytes(value));
    }

    static JWSAlgorithm algorithmFor(JWK jwk) throws JOSEException {
        if (jwk.getAlgorithm() != null) {
            return JWSAlgorithm.parse(jwk.getAlgorithm().getName());
        }
        if (jwk instanceof RSAKey) {
            return JWSAlgorithm.RS256;
        }
        if (jwk instanceof ECKey ecKey) {
            for (JWSAlgorithm algorithm : JWSAlgorithm.Family.EC) {
                final Set<Curve> curves = Curve.forJWSAlgorithm(algorithm);
                if (curves != null && curves.contains(ecKey.getCurve())) {
                    return algorithm;
                }
            }
            throw new JOSEException("Unsupported account key curve " + ecKey.getCurve());
        }
        throw new JOSEException("Unsupported account key type " + jwk.getKeyType());
    }

    private static JWSSigner signerFor(JWK jwk) throws JOSEException {
        if (jwk instanceof RSAKey rsaKey) {
            return new RSASSASigner(rsaKey);
        }
        if (jwk instanceof ECKey ecKey) {
            return new ECDSASigner(ecKey);
        }
        throw new JOSEException("Unsupported account key type " + jwk.getKeyType());
    }
}
