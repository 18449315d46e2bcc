package acme.services;

import java.io.IOException;
import java.security.KeyPair;
import java.util.List;
import java.util.Objects;
import javax.security.auth.x500.X500Principal;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;

/**
 * Builds the DER encoded CSR expected by {@link AcmeClient#submitCsr}. The certificate key pair is supplied by
 * the caller.
 */
@Slf4j
public class CsrFactory {

    static final String OPERATION = "create CSR";

    /**
     * @param domains the first becomes the subject CN, all of them are listed as subject alternative names
     */
    public byte[] createCsr(KeyPair keyPair, List<String> domains) {
        Objects.requireNonNull(keyPair, "keyPair");
        if (domains == null || domains.isEmpty()) {
            throw new IllegalArgumentException("At least one domain is required for a CSR");
        }
        log.debug("Creating CSR for domains={}", domains);

        final JcaPKCS10CertificationRequestBuilder csrBuilder = new JcaPKCS10CertificationRequestBuilder(
            new X500Principal("CN=" + domains.get(0)), keyPair.getPublic());
        csrBuilder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, createExtensions(domains));

        final PKCS10CertificationRequest csr = csrBuilder.build(createContentSigner(keyPair));
        try {
            return csr.getEncoded();
        } catch (IOException e) {
            throw new AcmeSigningException(OPERATION, null, e);
        }
    }

    private ContentSigner createContentSigner(KeyPair keyPair) {
        final String algorithm = switch (keyPair.getPrivate().getAlgorithm()) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            default -> throw new IllegalArgumentException(
                "Unsupported certificate key algorithm " + keyPair.getPrivate().getAlgorithm());
        };
        try {
            return new JcaContentSignerBuilder(algorithm).build(keyPair.getPrivate());
        } catch (OperatorCreationException e) {
            throw new AcmeSigningException(OPERATION, null, e);
        }
    }

    private Extensions createExtensions(List<String> domains) {
        final ExtensionsGenerator extensionsGenerator = new ExtensionsGenerator();
        try {
            extensionsGenerator.addExtension(Extension.subjectAlternativeName, false, new GeneralNames(
                domains.stream()
                    .map(domain -> new GeneralName(GeneralName.dNSName, domain))
                    .toArray(GeneralName[]::new)
            ));
        } catch (IOException e) {
            throw new AcmeSigningException(OPERATION, null, e);
        }
        return extensionsGenerator.generate();
    }
}
