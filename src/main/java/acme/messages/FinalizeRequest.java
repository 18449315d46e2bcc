package acme.messages;

/**
 * @param csr unpadded base64url encoding of CSR in DER (not PEM) format
 */
public record FinalizeRequest(
    String csr
) {

}
