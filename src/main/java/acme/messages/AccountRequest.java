package acme.messages;

import java.util.List;
import lombok.Builder;

@Builder
public record AccountRequest(
    List<String> contact,
    boolean termsOfServiceAgreed,
    boolean onlyReturnExisting
) {

    /**
     * Creates the account, or looks up the existing one bound to the same key, without contacts.
     */
    public static AccountRequest agreeingToTerms() {
        return AccountRequest.builder()
            .contact(List.of())
            .termsOfServiceAgreed(true)
            .onlyReturnExisting(false)
            .build();
    }
}
