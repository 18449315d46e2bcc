package acme.messages;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class AccountRequestTest {

    @Autowired
    private JacksonTester<AccountRequest> json;

    @Test
    void agreesToTermsWithoutContacts() throws IOException {
        assertThat(json.write(AccountRequest.agreeingToTerms()))
            .isEqualToJson("""
                {"onlyReturnExisting": false, "termsOfServiceAgreed": true, "contact": []}
                """, JSONCompareMode.STRICT);
    }
}
