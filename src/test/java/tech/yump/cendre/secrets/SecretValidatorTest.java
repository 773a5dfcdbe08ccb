package tech.yump.cendre.secrets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tech.yump.cendre.config.CendreProperties;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretValidatorTest {

    private final SecretValidator validator = new SecretValidator(new CendreProperties(
            new CendreProperties.SecretsProperties(1L, 86_400L, 64, 16), null, null, null));

    @Nested
    @DisplayName("TTL bounds")
    class Ttl {

        @ParameterizedTest
        @ValueSource(longs = {1, 300, 86_400})
        void acceptsTtlWithinBounds(long ttl) {
            assertThatCode(() -> validator.validateTtl(ttl)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(longs = {Long.MIN_VALUE, -1, 0, 86_401})
        void rejectsTtlOutsideBounds(long ttl) {
            assertThatThrownBy(() -> validator.validateTtl(ttl))
                    .isInstanceOf(InvalidSecretException.class)
                    .hasMessage("ttl_secs must be between 1 and 86400 seconds");
        }
    }

    @Nested
    @DisplayName("Payload")
    class Payload {

        @Test
        void acceptsOpaqueStrings() {
            assertThatCode(() -> validator.validatePayload("not even base64 !!", "x")).doesNotThrowAnyException();
        }

        @Test
        void rejectsBlankFields() {
            assertThatThrownBy(() -> validator.validatePayload("", "iv"))
                    .isInstanceOf(InvalidSecretException.class)
                    .hasMessage("ciphertext and iv must be non-empty strings");
            assertThatThrownBy(() -> validator.validatePayload("ct", "   "))
                    .isInstanceOf(InvalidSecretException.class);
            assertThatThrownBy(() -> validator.validatePayload(null, "iv"))
                    .isInstanceOf(InvalidSecretException.class);
        }

        @Test
        void rejectsOversizedFields() {
            assertThatThrownBy(() -> validator.validatePayload("c".repeat(65), "iv"))
                    .isInstanceOf(InvalidSecretException.class)
                    .hasMessageContaining("64");
            assertThatThrownBy(() -> validator.validatePayload("ct", "i".repeat(17)))
                    .isInstanceOf(InvalidSecretException.class)
                    .hasMessageContaining("16");
        }
    }

    @Test
    @DisplayName("Generated ids are 22 url-safe characters and do not repeat")
    void generatesUrlSafeUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            String id = validator.generateId();
            assertThat(id).hasSize(22).matches("[A-Za-z0-9_-]+");
            ids.add(id);
        }
        assertThat(ids).hasSize(1_000);
    }
}
