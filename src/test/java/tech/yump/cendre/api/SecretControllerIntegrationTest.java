package tech.yump.cendre.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import tech.yump.cendre.MutableClock;
import tech.yump.cendre.api.filter.RequestIdFilter;
import tech.yump.cendre.storage.InMemorySecretStore;
import tech.yump.cendre.storage.SecretStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasLength;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecretControllerIntegrationTest {

    private static final Instant START = Instant.parse("2026-05-01T10:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private MutableClock clock;
    @Autowired
    private SecretStore secretStore;

    private String createSecret(String ciphertext, String iv, long ttlSecs) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/secrets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("ciphertext", ciphertext, "iv", iv, "ttl_secs", ttlSecs))))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("id").asText();
    }

    @Test
    void contextUsesInMemoryStore() {
        assertThat(secretStore).isInstanceOf(InMemorySecretStore.class);
    }

    @Nested
    @DisplayName("Create and read")
    class CreateAndRead {

        @Test
        @DisplayName("Created secret is returned once, then 404")
        void createThenReadOnce() throws Exception {
            String expectedExpiry = clock.instant().plusSeconds(300).toString();
            mockMvc.perform(post("/api/secrets")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"ciphertext\":\"Q0lQSEVS\",\"iv\":\"SVY\",\"ttl_secs\":300}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id", hasLength(22)))
                    .andExpect(jsonPath("$.expires_at", is(expectedExpiry)))
                    .andExpect(header().string("Location", startsWith("/api/secret/")))
                    .andExpect(header().string("Cache-Control", containsString("no-store")));

            String id = createSecret("Q0lQSEVS", "SVY", 300);

            mockMvc.perform(get("/api/secret/{id}", id))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                    .andExpect(header().string("Cache-Control", containsString("no-store")))
                    .andExpect(jsonPath("$.ciphertext", is("Q0lQSEVS")))
                    .andExpect(jsonPath("$.iv", is("SVY")));

            mockMvc.perform(get("/api/secret/{id}", id))
                    .andExpect(status().isNotFound())
                    .andExpect(content().string(""));
        }

        @Test
        void unknownIdIsNotFound() throws Exception {
            mockMvc.perform(get("/api/secret/{id}", "AAAAAAAAAAAAAAAAAAAAAA"))
                    .andExpect(status().isNotFound())
                    .andExpect(content().string(""));
            mockMvc.perform(get("/api/secret/{id}", "00000000-0000-0000-0000-000000000000"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Expired secret answers exactly like an unknown one")
        void expiredSecretIsNotFound() throws Exception {
            String id = createSecret("CT", "IV", 60);

            clock.advance(Duration.ofSeconds(60));

            mockMvc.perform(get("/api/secret/{id}", id))
                    .andExpect(status().isNotFound())
                    .andExpect(content().string(""));
        }

        @Test
        void secretsAreIndependent() throws Exception {
            String first = createSecret("ONE", "IV1", 60);
            String second = createSecret("TWO", "IV2", 60);
            assertThat(first).isNotEqualTo(second);

            mockMvc.perform(get("/api/secret/{id}", second))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ciphertext", is("TWO")));
            mockMvc.perform(get("/api/secret/{id}", first))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ciphertext", is("ONE")));
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        private void expectBadRequest(String body) throws Exception {
            mockMvc.perform(post("/api/secrets")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                    .andExpect(jsonPath("$.status", is(400)));
        }

        @Test
        void ttlZeroIsRejected() throws Exception {
            expectBadRequest("{\"ciphertext\":\"CT\",\"iv\":\"IV\",\"ttl_secs\":0}");
        }

        @Test
        void ttlAboveMaximumIsRejected() throws Exception {
            mockMvc.perform(post("/api/secrets")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"ciphertext\":\"CT\",\"iv\":\"IV\",\"ttl_secs\":86401}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail", is("ttl_secs must be between 1 and 86400 seconds")));
        }

        @Test
        void negativeTtlIsRejected() throws Exception {
            expectBadRequest("{\"ciphertext\":\"CT\",\"iv\":\"IV\",\"ttl_secs\":-5}");
        }

        @Test
        void fractionalTtlIsRejected() throws Exception {
            expectBadRequest("{\"ciphertext\":\"CT\",\"iv\":\"IV\",\"ttl_secs\":1.9}");
        }

        @Test
        void missingFieldsAreRejected() throws Exception {
            expectBadRequest("{\"ciphertext\":\"CT\",\"ttl_secs\":60}");
            expectBadRequest("{\"iv\":\"IV\",\"ttl_secs\":60}");
            expectBadRequest("{\"ciphertext\":\"CT\",\"iv\":\"IV\"}");
        }

        @Test
        void blankPayloadIsRejected() throws Exception {
            mockMvc.perform(post("/api/secrets")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"ciphertext\":\"\",\"iv\":\"IV\",\"ttl_secs\":60}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail", containsString("ciphertext must be a non-empty string")));
        }

        @Test
        void malformedJsonIsRejected() throws Exception {
            expectBadRequest("{\"ciphertext\":\"CT\",");
            expectBadRequest("{\"ciphertext\":\"CT\",\"iv\":\"IV\",\"ttl_secs\":\"soon\"}");
        }
    }

    @Nested
    @DisplayName("Response hardening")
    class Hardening {

        @Test
        void securityHeadersAreSet() throws Exception {
            mockMvc.perform(get("/api/secret/{id}", "whatever"))
                    .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                    .andExpect(header().string("X-Frame-Options", "DENY"))
                    .andExpect(header().string("Referrer-Policy", "no-referrer"))
                    .andExpect(header().string("Strict-Transport-Security",
                            "max-age=63072000; includeSubDomains; preload"))
                    .andExpect(header().exists(RequestIdFilter.REQUEST_ID_HEADER));
        }

        @Test
        void healthAnswersOk() throws Exception {
            mockMvc.perform(get("/health"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("ok"))
                    .andExpect(header().string("X-Content-Type-Options", "nosniff"));
        }
    }
}
