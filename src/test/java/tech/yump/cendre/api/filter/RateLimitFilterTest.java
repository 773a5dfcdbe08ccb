package tech.yump.cendre.api.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import tech.yump.cendre.MutableClock;
import tech.yump.cendre.audit.AuditHelper;
import tech.yump.cendre.config.CendreProperties;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

    @Mock
    private AuditHelper auditHelper;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        filter = new RateLimitFilter(
                new CendreProperties.RateLimitProperties(true, 3, Duration.ofSeconds(60), null),
                clock, objectMapper, auditHelper);
    }

    private MockHttpServletResponse send(String path, String remoteAddr) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.setRemoteAddr(remoteAddr);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    @DisplayName("Requests up to the limit pass; the next one gets 429")
    void blocksOnceLimitIsExceeded() throws Exception {
        for (int i = 0; i < 3; i++) {
            assertThat(send("/api/secret/x", "10.0.0.1").getStatus()).isEqualTo(200);
        }

        MockHttpServletResponse blocked = send("/api/secret/x", "10.0.0.1");

        assertThat(blocked.getStatus()).isEqualTo(429);
        assertThat(blocked.getContentType()).isEqualTo("application/problem+json");
        assertThat(blocked.getHeader("Retry-After")).isEqualTo("60");
        JsonNode body = objectMapper.readTree(blocked.getContentAsString());
        assertThat(body.get("error").asText()).isEqualTo("too many requests");
        assertThat(body.get("status").asInt()).isEqualTo(429);

        verify(auditHelper).logHttpEvent(any(), eq("rate_limit"), eq("request"), eq("denied"),
                eq(429), eq("too many requests"), eq(null));
    }

    @Test
    void clientsAreCountedSeparately() throws Exception {
        for (int i = 0; i < 3; i++) {
            send("/api/secrets", "10.0.0.1");
        }

        assertThat(send("/api/secrets", "10.0.0.1").getStatus()).isEqualTo(429);
        assertThat(send("/api/secrets", "10.0.0.2").getStatus()).isEqualTo(200);
    }

    @Test
    void counterResetsWhenWindowElapses() throws Exception {
        for (int i = 0; i < 4; i++) {
            send("/api/secrets", "10.0.0.1");
        }
        clock.advance(Duration.ofSeconds(30));
        MockHttpServletResponse stillBlocked = send("/api/secrets", "10.0.0.1");
        assertThat(stillBlocked.getStatus()).isEqualTo(429);
        assertThat(stillBlocked.getHeader("Retry-After")).isEqualTo("30");

        clock.advance(Duration.ofSeconds(30));

        assertThat(send("/api/secrets", "10.0.0.1").getStatus()).isEqualTo(200);
    }

    @Test
    void routesOutsideApiAreNotLimited() throws Exception {
        for (int i = 0; i < 10; i++) {
            assertThat(send("/health", "10.0.0.1").getStatus()).isEqualTo(200);
        }
        verifyNoInteractions(auditHelper);
    }

    @Test
    void disabledFilterLetsEverythingThrough() throws Exception {
        filter = new RateLimitFilter(
                new CendreProperties.RateLimitProperties(false, 1, Duration.ofSeconds(60), null),
                clock, objectMapper, auditHelper);

        for (int i = 0; i < 5; i++) {
            assertThat(send("/api/secrets", "10.0.0.1").getStatus()).isEqualTo(200);
        }
    }

    @Test
    @DisplayName("Counters stay bounded when many distinct clients arrive within one window")
    void trackedClientsStayBounded() throws Exception {
        filter = new RateLimitFilter(
                new CendreProperties.RateLimitProperties(true, 60, Duration.ofSeconds(60), 100),
                clock, objectMapper, auditHelper);

        for (int i = 0; i < 5_000; i++) {
            String address = "10." + (i / 65_536) + "." + ((i / 256) % 256) + "." + (i % 256);
            assertThat(send("/api/secrets", address).getStatus()).isEqualTo(200);
        }

        assertThat(filter.trackedClients()).isLessThanOrEqualTo(100);
    }

    @Test
    void expiredWindowsAreReclaimed() throws Exception {
        for (int i = 0; i < 50; i++) {
            send("/api/secrets", "10.0.1." + i);
        }
        assertThat(filter.trackedClients()).isEqualTo(50);

        clock.advance(Duration.ofSeconds(60));

        assertThat(filter.trackedClients()).isZero();
    }
}
