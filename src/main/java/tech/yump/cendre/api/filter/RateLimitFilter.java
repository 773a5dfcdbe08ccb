package tech.yump.cendre.api.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.cendre.audit.AuditHelper;
import tech.yump.cendre.config.CendreProperties;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-window request limit per client address on the {@code /api/} routes.
 * Requests over the limit get a 429 problem response with {@code "error": "too many requests"}.
 * <p>
 * This is a first line of defence against id guessing and flooding, not a distributed limiter: counters live
 * in this process only. Each client's window starts with its first request and its counter expires with the
 * window. At most {@code max-tracked-clients} counters are kept; beyond that the least useful are evicted,
 * which resets those clients early.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

  public static final String ERROR_MESSAGE = "too many requests";
  static final String PROTECTED_PREFIX = "/api/";

  private final boolean enabled;
  private final int maxRequests;
  private final Duration window;
  private final Clock clock;
  private final ObjectMapper objectMapper;
  private final AuditHelper auditHelper;
  private final Cache<String, Bucket> buckets;

  public RateLimitFilter(
          CendreProperties.RateLimitProperties properties,
          Clock clock,
          ObjectMapper objectMapper,
          AuditHelper auditHelper) {
    this.enabled = properties.enabled();
    this.maxRequests = properties.maxRequests();
    this.window = properties.window();
    this.clock = clock;
    this.objectMapper = objectMapper;
    this.auditHelper = auditHelper;
    this.buckets = Caffeine.newBuilder()
            .expireAfterWrite(window)
            .maximumSize(properties.maxTrackedClients())
            .ticker(tickerOf(clock))
            .executor(Runnable::run)
            .build();
    log.debug("RateLimitFilter initialized. Enabled: {}, limit: {} requests per {}", enabled, maxRequests, window);
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    return !enabled || !request.getRequestURI().startsWith(PROTECTED_PREFIX);
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String client = request.getRemoteAddr() != null ? request.getRemoteAddr() : "global";
    Instant now = clock.instant();

    Bucket bucket = buckets.get(client, key -> new Bucket(now, new AtomicInteger()));
    int count = bucket.count().updateAndGet(c -> c == Integer.MAX_VALUE ? c : c + 1);

    if (count <= maxRequests) {
      filterChain.doFilter(request, response);
      return;
    }

    long retryAfterSecs = Math.max(1, Duration.between(now, bucket.windowStart().plus(window)).toSeconds());
    log.warn("Rate limit exceeded for client {} on {} {}", client, request.getMethod(), request.getRequestURI());
    auditHelper.logHttpEvent(request, "rate_limit", "request", "denied",
            HttpStatus.TOO_MANY_REQUESTS.value(), ERROR_MESSAGE, null);
    writeTooManyRequests(response, retryAfterSecs);
  }

  private void writeTooManyRequests(HttpServletResponse response, long retryAfterSecs) throws IOException {
    HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", "about:blank");
    body.put("title", status.getReasonPhrase());
    body.put("status", status.value());
    body.put("detail", "Request limit of " + maxRequests + " per " + window.toSeconds() + "s exceeded.");
    body.put("error", ERROR_MESSAGE);

    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSecs));
    objectMapper.writeValue(response.getOutputStream(), body);
  }

  /**
   * Number of clients currently holding a counter.
   */
  long trackedClients() {
    buckets.cleanUp();
    return buckets.estimatedSize();
  }

  // Window expiry follows the injected clock rather than System.nanoTime().
  private static Ticker tickerOf(Clock clock) {
    return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }

  private record Bucket(Instant windowStart, AtomicInteger count) {}
}
