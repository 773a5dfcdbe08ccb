package tech.yump.cendre.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.HeaderWriterFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.security.web.header.writers.StaticHeadersWriter;
import tech.yump.cendre.api.filter.RateLimitFilter;
import tech.yump.cendre.api.filter.RequestIdFilter;
import tech.yump.cendre.audit.AuditHelper;

import java.time.Clock;

/**
 * The API is anonymous by nature: possession of a secret id is the only credential. Spring Security is used for
 * the stateless chain, the response security headers, and to host the request-id and rate-limit filters.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private static final String HSTS_HEADER = "Strict-Transport-Security";
  private static final String HSTS_VALUE = "max-age=63072000; includeSubDomains; preload"; // two years

  private final CendreProperties cendreProperties;
  private final AuditHelper auditHelper;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .requestCache(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .headers(headers -> headers
                    .contentTypeOptions(contentTypeOptions -> {})
                    .frameOptions(frameOptions -> frameOptions.deny())
                    .referrerPolicy(referrer -> referrer.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER))
                    // Written on plain HTTP as well: TLS usually terminates at a proxy in front of the service.
                    .httpStrictTransportSecurity(hsts -> hsts.disable())
                    .addHeaderWriter(new StaticHeadersWriter(HSTS_HEADER, HSTS_VALUE)))
            .addFilterAfter(new RequestIdFilter(), HeaderWriterFilter.class)
            .addFilterAfter(rateLimitFilter(), RequestIdFilter.class)
            .authorizeHttpRequests(authz -> authz.anyRequest().permitAll());

    if (!cendreProperties.rateLimit().enabled()) {
      log.warn("Rate limiting is disabled via configuration (cendre.rate-limit.enabled=false).");
    }
    return http.build();
  }

  private RateLimitFilter rateLimitFilter() {
    return new RateLimitFilter(cendreProperties.rateLimit(), clock, objectMapper, auditHelper);
  }
}
