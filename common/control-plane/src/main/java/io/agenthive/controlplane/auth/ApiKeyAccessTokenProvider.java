package io.agenthive.controlplane.auth;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import javax.crypto.SecretKey;

/**
 * Issues short-lived HS256 tokens signed with the worker's API secret and carrying the agent grant.
 */
public final class ApiKeyAccessTokenProvider implements AccessTokenProvider {

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
  public static final String GRANTS_CLAIM = "grants";

  private final String apiKey;
  private final SecretKey signingKey;
  private final Duration ttl;
  private final Clock clock;

  public ApiKeyAccessTokenProvider(String apiKey, String apiSecret) {
    this(apiKey, apiSecret, DEFAULT_TTL, Clock.systemUTC());
  }

  /**
   * @param apiSecret HMAC secret; at least 32 bytes, as HS256 requires
   */
  public ApiKeyAccessTokenProvider(String apiKey, String apiSecret, Duration ttl, Clock clock) {
    this.apiKey = requireText(apiKey, "apiKey");
    this.signingKey = Keys.hmacShaKeyFor(requireText(apiSecret, "apiSecret").getBytes(StandardCharsets.UTF_8));
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String workerToken() {
    Instant now = clock.instant();
    return Jwts.builder()
        .issuer(apiKey)
        .id(UUID.randomUUID().toString())
        .notBefore(Date.from(now))
        .issuedAt(Date.from(now))
        .expiration(Date.from(now.plus(ttl)))
        .claim(GRANTS_CLAIM, Map.of("agent", true))
        .signWith(signingKey)
        .compact();
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }
}
