package io.agenthive.controlplane.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import javax.crypto.SecretKey;
import org.junit.jupiter.api.Test;

class ApiKeyAccessTokenProviderTest {

  private static final String SECRET = "0123456789abcdef0123456789abcdef";

  @Test
  void issuesSignedAgentToken() {
    ApiKeyAccessTokenProvider provider = new ApiKeyAccessTokenProvider("api-key", SECRET);
    SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));

    Claims claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(provider.workerToken()).getPayload();

    assertThat(claims.getIssuer()).isEqualTo("api-key");
    assertThat(claims.getId()).isNotBlank();
    assertThat(claims.get(ApiKeyAccessTokenProvider.GRANTS_CLAIM, Map.class)).containsEntry("agent", true);
    assertThat(Duration.between(claims.getIssuedAt().toInstant(), claims.getExpiration().toInstant()))
        .isEqualTo(ApiKeyAccessTokenProvider.DEFAULT_TTL);
  }

  @Test
  void usesTheClockForValidity() {
    Instant now = Instant.now().minusSeconds(30);
    ApiKeyAccessTokenProvider provider = new ApiKeyAccessTokenProvider(
        "api-key", SECRET, Duration.ofMinutes(5), Clock.fixed(now, ZoneOffset.UTC));
    SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));

    Claims claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(provider.workerToken()).getPayload();

    assertThat(claims.getNotBefore().toInstant().getEpochSecond()).isEqualTo(now.getEpochSecond());
    assertThat(claims.getExpiration().toInstant().getEpochSecond()).isEqualTo(now.plusSeconds(300).getEpochSecond());
  }

  @Test
  void tokensAreUnique() {
    ApiKeyAccessTokenProvider provider = new ApiKeyAccessTokenProvider("api-key", SECRET);

    assertThat(provider.workerToken()).isNotEqualTo(provider.workerToken());
  }

  @Test
  void rejectsMissingCredentials() {
    assertThatThrownBy(() -> new ApiKeyAccessTokenProvider(" ", SECRET))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("apiKey must not be null or blank");
    assertThatThrownBy(() -> new ApiKeyAccessTokenProvider("api-key", null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
