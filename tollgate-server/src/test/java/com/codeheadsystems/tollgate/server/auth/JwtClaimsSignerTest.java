package com.codeheadsystems.tollgate.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.config.TokenManagerConfig;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenTypeException;
import com.codeheadsystems.tollgate.server.exception.UnexpectedSigningMethodException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtClaimsSignerTest {

  private static final String SECRET = "test-secret-must-be-at-least-64-bytes-for-hs512-0123456789abcdef";
  private static final String WRONG_SECRET = "wrong-secret-must-be-at-least-64-bytes-for-hs512-0123456789abcde";

  private JwtClaimsSigner signer;

  @BeforeEach
  void setUp() {
    signer = new JwtClaimsSigner(TokenManagerConfig.of(SECRET));
  }

  @Test
  void signAndVerify_roundTrip() {
    TokenClaims claims = TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN);

    TokenClaims verified = signer.verify(signer.sign(claims, Duration.ofHours(1)), TokenType.ACCESS_TOKEN);

    assertThat(verified.subject()).isEqualTo("u1");
    assertThat(verified.tokenType()).isEqualTo(TokenType.ACCESS_TOKEN);
    assertThat(verified.createdAt()).isEqualTo(claims.createdAt());
    assertThat(verified.issuedAtTime()).isPresent();
    assertThat(verified.expiresAtTime()).isPresent();
    assertThat(verified.expiresAt()).isAfter(verified.issuedAt());
  }

  @Test
  void sign_usesHs512() {
    String token = signer.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN), Duration.ofMinutes(1));

    assertThat(JWT.decode(token).getAlgorithm()).isEqualTo("HS512");
  }

  @Test
  void sign_nonPositiveTtl_throws() {
    TokenClaims claims = TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN);

    assertThatThrownBy(() -> signer.sign(claims, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> signer.sign(claims, Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sign_subSecondTtl_roundsExpiryUpToWholeSecond() {
    Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00.200Z"), ZoneOffset.UTC);
    JwtClaimsSigner clocked = new JwtClaimsSigner(TokenManagerConfig.of(SECRET), clock);

    String token = clocked.sign(TokenClaims.newClaims("u1", TokenType.VERIFY_EMAIL, clock),
        Duration.ofMillis(500));

    TokenClaims verified = clocked.verify(token, TokenType.VERIFY_EMAIL);
    assertThat(verified.expiresAt()).isEqualTo(Instant.parse("2026-01-01T00:00:01Z"));
  }

  @Test
  void expiresAt_neverFallsBeforeExactExpiry() {
    Instant now = Instant.parse("2026-01-01T00:00:00.200Z");

    assertThat(JwtClaimsSigner.expiresAt(now, Duration.ofMillis(1500)))
        .isEqualTo(Instant.parse("2026-01-01T00:00:02Z"));
    assertThat(JwtClaimsSigner.expiresAt(now, Duration.ofMillis(800)))
        .isEqualTo(Instant.parse("2026-01-01T00:00:01Z"));
    assertThat(JwtClaimsSigner.expiresAt(Instant.parse("2026-01-01T00:00:00Z"), Duration.ofSeconds(5)))
        .isEqualTo(Instant.parse("2026-01-01T00:00:05Z"));
  }

  @Test
  void verify_typeMismatch_throwsInvalidTokenType() {
    String token = signer.sign(TokenClaims.newClaims("u1", TokenType.VERIFY_EMAIL), Duration.ofMinutes(5));

    assertThatThrownBy(() -> signer.verify(token, TokenType.RESET_PASSWORD))
        .isInstanceOfSatisfying(InvalidTokenTypeException.class, e -> {
          assertThat(e.getExpected()).isEqualTo(TokenType.RESET_PASSWORD);
          assertThat(e.getActual()).isEqualTo(TokenType.VERIFY_EMAIL);
        });
  }

  @Test
  void verify_wrongSecret_throwsInvalidToken() {
    String token = signer.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN), Duration.ofHours(1));
    JwtClaimsSigner other = new JwtClaimsSigner(TokenManagerConfig.of(WRONG_SECRET));

    assertThatThrownBy(() -> other.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class)
        .hasMessage("invalid token");
  }

  @Test
  void verify_expiredToken_throwsInvalidToken() {
    Clock twoHoursAgo = Clock.fixed(Instant.now().minus(Duration.ofHours(2)), ZoneOffset.UTC);
    JwtClaimsSigner pastSigner = new JwtClaimsSigner(TokenManagerConfig.of(SECRET), twoHoursAgo);
    String token = pastSigner.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN, twoHoursAgo),
        Duration.ofHours(1));

    assertThatThrownBy(() -> signer.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_tamperedSignature_throwsInvalidToken() {
    String token = signer.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN), Duration.ofHours(1));

    assertThatThrownBy(() -> signer.verify(tamperSignature(token), TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_tamperedPayload_throwsInvalidToken() {
    String token = signer.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN), Duration.ofHours(1));
    String[] parts = token.split("\\.");
    String forgedPayload = b64(new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8)
        .replace("\"u1\"", "\"u9\""));

    assertThatThrownBy(() -> signer.verify(parts[0] + "." + forgedPayload + "." + parts[2],
        TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_noneAlgorithm_throwsUnexpectedSigningMethod() {
    String token = signer.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN), Duration.ofHours(1));
    String payload = token.split("\\.")[1];
    String unsigned = b64("{\"alg\":\"none\",\"typ\":\"JWT\"}") + "." + payload + ".";

    assertThatThrownBy(() -> signer.verify(unsigned, TokenType.ACCESS_TOKEN))
        .isInstanceOfSatisfying(UnexpectedSigningMethodException.class,
            e -> assertThat(e.getAlgorithm()).isEqualTo("none"));
  }

  @Test
  void verify_otherHmacAlgorithmWithSameKey_throwsUnexpectedSigningMethod() {
    String token = JWT.create()
        .withSubject("u1")
        .withClaim("createdAt", Instant.now().toEpochMilli())
        .withClaim("tokenType", TokenType.ACCESS_TOKEN.name())
        .withIssuedAt(Instant.now())
        .withExpiresAt(Instant.now().plusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> signer.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOfSatisfying(UnexpectedSigningMethodException.class,
            e -> assertThat(e.getAlgorithm()).isEqualTo("HS256"));
  }

  @Test
  void verify_missingTokenTypeClaim_throwsInvalidToken() {
    String token = JWT.create()
        .withSubject("u1")
        .withClaim("createdAt", Instant.now().toEpochMilli())
        .withExpiresAt(Instant.now().plusSeconds(3600))
        .sign(Algorithm.HMAC512(SECRET));

    assertThatThrownBy(() -> signer.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_unknownTokenType_throwsInvalidToken() {
    String token = JWT.create()
        .withSubject("u1")
        .withClaim("createdAt", Instant.now().toEpochMilli())
        .withClaim("tokenType", "SUPER_USER")
        .withExpiresAt(Instant.now().plusSeconds(3600))
        .sign(Algorithm.HMAC512(SECRET));

    assertThatThrownBy(() -> signer.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_missingExpiry_throwsInvalidToken() {
    String token = JWT.create()
        .withSubject("u1")
        .withClaim("createdAt", Instant.now().toEpochMilli())
        .withClaim("tokenType", TokenType.ACCESS_TOKEN.name())
        .sign(Algorithm.HMAC512(SECRET));

    assertThatThrownBy(() -> signer.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_garbage_throwsInvalidToken() {
    assertThatThrownBy(() -> signer.verify("not-a-token", TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
    assertThatThrownBy(() -> signer.verify("", TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
    assertThatThrownBy(() -> signer.verify(null, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void verify_issuerConfigured_rejectsTokensFromOtherIssuer() {
    JwtClaimsSigner issuerA = new JwtClaimsSigner(new TokenManagerConfig(SECRET, "issuer-a"));
    JwtClaimsSigner issuerB = new JwtClaimsSigner(new TokenManagerConfig(SECRET, "issuer-b"));
    String token = issuerA.sign(TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN), Duration.ofHours(1));

    assertThat(issuerA.verify(token, TokenType.ACCESS_TOKEN).subject()).isEqualTo("u1");
    assertThatThrownBy(() -> issuerB.verify(token, TokenType.ACCESS_TOKEN))
        .isInstanceOf(InvalidTokenException.class);
  }

  /**
   * Replaces one character in the middle of the signature segment, where every bit is significant.
   */
  static String tamperSignature(String token) {
    int index = token.lastIndexOf('.') + 10;
    char replacement = token.charAt(index) == 'A' ? 'B' : 'A';
    return token.substring(0, index) + replacement + token.substring(index + 1);
  }

  private static String b64(String json) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
