package com.codeheadsystems.tollgate.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TokenClaimsTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00.123456789Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void newClaims_keepsSubjectAndTypeAsGiven() {
    TokenClaims claims = TokenClaims.newClaims("  user 42  ", TokenType.VERIFY_EMAIL, CLOCK);

    assertThat(claims.subject()).isEqualTo("  user 42  ");
    assertThat(claims.tokenType()).isEqualTo(TokenType.VERIFY_EMAIL);
  }

  @Test
  void newClaims_stampsCreatedAtAtMillisecondPrecision() {
    TokenClaims claims = TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN, CLOCK);

    assertThat(claims.createdAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00.123Z"));
  }

  @Test
  void newClaims_hasNoValidityWindow() {
    TokenClaims claims = TokenClaims.newClaims("u1", TokenType.ACCESS_TOKEN, CLOCK);

    assertThat(claims.issuedAtTime()).isEmpty();
    assertThat(claims.expiresAtTime()).isEmpty();
  }

  @Test
  void withValidity_returnsCopyAndLeavesOriginalUntouched() {
    TokenClaims claims = TokenClaims.newClaims("u1", TokenType.REFRESH_TOKEN, CLOCK);
    Instant exp = NOW.plusSeconds(60);

    TokenClaims signed = claims.withValidity(NOW, exp);

    assertThat(signed.expiresAtTime()).contains(exp);
    assertThat(signed.subject()).isEqualTo("u1");
    assertThat(signed.tokenType()).isEqualTo(TokenType.REFRESH_TOKEN);
    assertThat(claims.expiresAtTime()).isEmpty();
  }

  @Test
  void constructor_rejectsMissingType() {
    assertThatThrownBy(() -> new TokenClaims("u1", NOW, null, null, null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void json_omitsUnsetValidityAndReadsBack() throws Exception {
    ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    TokenClaims claims = TokenClaims.newClaims("u1", TokenType.RESET_PASSWORD, CLOCK);

    String json = mapper.writeValueAsString(claims);

    assertThat(json).contains("\"tokenType\":\"RESET_PASSWORD\"").doesNotContain("expiresAt");
    assertThat(mapper.readValue(json, TokenClaims.class)).isEqualTo(claims);
  }
}
