package com.codeheadsystems.tollgate.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.auth.ClaimsSigner;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenTypeException;
import com.codeheadsystems.tollgate.server.exception.UnexpectedSigningMethodException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessTokenServiceTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T08:00:00Z"), ZoneOffset.UTC);

  @Mock private ClaimsSigner signer;

  private AccessTokenService service;

  @BeforeEach
  void setUp() {
    service = new AccessTokenService(signer, CLOCK);
  }

  @Test
  void generateAccessToken_signsAccessTokenClaims() {
    when(signer.sign(any(), eq(Duration.ofHours(1)))).thenReturn("signed");

    assertThat(service.generateAccessToken("u2", Duration.ofHours(1))).isEqualTo("signed");

    ArgumentCaptor<TokenClaims> claims = ArgumentCaptor.forClass(TokenClaims.class);
    verify(signer).sign(claims.capture(), eq(Duration.ofHours(1)));
    assertThat(claims.getValue().subject()).isEqualTo("u2");
    assertThat(claims.getValue().tokenType()).isEqualTo(TokenType.ACCESS_TOKEN);
    assertThat(claims.getValue().createdAt()).isEqualTo(CLOCK.instant());
  }

  @Test
  void decodeAccessToken_wrongType_isInvalidWithTypeError() {
    InvalidTokenTypeException failure =
        new InvalidTokenTypeException(TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN);
    when(signer.verify("t", TokenType.ACCESS_TOKEN)).thenThrow(failure);

    AccessTokenResult result = service.decodeAccessToken("t");

    assertThat(result.valid()).isFalse();
    assertThat(result.claims()).isEmpty();
    assertThat(result.error()).containsSame(failure);
  }

  @Test
  void decodeAccessToken_unexpectedAlgorithm_surfacesDistinctError() {
    when(signer.verify("t", TokenType.ACCESS_TOKEN)).thenThrow(new UnexpectedSigningMethodException("none"));

    assertThat(service.decodeAccessToken("t").error())
        .hasValueSatisfying(e -> assertThat(e).isInstanceOf(UnexpectedSigningMethodException.class));
  }
}
