package com.codeheadsystems.portcullis.client.idsite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.portcullis.client.error.IdSiteError;
import com.codeheadsystems.portcullis.client.exceptions.TokenClaimException;
import com.codeheadsystems.portcullis.client.model.IdSiteResult;
import com.codeheadsystems.portcullis.client.model.IdSiteResultStatus;
import com.codeheadsystems.portcullis.token.SigningContext;
import com.codeheadsystems.portcullis.token.TokenClaims;
import com.codeheadsystems.portcullis.token.TokenCodec;
import com.codeheadsystems.portcullis.token.exceptions.MalformedTokenException;
import com.codeheadsystems.portcullis.token.exceptions.SignatureInvalidException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Response tokens are minted with java-jwt, the way a server would, except where a claim must
 * carry a value java-jwt refuses to write.
 */
class IdSiteCallbackVerifierTest {

  private static final String KEY_ID = "KEYID";
  private static final String SECRET = "an-api-key-secret-of-some-length";
  private static final String ACCOUNT = "https://api.example.com/v1/accounts/acc1";
  private static final String CALLBACK = "https://myapp.example.com/callback?jwtResponse=";
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private final SigningContext context = new SigningContext(KEY_ID, SECRET.getBytes(StandardCharsets.UTF_8));
  private TokenCodec codec;
  private IdSiteCallbackVerifier verifier;

  @BeforeEach
  void setUp() {
    codec = new TokenCodec(new ObjectMapper());
    verifier = new IdSiteCallbackVerifier(codec, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(60));
  }

  @Test
  void handleCallback_registered_returnsNewAccount() {
    String token = response()
        .withClaim("status", "REGISTERED")
        .withClaim("isNewSub", true)
        .withClaim("state", "xyz")
        .sign(Algorithm.HMAC256(SECRET));

    IdSiteResult result = verifier.handleCallback(CALLBACK + token + "&other=1", context);

    assertThat(result.accountHref()).isEqualTo(ACCOUNT);
    assertThat(result.status()).isEqualTo(IdSiteResultStatus.REGISTERED);
    assertThat(result.state()).isEqualTo("xyz");
    assertThat(result.isNewAccount()).isTrue();
  }

  @Test
  void handleCallback_defaultsStateAndNewAccount() {
    String token = response().withClaim("status", "AUTHENTICATED").sign(Algorithm.HMAC256(SECRET));

    IdSiteResult result = verifier.handleCallback(CALLBACK + token, context);

    assertThat(result.status()).isEqualTo(IdSiteResultStatus.AUTHENTICATED);
    assertThat(result.state()).isEmpty();
    assertThat(result.isNewAccount()).isFalse();
  }

  @Test
  void handleCallback_logout() {
    String token = response().withClaim("status", "LOGOUT").sign(Algorithm.HMAC256(SECRET));

    assertThat(verifier.handleCallback(CALLBACK + token, context).status()).isEqualTo(IdSiteResultStatus.LOGOUT);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  "})
  void handleCallback_noUrl_isArgumentError(String url) {
    assertThatThrownBy(() -> verifier.handleCallback(url, context))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void handleCallback_noJwtResponse_isArgumentError() {
    assertThatThrownBy(() -> verifier.handleCallback("https://myapp.example.com/callback?state=1", context))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("jwtResponse");
  }

  @Test
  void handleCallback_otherSecret_isSignatureInvalid() {
    String token = response().withClaim("status", "AUTHENTICATED").sign(Algorithm.HMAC256("not-the-secret"));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOf(SignatureInvalidException.class);
  }

  @Test
  void handleCallback_garbage_isMalformed() {
    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + "not-a-token", context))
        .isInstanceOf(MalformedTokenException.class);
  }

  @Test
  void handleCallback_expired() {
    String token = response()
        .withExpiresAt(Date.from(NOW.minusSeconds(1)))
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class, e -> {
          assertThat(e.error()).isEqualTo(IdSiteError.EXPIRED);
          assertThat(e.status()).isEqualTo(400);
          assertThat(e.code()).isEqualTo(10011);
          assertThat(e.getMessage()).isEqualTo("Token is invalid");
          assertThat(e.developerMessage()).isEqualTo("Token is no longer valid because it has expired");
        });
  }

  @Test
  void handleCallback_expiresExactlyNow_isExpired() {
    String token = response()
        .withExpiresAt(Date.from(NOW))
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class,
            e -> assertThat(e.error()).isEqualTo(IdSiteError.EXPIRED));
  }

  @Test
  void handleCallback_audienceMismatch() {
    String token = response()
        .withAudience("SOMEONE_ELSE")
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class, e -> {
          assertThat(e.code()).isEqualTo(10012);
          assertThat(e.getMessage()).isEqualTo("Token is invalid");
          assertThat(e.developerMessage())
              .isEqualTo("Token is invalid because the issued at time (iat) is after the current time");
        });
  }

  @Test
  void handleCallback_audienceCheckedBeforeExpiry() {
    String token = response()
        .withAudience("SOMEONE_ELSE")
        .withExpiresAt(Date.from(NOW.minusSeconds(600)))
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class,
            e -> assertThat(e.error()).isEqualTo(IdSiteError.AUDIENCE_MISMATCH));
  }

  @Test
  void handleCallback_nonNumericExpiration() {
    TokenClaims claims = TokenClaims.builder()
        .withIssuedAt(NOW)
        .withRawExpiresAt(TextNode.valueOf("tomorrow"))
        .withAudience(KEY_ID)
        .withSubject(ACCOUNT)
        .withStatus("AUTHENTICATED")
        .build();

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + codec.encode(claims, context), context))
        .isInstanceOfSatisfying(TokenClaimException.class, e -> {
          assertThat(e.error()).isEqualTo(IdSiteError.INVALID_EXPIRATION);
          assertThat(e.code()).isEqualTo(10017);
          assertThat(e.getMessage()).isEqualTo("Token is invalid");
        });
  }

  @Test
  void handleCallback_issuedTooFarInTheFuture() {
    String token = response()
        .withIssuedAt(Date.from(NOW.plusSeconds(120)))
        .withExpiresAt(Date.from(NOW.plusSeconds(600)))
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class, e -> {
          assertThat(e.error()).isEqualTo(IdSiteError.ISSUED_IN_FUTURE);
          assertThat(e.code()).isEqualTo(10012);
        });
  }

  @Test
  void handleCallback_issuedWithinSkew_isAccepted() {
    String token = response()
        .withIssuedAt(Date.from(NOW.plusSeconds(30)))
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(verifier.handleCallback(CALLBACK + token, context).accountHref()).isEqualTo(ACCOUNT);
  }

  @Test
  void handleCallback_missingStatus() {
    String token = response().sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class,
            e -> assertThat(e.error()).isEqualTo(IdSiteError.INVALID_STATUS));
  }

  @Test
  void handleCallback_unknownStatus() {
    String token = response().withClaim("status", "DELETED").sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class, e -> {
          assertThat(e.error()).isEqualTo(IdSiteError.INVALID_STATUS);
          assertThat(e.code()).isEqualTo(10017);
        });
  }

  @Test
  void handleCallback_missingSubject() {
    String token = JWT.create()
        .withIssuer("https://api.example.com/v1/applications/app123")
        .withAudience(KEY_ID)
        .withIssuedAt(Date.from(NOW.minusSeconds(5)))
        .withClaim("status", "AUTHENTICATED")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> verifier.handleCallback(CALLBACK + token, context))
        .isInstanceOfSatisfying(TokenClaimException.class,
            e -> assertThat(e.error()).isEqualTo(IdSiteError.MISSING_SUBJECT));
  }

  private static JWTCreator.Builder response() {
    return JWT.create()
        .withIssuer("https://api.example.com/v1/applications/app123")
        .withAudience(KEY_ID)
        .withSubject(ACCOUNT)
        .withIssuedAt(Date.from(NOW.minusSeconds(5)))
        .withExpiresAt(Date.from(NOW.plusSeconds(60)));
  }
}
