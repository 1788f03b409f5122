package com.codeheadsystems.portcullis.client.idsite;

import com.codeheadsystems.portcullis.client.error.IdSiteError;
import com.codeheadsystems.portcullis.client.exceptions.TokenClaimException;
import com.codeheadsystems.portcullis.client.model.IdSiteResult;
import com.codeheadsystems.portcullis.client.model.IdSiteResultStatus;
import com.codeheadsystems.portcullis.token.SigningContext;
import com.codeheadsystems.portcullis.token.TokenClaims;
import com.codeheadsystems.portcullis.token.TokenCodec;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the URL ID Site redirects the user back to and turns it into an {@link IdSiteResult}.
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>Extract the {@code jwtResponse} query parameter.</li>
 *   <li>Decode and verify the signature with the {@link TokenCodec}. Decode failures are
 *       propagated untouched: they mean a forged or corrupted response.</li>
 *   <li>Run {@link IdSiteClaimChecks#standard} and report the first failure as a
 *       {@link TokenClaimException}.</li>
 * </ol>
 * Claims are only ever handed back wrapped in the result, after every check has passed.
 */
public class IdSiteCallbackVerifier {

  private static final Logger log = LoggerFactory.getLogger(IdSiteCallbackVerifier.class);

  private static final String JWT_RESPONSE = "jwtResponse";

  private final TokenCodec tokenCodec;
  private final Clock clock;
  private final Duration clockSkew;

  /**
   * Instantiates a new Id site callback verifier.
   *
   * @param tokenCodec the token codec
   * @param clock      the clock
   * @param clockSkew  tolerated future skew of {@code iat}
   */
  public IdSiteCallbackVerifier(final TokenCodec tokenCodec, final Clock clock, final Duration clockSkew) {
    this.tokenCodec = tokenCodec;
    this.clock = clock;
    this.clockSkew = clockSkew;
  }

  /**
   * Verifies the callback.
   *
   * @param responseUrl    the full URL ID Site redirected to
   * @param signingContext the signing context
   * @return the result
   * @throws IllegalArgumentException if the URL is missing or has no {@code jwtResponse}
   * @throws com.codeheadsystems.portcullis.token.exceptions.TokenDecodeException if the token
   *                                  is malformed or its signature is invalid
   * @throws TokenClaimException      if a claim check fails
   */
  public IdSiteResult handleCallback(final String responseUrl, final SigningContext signingContext) {
    if (responseUrl == null || responseUrl.isBlank()) {
      throw new IllegalArgumentException("responseUrl must not be empty");
    }
    String token = jwtResponse(responseUrl);
    TokenClaims claims = tokenCodec.decode(token, signingContext);

    List<ClaimCheck> checks = IdSiteClaimChecks.standard(signingContext.issuerId(), clock.instant(), clockSkew);
    Optional<IdSiteError> failure = IdSiteClaimChecks.firstFailure(checks, claims);
    if (failure.isPresent()) {
      log.debug("ID Site response rejected: {}", failure.get());
      throw new TokenClaimException(failure.get());
    }

    IdSiteResultStatus status = IdSiteResultStatus.fromClaim(claims.status())
        .orElseThrow(() -> new TokenClaimException(IdSiteError.INVALID_STATUS));
    return new IdSiteResult(
        claims.subject(),
        status,
        claims.state() == null ? "" : claims.state(),
        Boolean.TRUE.equals(claims.newSubject()));
  }

  private static String jwtResponse(String responseUrl) {
    URI uri;
    try {
      uri = URI.create(responseUrl.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("responseUrl is not a valid URL", e);
    }
    String query = uri.getRawQuery();
    if (query != null) {
      for (String pair : query.split("&")) {
        int eq = pair.indexOf('=');
        String name = eq < 0 ? pair : pair.substring(0, eq);
        if (JWT_RESPONSE.equals(name) && eq >= 0) {
          String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
          if (!value.isBlank()) {
            return value;
          }
        }
      }
    }
    throw new IllegalArgumentException("responseUrl has no " + JWT_RESPONSE + " parameter");
  }
}
