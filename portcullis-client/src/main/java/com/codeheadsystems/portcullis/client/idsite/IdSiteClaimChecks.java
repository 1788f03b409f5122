package com.codeheadsystems.portcullis.client.idsite;

import com.codeheadsystems.portcullis.client.error.IdSiteError;
import com.codeheadsystems.portcullis.client.model.IdSiteResultStatus;
import com.codeheadsystems.portcullis.token.TokenClaims;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The ordered checks applied to an ID Site response token. The order matters: callers and the
 * service agree on which error is reported when several claims are wrong at once.
 */
public final class IdSiteClaimChecks {

  private IdSiteClaimChecks() {
  }

  /**
   * The standard chain: audience, expiration format, expiry, issued-at, subject, status.
   *
   * @param issuerId  the caller's own API key id
   * @param now       the current time
   * @param clockSkew how far in the future {@code iat} may be
   * @return the checks, in evaluation order
   */
  public static List<ClaimCheck> standard(final String issuerId, final Instant now, final Duration clockSkew) {
    return List.of(
        audience(issuerId),
        expirationFormat(),
        notExpired(now),
        issuedAt(now, clockSkew),
        subjectPresent(),
        knownStatus());
  }

  /**
   * Runs the checks in order and stops at the first failure.
   *
   * @param checks the checks
   * @param claims the claims
   * @return the first failure, or empty when all pass
   */
  public static Optional<IdSiteError> firstFailure(final List<ClaimCheck> checks, final TokenClaims claims) {
    for (ClaimCheck check : checks) {
      Optional<IdSiteError> failure = check.check(claims);
      if (failure.isPresent()) {
        return failure;
      }
    }
    return Optional.empty();
  }

  static ClaimCheck audience(final String issuerId) {
    return claims -> issuerId.equals(claims.audience())
        ? Optional.empty()
        : Optional.of(IdSiteError.AUDIENCE_MISMATCH);
  }

  static ClaimCheck expirationFormat() {
    return claims -> claims.expiresAt() == null || isTimestamp(claims.expiresAt())
        ? Optional.empty()
        : Optional.of(IdSiteError.INVALID_EXPIRATION);
  }

  static ClaimCheck notExpired(final Instant now) {
    return claims -> {
      if (claims.expiresAt() == null || !isTimestamp(claims.expiresAt())) {
        return Optional.empty();
      }
      return claims.expiresAt().asLong() <= now.getEpochSecond()
          ? Optional.of(IdSiteError.EXPIRED)
          : Optional.empty();
    };
  }

  static ClaimCheck issuedAt(final Instant now, final Duration clockSkew) {
    long latest = now.plus(clockSkew).getEpochSecond();
    return claims -> {
      JsonNode iat = claims.issuedAt();
      if (iat == null) {
        return Optional.empty();
      }
      if (!isTimestamp(iat)) {
        return Optional.of(IdSiteError.INVALID_ISSUED_AT);
      }
      return iat.asLong() > latest ? Optional.of(IdSiteError.ISSUED_IN_FUTURE) : Optional.empty();
    };
  }

  static ClaimCheck subjectPresent() {
    return claims -> claims.subject() == null || claims.subject().isBlank()
        ? Optional.of(IdSiteError.MISSING_SUBJECT)
        : Optional.empty();
  }

  static ClaimCheck knownStatus() {
    return claims -> IdSiteResultStatus.fromClaim(claims.status()).isPresent()
        ? Optional.empty()
        : Optional.of(IdSiteError.INVALID_STATUS);
  }

  private static boolean isTimestamp(JsonNode node) {
    return node.isIntegralNumber() && node.canConvertToLong();
  }
}
