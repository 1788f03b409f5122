package com.codeheadsystems.portcullis.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Claims carried by a signed token, as a fixed set of named optional fields plus a side map
 * for anything the library does not know about.
 * <p>
 * The two time claims are kept as raw JSON values. Whether {@code iat} or {@code exp} is a
 * usable timestamp is a validation question, not a decoding one, so a token carrying
 * {@code "exp":"tomorrow"} still decodes and is rejected later by whoever checks the claims.
 * Integral values are always normalized to {@link LongNode}.
 *
 * @param issuedAt    {@code iat}, seconds since the epoch
 * @param expiresAt   {@code exp}, seconds since the epoch
 * @param jwtId       {@code jti}
 * @param issuer      {@code iss}
 * @param audience    {@code aud}
 * @param subject     {@code sub}, an application or account href
 * @param callbackUri {@code cb_uri}
 * @param path        {@code path}
 * @param state       {@code state}
 * @param newSubject  {@code isNewSub}
 * @param status      {@code status}
 * @param extraClaims every other claim, keyed by name
 */
public record TokenClaims(
    JsonNode issuedAt,
    JsonNode expiresAt,
    String jwtId,
    String issuer,
    String audience,
    String subject,
    String callbackUri,
    String path,
    String state,
    Boolean newSubject,
    String status,
    Map<String, Object> extraClaims) {

  public static final String ISSUED_AT = "iat";
  public static final String EXPIRES_AT = "exp";
  public static final String JWT_ID = "jti";
  public static final String ISSUER = "iss";
  public static final String AUDIENCE = "aud";
  public static final String SUBJECT = "sub";
  public static final String CALLBACK_URI = "cb_uri";
  public static final String PATH = "path";
  public static final String STATE = "state";
  public static final String NEW_SUBJECT = "isNewSub";
  public static final String STATUS = "status";

  /**
   * Names that map onto a record component and may not appear in {@link #extraClaims()}.
   */
  public static final Set<String> REGISTERED = Set.of(ISSUED_AT, EXPIRES_AT, JWT_ID, ISSUER,
      AUDIENCE, SUBJECT, CALLBACK_URI, PATH, STATE, NEW_SUBJECT, STATUS);

  public TokenClaims {
    issuedAt = normalize(issuedAt);
    expiresAt = normalize(expiresAt);
    if (extraClaims == null || extraClaims.isEmpty()) {
      extraClaims = Map.of();
    } else {
      for (String name : extraClaims.keySet()) {
        if (REGISTERED.contains(name)) {
          throw new IllegalArgumentException("Claim '" + name + "' has a dedicated field");
        }
      }
      extraClaims = canonicalMap(extraClaims);
    }
  }

  // Extra claims are held in the shape they take after a JSON round trip: whole numbers as
  // Long, fractions as Double, objects as String-keyed maps and arrays as lists.
  private static Map<String, Object> canonicalMap(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((key, value) -> copy.put(String.valueOf(key), canonical(value)));
    return Collections.unmodifiableMap(copy);
  }

  private static Object canonical(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big;
    }
    if (value instanceof Float f) {
      return Double.parseDouble(f.toString());
    }
    if (value instanceof Double || value instanceof BigDecimal) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Map<?, ?> map) {
      return canonicalMap(map);
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      collection.forEach(element -> copy.add(canonical(element)));
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Object[] array) {
      return canonical(Arrays.asList(array));
    }
    return value;
  }

  private static JsonNode normalize(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return LongNode.valueOf(node.asLong());
    }
    return node;
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * The type Builder.
   */
  public static class Builder {
    private JsonNode issuedAt;
    private JsonNode expiresAt;
    private String jwtId;
    private String issuer;
    private String audience;
    private String subject;
    private String callbackUri;
    private String path;
    private String state;
    private Boolean newSubject;
    private String status;
    private final Map<String, Object> extraClaims = new LinkedHashMap<>();

    public Builder withIssuedAt(final Instant instant) {
      this.issuedAt = LongNode.valueOf(instant.getEpochSecond());
      return this;
    }

    /**
     * Sets {@code iat} to an arbitrary JSON value, including ones that are not timestamps.
     *
     * @param value the raw value
     * @return the builder
     */
    public Builder withRawIssuedAt(final JsonNode value) {
      this.issuedAt = value;
      return this;
    }

    public Builder withExpiresAt(final Instant instant) {
      this.expiresAt = LongNode.valueOf(instant.getEpochSecond());
      return this;
    }

    /**
     * Sets {@code exp} to an arbitrary JSON value, including ones that are not timestamps.
     *
     * @param value the raw value
     * @return the builder
     */
    public Builder withRawExpiresAt(final JsonNode value) {
      this.expiresAt = value;
      return this;
    }

    public Builder withJwtId(final String jwtId) {
      this.jwtId = jwtId;
      return this;
    }

    public Builder withIssuer(final String issuer) {
      this.issuer = issuer;
      return this;
    }

    public Builder withAudience(final String audience) {
      this.audience = audience;
      return this;
    }

    public Builder withSubject(final String subject) {
      this.subject = subject;
      return this;
    }

    public Builder withCallbackUri(final String callbackUri) {
      this.callbackUri = callbackUri;
      return this;
    }

    public Builder withPath(final String path) {
      this.path = path;
      return this;
    }

    public Builder withState(final String state) {
      this.state = state;
      return this;
    }

    public Builder withNewSubject(final Boolean newSubject) {
      this.newSubject = newSubject;
      return this;
    }

    public Builder withStatus(final String status) {
      this.status = status;
      return this;
    }

    /**
     * Adds a claim that has no dedicated field.
     *
     * @param name  the claim name
     * @param value a JSON-compatible value (String, Number, Boolean, Map, List)
     * @return the builder
     */
    public Builder withClaim(final String name, final Object value) {
      if (REGISTERED.contains(name)) {
        throw new IllegalArgumentException("Claim '" + name + "' has a dedicated setter");
      }
      extraClaims.put(name, value);
      return this;
    }

    public TokenClaims build() {
      return new TokenClaims(issuedAt, expiresAt, jwtId, issuer, audience, subject, callbackUri,
          path, state, newSubject, status, extraClaims);
    }
  }
}
