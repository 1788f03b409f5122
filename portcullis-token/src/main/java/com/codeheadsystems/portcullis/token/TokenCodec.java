package com.codeheadsystems.portcullis.token;

import com.codeheadsystems.portcullis.token.exceptions.MalformedTokenException;
import com.codeheadsystems.portcullis.token.exceptions.SignatureInvalidException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and decodes compact HS256 tokens ({@code header.claims.signature}, each segment
 * base64url without padding).
 * <p>
 * The header is always {@code {"alg":"HS256","typ":"JWT"}} on the way out. On the way in the
 * {@code alg} header is only compared against the signing context; it never selects the
 * verification algorithm, so {@code none} or RSA headers are rejected outright.
 * <p>
 * Stateless and thread-safe. Every call takes the {@link SigningContext} explicitly.
 */
@Singleton
public class TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64URL_DECODER = Base64.getUrlDecoder();
  private static final String HEADER_ALG = "alg";

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Token codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public TokenCodec(final ObjectMapper objectMapper) {
    log.info("TokenCodec()");
    this.objectMapper = objectMapper;
  }

  /**
   * Signs the claims.
   *
   * @param claims  the claims
   * @param context the signing context
   * @return the compact token
   */
  public String encode(final TokenClaims claims, final SigningContext context) {
    Objects.requireNonNull(claims, "claims");
    Objects.requireNonNull(context, "context");
    ObjectNode header = objectMapper.createObjectNode()
        .put(HEADER_ALG, context.algorithm())
        .put("typ", "JWT");
    try {
      String headerSegment = B64URL.encodeToString(objectMapper.writeValueAsBytes(header));
      String claimsSegment = B64URL.encodeToString(objectMapper.writeValueAsBytes(toJson(claims)));
      byte[] signature = sign(headerSegment, claimsSegment, context);
      return headerSegment + "." + claimsSegment + "." + B64URL.encodeToString(signature);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Claims cannot be serialized to JSON", e);
    }
  }

  /**
   * Verifies the signature and returns the claims. Claims are NOT validated here.
   *
   * @param token   the compact token
   * @param context the signing context
   * @return the claims
   * @throws MalformedTokenException   if the token is not three decodable JSON segments
   * @throws SignatureInvalidException if the algorithm or the signature does not match
   */
  public TokenClaims decode(final String token, final SigningContext context) {
    Objects.requireNonNull(context, "context");
    if (token == null || token.isBlank()) {
      throw new MalformedTokenException("Token is empty");
    }
    String[] segments = token.split("\\.", -1);
    if (segments.length != 3) {
      throw new MalformedTokenException(
          "Token must have exactly 3 segments but had " + segments.length);
    }
    JsonNode header = readJson(segments[0], "header");
    JsonNode claims = readJson(segments[1], "claims");
    byte[] actual = decodeSegment(segments[2], "signature");

    JsonNode alg = header.get(HEADER_ALG);
    if (alg == null || !alg.isTextual() || !context.algorithm().equals(alg.textValue())) {
      log.debug("Rejected token with alg={}", alg);
      throw new SignatureInvalidException("Token algorithm is not " + context.algorithm());
    }
    byte[] expected = sign(segments[0], segments[1], context);
    if (!MessageDigest.isEqual(expected, actual)) {
      log.debug("Rejected token with a signature that does not verify");
      throw new SignatureInvalidException("Token signature does not match");
    }
    return fromJson((ObjectNode) claims);
  }

  private byte[] sign(String headerSegment, String claimsSegment, SigningContext context) {
    return context.signer().sign(
        headerSegment.getBytes(StandardCharsets.UTF_8),
        claimsSegment.getBytes(StandardCharsets.UTF_8));
  }

  private byte[] decodeSegment(String segment, String name) {
    try {
      return B64URL_DECODER.decode(segment);
    } catch (IllegalArgumentException e) {
      throw new MalformedTokenException("Token " + name + " is not valid base64url", e);
    }
  }

  private JsonNode readJson(String segment, String name) {
    byte[] bytes = decodeSegment(segment, name);
    JsonNode node;
    try {
      node = objectMapper.readTree(bytes);
    } catch (IOException e) {
      throw new MalformedTokenException("Token " + name + " is not valid JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedTokenException("Token " + name + " is not a JSON object");
    }
    return node;
  }

  private ObjectNode toJson(TokenClaims claims) {
    ObjectNode node = objectMapper.createObjectNode();
    if (claims.issuedAt() != null) {
      node.set(TokenClaims.ISSUED_AT, claims.issuedAt());
    }
    if (claims.expiresAt() != null) {
      node.set(TokenClaims.EXPIRES_AT, claims.expiresAt());
    }
    putIfPresent(node, TokenClaims.JWT_ID, claims.jwtId());
    putIfPresent(node, TokenClaims.ISSUER, claims.issuer());
    putIfPresent(node, TokenClaims.AUDIENCE, claims.audience());
    putIfPresent(node, TokenClaims.SUBJECT, claims.subject());
    putIfPresent(node, TokenClaims.CALLBACK_URI, claims.callbackUri());
    putIfPresent(node, TokenClaims.PATH, claims.path());
    putIfPresent(node, TokenClaims.STATE, claims.state());
    if (claims.newSubject() != null) {
      node.put(TokenClaims.NEW_SUBJECT, claims.newSubject());
    }
    putIfPresent(node, TokenClaims.STATUS, claims.status());
    claims.extraClaims().forEach((name, value) -> node.set(name, objectMapper.valueToTree(value)));
    return node;
  }

  private static void putIfPresent(ObjectNode node, String name, String value) {
    if (value != null) {
      node.put(name, value);
    }
  }

  private TokenClaims fromJson(ObjectNode node) {
    TokenClaims.Builder builder = TokenClaims.builder()
        .withRawIssuedAt(node.get(TokenClaims.ISSUED_AT))
        .withRawExpiresAt(node.get(TokenClaims.EXPIRES_AT))
        .withJwtId(text(node, TokenClaims.JWT_ID))
        .withIssuer(text(node, TokenClaims.ISSUER))
        .withAudience(audience(node.get(TokenClaims.AUDIENCE)))
        .withSubject(text(node, TokenClaims.SUBJECT))
        .withCallbackUri(text(node, TokenClaims.CALLBACK_URI))
        .withPath(text(node, TokenClaims.PATH))
        .withState(text(node, TokenClaims.STATE))
        .withStatus(text(node, TokenClaims.STATUS));
    JsonNode newSubject = node.get(TokenClaims.NEW_SUBJECT);
    if (newSubject != null && !newSubject.isNull()) {
      builder.withNewSubject(newSubject.asBoolean());
    }
    Map<String, Object> extras = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!TokenClaims.REGISTERED.contains(field.getKey())) {
        extras.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
      }
    }
    extras.forEach(builder::withClaim);
    return builder.build();
  }

  private static String text(ObjectNode node, String name) {
    JsonNode value = node.get(name);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }

  // A single-element audience array is equivalent to the plain string form.
  private static String audience(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isArray()) {
      return value.size() == 1 ? value.get(0).asText() : value.toString();
    }
    return value.asText();
  }
}
