package com.ledgerlink.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the {@code Plaid-Verification} header: an ES256 JWT signed with a rotating key that is
 * fetched by {@code kid}, issued at most five minutes ago, whose {@code request_body_sha256}
 * claim matches the raw request body.
 */
@Component
public class PlaidWebhookVerifier {
  static final String HEADER = "plaid-verification";
  static final Duration KEY_CACHE_TTL = Duration.ofHours(24);
  static final Duration MAX_TOKEN_AGE = Duration.ofMinutes(5);
  private static final Logger log = LoggerFactory.getLogger(PlaidWebhookVerifier.class);

  private final PlaidClient plaidClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Map<String, CachedKey> keyCache = new ConcurrentHashMap<>();

  public PlaidWebhookVerifier(PlaidClient plaidClient, ObjectMapper objectMapper, Clock clock) {
    this.plaidClient = plaidClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public boolean verify(String rawBody, Map<String, String> headers) {
    String signedJwt = header(headers);
    if (signedJwt == null || signedJwt.isBlank()) {
      log.warn("Webhook verification failed: missing Plaid-Verification header");
      return false;
    }
    JsonNode jwtHeader = decodeHeader(signedJwt);
    if (jwtHeader == null) {
      log.warn("Webhook verification failed: malformed JWT header");
      return false;
    }
    String algorithm = jwtHeader.path("alg").asText();
    if (!"ES256".equals(algorithm)) {
      log.warn("Webhook verification failed: algorithm {} is not ES256", algorithm);
      return false;
    }
    String keyId = jwtHeader.path("kid").asText(null);
    if (keyId == null || keyId.isBlank()) {
      log.warn("Webhook verification failed: missing kid in JWT header");
      return false;
    }

    PublicKey publicKey;
    try {
      publicKey = resolveKey(keyId);
    } catch (RuntimeException | GeneralSecurityException ex) {
      log.error("Webhook verification failed: could not load verification key {}: {}", keyId, ex.getMessage());
      return false;
    }

    Claims claims;
    try {
      claims = Jwts.parserBuilder()
          .setSigningKey(publicKey)
          .setClock(() -> Date.from(clock.instant()))
          .build()
          .parseClaimsJws(signedJwt)
          .getBody();
    } catch (JwtException | IllegalArgumentException ex) {
      log.warn("Webhook verification failed: JWT verification error: {}", ex.getMessage());
      return false;
    }
    Date issuedAt = claims.getIssuedAt();
    if (issuedAt == null || Duration.between(issuedAt.toInstant(), clock.instant()).compareTo(MAX_TOKEN_AGE) > 0) {
      log.warn("Webhook verification failed: token older than {}", MAX_TOKEN_AGE);
      return false;
    }

    String claimedHash = claims.get("request_body_sha256", String.class);
    if (claimedHash == null) {
      log.warn("Webhook verification failed: missing request_body_sha256 claim");
      return false;
    }
    String computedHash = sha256Hex(rawBody == null ? "" : rawBody);
    if (!MessageDigest.isEqual(claimedHash.getBytes(StandardCharsets.UTF_8),
        computedHash.getBytes(StandardCharsets.UTF_8))) {
      log.warn("Webhook verification failed: body hash mismatch");
      return false;
    }
    return true;
  }

  private PublicKey resolveKey(String keyId) throws GeneralSecurityException {
    Instant now = clock.instant();
    CachedKey cached = keyCache.get(keyId);
    if (cached != null && cached.isUsable(now)) {
      return cached.key();
    }
    JsonNode jwk = plaidClient.getWebhookVerificationKey(keyId);
    PublicKey key = toPublicKey(jwk);
    Instant expiredAt = jwk.hasNonNull("expired_at") ? Instant.ofEpochSecond(jwk.get("expired_at").asLong()) : null;
    keyCache.put(keyId, new CachedKey(key, now, expiredAt));
    log.info("Fetched and cached Plaid verification key {}", keyId);
    return key;
  }

  static PublicKey toPublicKey(JsonNode jwk) throws GeneralSecurityException {
    if (!"EC".equals(jwk.path("kty").asText()) || !"P-256".equals(jwk.path("crv").asText())) {
      throw new GeneralSecurityException("Unsupported JWK " + jwk.path("kty").asText() + "/" + jwk.path("crv").asText());
    }
    Base64.Decoder decoder = Base64.getUrlDecoder();
    BigInteger x = new BigInteger(1, decoder.decode(jwk.path("x").asText()));
    BigInteger y = new BigInteger(1, decoder.decode(jwk.path("y").asText()));
    AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
    parameters.init(new ECGenParameterSpec("secp256r1"));
    ECParameterSpec curve = parameters.getParameterSpec(ECParameterSpec.class);
    return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(new ECPoint(x, y), curve));
  }

  private JsonNode decodeHeader(String jwt) {
    int dot = jwt.indexOf('.');
    if (dot <= 0) {
      return null;
    }
    try {
      byte[] json = Base64.getUrlDecoder().decode(jwt.substring(0, dot));
      return objectMapper.readTree(json);
    } catch (Exception ex) {
      log.debug("Undecodable JWT header: {}", ex.getMessage());
      return null;
    }
  }

  private static String header(Map<String, String> headers) {
    if (headers == null) {
      return null;
    }
    return headers.entrySet().stream()
        .filter(entry -> HEADER.equalsIgnoreCase(entry.getKey()))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static String sha256Hex(String body) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  private record CachedKey(PublicKey key, Instant cachedAt, Instant expiredAt) {
    boolean isUsable(Instant now) {
      boolean notExpired = expiredAt == null || expiredAt.isAfter(now);
      return notExpired && Duration.between(cachedAt, now).compareTo(KEY_CACHE_TTL) < 0;
    }
  }
}
