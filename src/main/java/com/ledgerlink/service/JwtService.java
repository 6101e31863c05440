package com.ledgerlink.service;

import com.ledgerlink.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Verifies bearer tokens issued by the external auth service. Subject is the user id. */
@Service
public class JwtService {
  private final JwtParser parser;

  public JwtService(JwtProperties properties) {
    if (properties.secret() == null || properties.secret().isBlank()) {
      throw new IllegalStateException("ledgerlink.jwt.secret is required");
    }
    JwtParserBuilder builder = Jwts.parserBuilder()
        .setSigningKey(Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8)));
    if (properties.issuer() != null && !properties.issuer().isBlank()) {
      builder.requireIssuer(properties.issuer());
    }
    this.parser = builder.build();
  }

  public UUID parseUserId(String token) {
    Claims claims = parser.parseClaimsJws(token).getBody();
    return UUID.fromString(claims.getSubject());
  }
}
