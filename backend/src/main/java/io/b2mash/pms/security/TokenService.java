package io.b2mash.pms.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues HS256 access tokens. Verification happens in the resource server's {@code JwtDecoder},
 * configured from the same {@link JwtProperties}.
 */
@Service
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  public static final String CLAIM_EMAIL = "email";
  public static final String CLAIM_USERNAME = "username";
  public static final String CLAIM_ROLES = "roles";

  private final JwtProperties properties;
  private final byte[] secret;

  public TokenService(JwtProperties properties) {
    this.properties = properties;
    this.secret = properties.secret().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Issues a token for the given user.
   *
   * @return signed JWT string
   */
  public String issueToken(UUID userId, String email, String username, RoleSet roles) {
    try {
      Instant now = Instant.now();
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(userId.toString())
              .issuer(properties.issuer())
              .claim(CLAIM_EMAIL, email)
              .claim(CLAIM_USERNAME, username)
              .claim(CLAIM_ROLES, roles.values())
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(properties.ttl())))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued token for user {}", userId);
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign access token", e);
    }
  }
}
