package io.b2mash.pms.security;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Token signing configuration.
 *
 * @param secret HMAC secret shared by issuer and verifier, at least 32 bytes for HS256
 * @param issuer value of the {@code iss} claim, checked on every request
 * @param ttl lifetime of an issued token
 */
@ConfigurationProperties(prefix = "pms.jwt")
public record JwtProperties(String secret, String issuer, Duration ttl) {}
