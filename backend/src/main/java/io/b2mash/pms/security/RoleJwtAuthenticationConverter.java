package io.b2mash.pms.security;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Maps the {@code roles} claim to {@code ROLE_*} authorities. {@link UserFilter} later replaces
 * these with the roles currently stored for the user.
 */
@Component
public class RoleJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    List<String> claimed = jwt.getClaimAsStringList(TokenService.CLAIM_ROLES);
    if (claimed == null) {
      return List.of();
    }
    return claimed.stream()
        .map(Role::fromValue)
        .flatMap(Optional::stream)
        .map(role -> (GrantedAuthority) new SimpleGrantedAuthority(role.authority()))
        .toList();
  }

  /** Authorities for a role set, used when re-issuing the authentication from stored roles. */
  static List<GrantedAuthority> authoritiesOf(RoleSet roles) {
    return roles.asSet().stream()
        .map(role -> (GrantedAuthority) new SimpleGrantedAuthority(role.authority()))
        .toList();
  }
}
