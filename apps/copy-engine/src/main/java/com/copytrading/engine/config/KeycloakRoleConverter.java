package com.copytrading.engine.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Maps Keycloak roles to {@code ROLE_*} authorities: realm roles from {@code realm_access} and
 * roles of the configured client from {@code resource_access}. Scope authorities are kept as-is.
 * A role written {@code copy-admin} or {@code ROLE_admin} becomes {@code ROLE_COPY_ADMIN} or
 * {@code ROLE_ADMIN}.
 */
public class KeycloakRoleConverter implements Converter<Jwt, Collection<GrantedAuthority>> {
  private static final String ROLE_PREFIX = "ROLE_";

  private final String clientId;
  private final JwtGrantedAuthoritiesConverter scopeConverter =
      new JwtGrantedAuthoritiesConverter();

  public KeycloakRoleConverter(String clientId) {
    this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
  }

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Set<GrantedAuthority> authorities = new LinkedHashSet<>();
    Collection<GrantedAuthority> scopes = scopeConverter.convert(jwt);
    if (scopes != null) {
      authorities.addAll(scopes);
    }
    rolesUnder(jwt.getClaims().get("realm_access")).forEach(role -> add(authorities, role));
    Object resourceAccess = jwt.getClaims().get("resource_access");
    if (resourceAccess instanceof Map<?, ?> clients) {
      rolesUnder(clients.get(clientId)).forEach(role -> add(authorities, role));
    }
    return authorities;
  }

  private static List<String> rolesUnder(Object access) {
    if (access instanceof Map<?, ?> accessMap
        && accessMap.get("roles") instanceof Collection<?> roles) {
      return roles.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }
    return List.of();
  }

  private static void add(Set<GrantedAuthority> authorities, String role) {
    String normalized = role.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if (normalized.isEmpty()) {
      return;
    }
    if (!normalized.startsWith(ROLE_PREFIX)) {
      normalized = ROLE_PREFIX + normalized;
    }
    authorities.add(new SimpleGrantedAuthority(normalized));
  }
}
