package com.example.file_registry.config;

import java.util.List;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Identity is the host's concern. File and source reads are never rejected here; Basic
 * credentials, when sent, only name the caller whose source access the {@code AccessPolicy} then
 * decides. Registering a source at runtime is administrative and needs one of the configured
 * {@code files.access.admins} accounts.
 */
@Configuration
public class SecurityConfig {
  static final String ADMIN_ROLE = "ADMIN";

  @Bean
  SecurityFilterChain securityFilterChain(HttpSecurity http, AuthenticationProvider callerProvider)
      throws Exception {
    http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(HttpMethod.POST, "/api/v1/sources")
                    .hasRole(ADMIN_ROLE)
                    .anyRequest()
                    .permitAll())
        .httpBasic(Customizer.withDefaults())
        .authenticationProvider(callerProvider);
    return http.build();
  }

  /**
   * Any Basic user name is accepted as a caller. Names listed as admins must present the matching
   * password and then also carry the admin role.
   */
  @Bean
  AuthenticationProvider callerProvider(FileRegistryProperties properties) {
    Map<String, String> admins = properties.getAccess().getAdmins();
    PasswordEncoder passwordEncoder = PasswordEncoderFactories.createDelegatingPasswordEncoder();
    return new AuthenticationProvider() {
      @Override
      public Authentication authenticate(Authentication auth) {
        String encoded = admins.get(auth.getName());
        if (encoded == null) {
          return authenticated(auth, List.of(new SimpleGrantedAuthority("ROLE_CALLER")));
        }
        Object credentials = auth.getCredentials();
        if (credentials == null || !passwordEncoder.matches(credentials.toString(), encoded)) {
          throw new BadCredentialsException("Bad credentials for " + auth.getName());
        }
        return authenticated(
            auth,
            List.of(
                new SimpleGrantedAuthority("ROLE_CALLER"),
                new SimpleGrantedAuthority("ROLE_" + ADMIN_ROLE)));
      }

      @Override
      public boolean supports(Class<?> type) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(type);
      }
    };
  }

  private static Authentication authenticated(
      Authentication auth, List<? extends GrantedAuthority> authorities) {
    return new UsernamePasswordAuthenticationToken(auth.getName(), null, authorities);
  }
}
