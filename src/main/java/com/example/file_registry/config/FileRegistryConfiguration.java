package com.example.file_registry.config;

import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.security.AccessPolicy;
import com.example.file_registry.security.ConfiguredAccessPolicy;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Default collaborators. A host application replaces either one by declaring its own bean of the
 * same type.
 */
@Configuration
@EnableConfigurationProperties(FileRegistryProperties.class)
public class FileRegistryConfiguration {

  @Bean
  @ConditionalOnMissingBean(AccessPolicy.class)
  AccessPolicy accessPolicy(FileRegistryProperties properties) {
    return new ConfiguredAccessPolicy(properties.getAccess());
  }

  @Bean
  @ConditionalOnMissingBean(SecretResolver.class)
  SecretResolver secretResolver(FileRegistryProperties properties, Environment environment) {
    Map<String, String> secrets = properties.getSecrets();
    Set<String> fromEnvironment = Set.copyOf(properties.getEnvironmentSecrets());
    return name -> {
      String configured = secrets.get(name);
      if (configured != null) {
        return Optional.of(configured);
      }
      if (!fromEnvironment.contains(name)) {
        return Optional.empty();
      }
      return Optional.ofNullable(environment.getProperty(name));
    };
  }
}
