package com.example.file_registry.security;

import static org.junit.jupiter.api.Assertions.*;

import com.example.file_registry.config.FileRegistryProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfiguredAccessPolicyTest {

  private FileRegistryProperties.Access access;
  private ConfiguredAccessPolicy policy;

  @BeforeEach
  void setUp() {
    access = new FileRegistryProperties.Access();
    access.getSources().put("public", List.of("*"));
    access.getSources().put("team", List.of("alice", "bob"));
    policy = new ConfiguredAccessPolicy(access);
  }

  @Test
  void isAllowed_wildcardSource_admitsAnonymous() {
    assertTrue(policy.isAllowed(CallerContext.anonymous(), "public"));
    assertTrue(policy.isAllowed(CallerContext.of("carol"), "public"));
  }

  @Test
  void isAllowed_listedActor_isAdmitted() {
    assertTrue(policy.isAllowed(CallerContext.of("alice"), "team"));
  }

  @Test
  void isAllowed_unlistedActor_isDenied() {
    assertFalse(policy.isAllowed(CallerContext.of("carol"), "team"));
    assertFalse(policy.isAllowed(CallerContext.anonymous(), "team"));
  }

  @Test
  void isAllowed_unlistedSource_fallsBackToDefault() {
    assertFalse(policy.isAllowed(CallerContext.of("alice"), "other"));

    access.setDefaultAllowed(true);

    assertTrue(policy.isAllowed(CallerContext.of("alice"), "other"));
  }

  @Test
  void isAllowed_readsPolicyOnEveryCall() {
    assertFalse(policy.isAllowed(CallerContext.of("carol"), "team"));

    access.getSources().put("team", List.of("carol"));

    assertTrue(policy.isAllowed(CallerContext.of("carol"), "team"));
  }
}
