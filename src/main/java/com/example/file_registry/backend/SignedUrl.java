package com.example.file_registry.backend;

import java.time.Instant;

public record SignedUrl(String url, Instant expiresAt) {}
