package com.phillippitts.wordassist.service.fallback.event;

import com.phillippitts.wordassist.exception.ErrorKind;

import java.time.Instant;

/** Published when a provider failed and the next fallback candidate is tried. */
public record ProviderFallbackEvent(String providerId, ErrorKind kind, String reason, Instant at) { }
