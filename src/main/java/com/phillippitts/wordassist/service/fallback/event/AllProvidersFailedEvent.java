package com.phillippitts.wordassist.service.fallback.event;

import java.time.Instant;

/** Published when every attempted provider failed. */
public record AllProvidersFailedEvent(int attempted, String reason, Instant at) { }
