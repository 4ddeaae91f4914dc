package com.phillippitts.wordassist.service.config.event;

import java.time.Instant;

/** Published when the configuration blob changed and stayed unchanged for the debounce window. */
public record ConfigChangedExternallyEvent(long stamp, Instant at) { }
