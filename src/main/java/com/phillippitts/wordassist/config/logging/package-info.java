/**
 * Request correlation for Log4j2.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code path}: set by
 *       {@link com.phillippitts.wordassist.config.logging.MdcFilter} for every HTTP request</li>
 *   <li>{@code provider}: set by the fallback chain while a provider is being called</li>
 * </ul>
 *
 * <p>Log format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2026-03-02 10:15:04.112 [http-nio-8080-exec-1] [requestId] [provider] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.wordassist.config.logging;
