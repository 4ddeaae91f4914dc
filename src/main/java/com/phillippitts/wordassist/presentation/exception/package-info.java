/**
 * Exception-to-HTTP mapping for the local API.
 *
 * <ul>
 *   <li>{@link com.phillippitts.wordassist.exception.NoProvidersAvailableException} → 503</li>
 *   <li>{@link com.phillippitts.wordassist.exception.AllProvidersFailedException} → 502</li>
 *   <li>{@link com.phillippitts.wordassist.exception.OutputValidationException} → 422</li>
 *   <li>{@link com.phillippitts.wordassist.exception.ProviderConfigurationException},
 *       {@code IllegalArgumentException} → 400</li>
 *   <li>{@code Exception} (catch-all) → 500</li>
 * </ul>
 *
 * <p>Response format:
 * <pre>
 * {
 *   "error": "AllProvidersFailedException",
 *   "message": "All AI providers failed: ...",
 *   "timestamp": "2026-03-02T10:15:04.112Z"
 * }
 * </pre>
 */
package com.phillippitts.wordassist.presentation.exception;
