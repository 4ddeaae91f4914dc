/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend the unchecked {@link com.phillippitts.wordassist.exception.WordAssistException},
 * which carries an {@link com.phillippitts.wordassist.exception.ErrorKind} so callers can branch on a
 * stable category instead of parsing messages.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.wordassist.exception.ProviderConfigurationException} - unknown provider,
 *       missing API key or model (not retried)</li>
 *   <li>{@link com.phillippitts.wordassist.exception.RequestFailedException} - transport failure of a single
 *       provider call, with HTTP status and {@link com.phillippitts.wordassist.exception.FailureReason}</li>
 *   <li>{@link com.phillippitts.wordassist.exception.OutputValidationException} - AI output outside the
 *       requested field schema</li>
 *   <li>{@link com.phillippitts.wordassist.exception.ApiKeyCryptoException} - key encryption failure
 *       (decrypt failures never leave the config store)</li>
 *   <li>{@link com.phillippitts.wordassist.exception.AllProvidersFailedException} and
 *       {@link com.phillippitts.wordassist.exception.NoProvidersAvailableException} - fallback exhaustion</li>
 * </ul>
 *
 * @see com.phillippitts.wordassist.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.wordassist.exception;
