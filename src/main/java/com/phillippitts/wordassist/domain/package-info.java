/**
 * Domain models shared by the orchestration and configuration services.
 *
 * <p>All domain models are immutable records; "with" methods return modified copies.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.wordassist.domain.AppConfig} - persisted configuration root with
 *       pass-through sections</li>
 *   <li>{@link com.phillippitts.wordassist.domain.AiConfig} - active provider, per-provider
 *       {@link com.phillippitts.wordassist.domain.ModelState} and fallback order</li>
 *   <li>{@link com.phillippitts.wordassist.domain.GenerationOptions} - temperature and token overrides</li>
 *   <li>{@link com.phillippitts.wordassist.domain.ParseResult} - fields extracted from free text</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.wordassist.domain;
