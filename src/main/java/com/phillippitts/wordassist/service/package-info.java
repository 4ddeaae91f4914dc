/**
 * Service layer: provider orchestration and configuration.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.provider} - provider registry, request building, wire formats</li>
 *   <li>{@code service.transport} - HTTP transport behind {@code ProviderTransport}</li>
 *   <li>{@code service.execution} - single-shot execution and retry</li>
 *   <li>{@code service.fallback} - ordered fallback across providers</li>
 *   <li>{@code service.prompt} - field-schema prompts, output validation, dynamic parsing</li>
 *   <li>{@code service.config} - encrypted, versioned provider configuration</li>
 *   <li>{@code service.health}, {@code service.metrics} - persisted health and Micrometer meters</li>
 * </ul>
 *
 * <p>{@link com.phillippitts.wordassist.service.AiOrchestrationService} is the entry point for
 * host code. Everything runs synchronously on the calling thread.
 */
package com.phillippitts.wordassist.service;
