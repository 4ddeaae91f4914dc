package com.phillippitts.wordassist.presentation.controller;

import com.phillippitts.wordassist.domain.AiConfig;
import com.phillippitts.wordassist.domain.ConnectionTestResult;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.domain.ParseResult;
import com.phillippitts.wordassist.service.AiOrchestrationService;
import com.phillippitts.wordassist.service.config.ConfigService;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local HTTP surface over {@link AiOrchestrationService}. API keys are accepted for connection
 * tests but never returned.
 */
@RestController
@RequestMapping("/api")
class AiController {

    private static final Logger LOG = LogManager.getLogger(AiController.class);

    private final AiOrchestrationService orchestration;
    private final ProviderRegistry registry;
    private final ConfigService configService;

    AiController(AiOrchestrationService orchestration, ProviderRegistry registry, ConfigService configService) {
        this.orchestration = orchestration;
        this.registry = registry;
        this.configService = configService;
    }

    @PostMapping("/parse")
    ResponseEntity<ParseResult> parse(@RequestBody ParseRequest request) {
        LOG.info("Parse request received (chars={})", request.text() == null ? 0 : request.text().length());
        return ResponseEntity.ok(orchestration.parseWithFallback(request.text(), request.template()));
    }

    @PostMapping("/parse/fields")
    ResponseEntity<ParseResult> parseFields(@RequestBody FieldParseRequest request) {
        LOG.info("Field parse request received (fields={})", request.fieldNames());
        return ResponseEntity.ok(orchestration.parseWithDynamicFields(
                request.text(), request.fieldNames(), request.template()));
    }

    @PostMapping("/providers/{id}/test")
    ResponseEntity<ConnectionTestResult> testConnection(@PathVariable("id") String id,
                                                        @RequestBody ConnectionTestRequest request) {
        return ResponseEntity.ok(orchestration.testConnection(id, request.apiKey(), request.modelName()));
    }

    @GetMapping("/providers")
    ResponseEntity<Map<String, Object>> providers() {
        AiConfig ai = configService.current().aiConfig();
        List<Map<String, Object>> providers = new ArrayList<>();
        for (ProviderDescriptor descriptor : registry.getAll()) {
            ModelState state = ai.model(descriptor.id()).orElse(ModelState.initial(descriptor.defaultApiUrl()));
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", descriptor.id());
            entry.put("label", descriptor.label());
            entry.put("compatMode", descriptor.mode().tag());
            entry.put("defaultModel", descriptor.defaultModel());
            entry.put("supportedModels", descriptor.supportedModels());
            entry.put("configured", state.hasApiKey());
            entry.put("modelName", state.modelName());
            entry.put("healthStatus", state.healthStatus().value());
            entry.put("lastHealthCheck", state.lastHealthCheck());
            entry.put("lastErrorMessage", state.lastErrorMessage());
            providers.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("activeProvider", registry.canonicalize(ai.provider()));
        body.put("providers", providers);
        body.put("hostPermissions", registry.allHostPermissions());
        return ResponseEntity.ok(body);
    }

    record ParseRequest(String text, String template) {}

    record FieldParseRequest(String text, List<String> fieldNames, String template) {}

    record ConnectionTestRequest(String apiKey, String modelName) {}
}
