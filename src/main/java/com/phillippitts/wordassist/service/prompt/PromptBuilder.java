package com.phillippitts.wordassist.service.prompt;

import com.phillippitts.wordassist.domain.AppConfig;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds prompts that ask a provider for a JSON object with a caller-defined set of fields.
 *
 * <p>Templates may contain {@code {{INPUT_TEXT}}}, {@code {{FIELD_SCHEMA}}} and
 * {@code {{AVAILABLE_FIELDS}}}. A custom template with neither of the first two placeholders is a
 * fully custom instruction: the input is appended after a separator and no schema scaffolding is
 * added.
 */
@Component
public class PromptBuilder {

    public static final String INPUT_TEXT = "{{INPUT_TEXT}}";
    public static final String FIELD_SCHEMA = "{{FIELD_SCHEMA}}";
    public static final String AVAILABLE_FIELDS = "{{AVAILABLE_FIELDS}}";

    static final String CUSTOM_SEPARATOR = "\n-------------------------------\n";
    static final String INPUT_LABEL = "Input: ";

    static final String DEFAULT_TEMPLATE = """
            # Role: Vocabulary lookup assistant

            Complete the following tasks:
            1. Look up the word or phrase: "{{INPUT_TEXT}}"
            2. Produce a detailed explanation
            3. Output the result in the following JSON format:
            {{FIELD_SCHEMA}}

            Requirements:
            - Output pure JSON without any explanatory text
            - Fill the fields that fit this word or phrase
            - Leave out any field that does not apply""";

    static final String FRONT_BACK_FORMAT = """
            Your output must be a pure JSON object, without explanatory text or code fences.
            JSON format:
            {
              "front": "the word or phrase",
              "back": "the complete lookup result (keep the original line breaks)"
            }""";

    /**
     * Builds a field-schema prompt.
     *
     * @param text           user input
     * @param fieldNames     allowed output fields, in order
     * @param customTemplate template to use instead of the default, may be null or blank
     * @return prompt text
     */
    public String buildIntegratedPrompt(String text, List<String> fieldNames, String customTemplate) {
        boolean hasCustom = customTemplate != null && !customTemplate.isBlank();
        if (hasCustom && !customTemplate.contains(INPUT_TEXT) && !customTemplate.contains(FIELD_SCHEMA)) {
            return customTemplate + CUSTOM_SEPARATOR + INPUT_LABEL + text;
        }

        String template = hasCustom ? customTemplate : DEFAULT_TEMPLATE;
        String quotedFields = fieldNames.stream()
                .map(f -> "\"" + f + "\"")
                .collect(Collectors.joining(", "));
        String prompt = template
                .replace(INPUT_TEXT, text)
                .replace(FIELD_SCHEMA, fieldSchema(fieldNames))
                .replace(AVAILABLE_FIELDS, quotedFields);

        return prompt + "\n\nCRITICAL requirements:\n"
                + "- Output valid JSON\n"
                + "- Only use these fields: " + String.join(", ", fieldNames) + "\n"
                + "- Partial output is allowed, but field names must match exactly";
    }

    /**
     * Builds the two-field {@code front}/{@code back} prompt.
     *
     * @param text     user input
     * @param template optional template; repaired with {@link #fixPromptTemplate(String)} when given
     * @return prompt text
     */
    public String buildLegacyPrompt(String text, String template) {
        if (template == null || template.isBlank()) {
            return "Parse the following lookup result into structured data.\n"
                    + FRONT_BACK_FORMAT + "\n\n"
                    + "Text to parse:\n---\n" + text + "\n---\n";
        }
        return fixPromptTemplate(template).replace(INPUT_TEXT, text) + "\n\n" + FRONT_BACK_FORMAT;
    }

    /** A template is usable when it places the input text somewhere. */
    public boolean validatePromptTemplate(String template) {
        return template != null && template.contains(INPUT_TEXT);
    }

    /**
     * Repairs a template: blank becomes the default template, a template without
     * {@code {{INPUT_TEXT}}} gets an input line appended.
     */
    public String fixPromptTemplate(String template) {
        if (template == null || template.isBlank()) {
            return DEFAULT_TEMPLATE;
        }
        if (!template.contains(INPUT_TEXT)) {
            return template + "\n\nUser input: \"" + INPUT_TEXT + "\"";
        }
        return template;
    }

    /**
     * Looks up the template stored for a model: note-taking settings first, then prompt templates
     * by model, then the custom prompt template.
     *
     * @return template, or "" when none is stored
     */
    public String loadPromptForModel(String modelName, AppConfig config) {
        Map<String, Object> sections = config.sections();
        String byModel = text(sections, "ankiConfig", "promptTemplatesByModel", modelName);
        if (byModel.isEmpty()) {
            byModel = text(sections, "promptTemplates", "promptTemplatesByModel", modelName);
        }
        if (byModel.isEmpty()) {
            byModel = text(sections, "promptTemplates", "custom");
        }
        return byModel;
    }

    /**
     * Pretty-printed JSON object mapping each field to a hint derived from its name.
     */
    static String fieldSchema(List<String> fieldNames) {
        if (fieldNames.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{\n");
        for (int i = 0; i < fieldNames.size(); i++) {
            String field = fieldNames.get(i);
            sb.append("  ").append(JSONObject.quote(field)).append(": ").append(JSONObject.quote(hintFor(field)));
            sb.append(i < fieldNames.size() - 1 ? ",\n" : "\n");
        }
        return sb.append('}').toString();
    }

    static String hintFor(String field) {
        String name = field.toLowerCase(Locale.ROOT);
        if (name.contains("word") || name.contains("front")) {
            return "the word or phrase itself";
        }
        if (name.contains("reading") || name.contains("pronunciation")) {
            return "reading or phonetic transcription";
        }
        if (name.contains("meaning") || name.contains("definition")) {
            return "meaning and explanation";
        }
        if (name.contains("example")) {
            return "example sentence";
        }
        return "content for " + field;
    }

    private static String text(Map<String, Object> root, String... path) {
        Object node = root;
        for (String key : path) {
            if (!(node instanceof Map<?, ?> map)) {
                return "";
            }
            node = map.get(key);
        }
        return node instanceof String value ? value : "";
    }
}
