package com.phillippitts.wordassist.service.prompt;

import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.service.config.ConfigCodec;
import com.phillippitts.wordassist.service.config.ConfigMigrator;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void defaultTemplateEmbedsInputAndSchema() {
        String prompt = builder.buildIntegratedPrompt("serendipity", List.of("word", "meaning"), null);

        assertThat(prompt)
                .contains("\"serendipity\"")
                .contains("\"word\": \"the word or phrase itself\"")
                .contains("\"meaning\": \"meaning and explanation\"")
                .doesNotContain(PromptBuilder.FIELD_SCHEMA)
                .doesNotContain(PromptBuilder.INPUT_TEXT)
                .endsWith("- Only use these fields: word, meaning\n"
                        + "- Partial output is allowed, but field names must match exactly");
    }

    @Test
    void schemaIsValidJsonInFieldOrder() {
        JSONObject schema = new JSONObject(PromptBuilder.fieldSchema(List.of("Front", "Reading", "Example", "Notes")));

        assertThat(schema.getString("Front")).isEqualTo("the word or phrase itself");
        assertThat(schema.getString("Reading")).isEqualTo("reading or phonetic transcription");
        assertThat(schema.getString("Example")).isEqualTo("example sentence");
        assertThat(schema.getString("Notes")).isEqualTo("content for Notes");
        assertThat(PromptBuilder.fieldSchema(List.of("b", "a"))).isEqualTo(
                "{\n  \"b\": \"content for b\",\n  \"a\": \"content for a\"\n}");
    }

    @Test
    void emptyFieldListRendersEmptyObject() {
        assertThat(PromptBuilder.fieldSchema(List.of())).isEqualTo("{}");
    }

    @Test
    void customTemplateWithPlaceholdersIsFilledAndHardened() {
        String template = "Word: {{INPUT_TEXT}}\nFields: {{AVAILABLE_FIELDS}}\nSchema:\n{{FIELD_SCHEMA}}";

        String prompt = builder.buildIntegratedPrompt("ephemeral", List.of("word", "example"), template);

        assertThat(prompt)
                .startsWith("Word: ephemeral\nFields: \"word\", \"example\"\nSchema:\n{")
                .contains("CRITICAL requirements:")
                .contains("- Only use these fields: word, example");
    }

    @Test
    void fullyCustomTemplateGetsInputAppendedAfterSeparator() {
        String prompt = builder.buildIntegratedPrompt("hello", List.of("word"), "Translate this into French.");

        assertThat(prompt).isEqualTo("Translate this into French."
                + "\n-------------------------------\n" + "Input: hello");
        assertThat(prompt).doesNotContain("CRITICAL");
    }

    @Test
    void legacyPromptWithoutTemplateAsksForFrontAndBack() {
        String prompt = builder.buildLegacyPrompt("line one\nline two", null);

        assertThat(prompt)
                .startsWith("Parse the following lookup result into structured data.")
                .contains("\"front\"")
                .contains("\"back\"")
                .endsWith("Text to parse:\n---\nline one\nline two\n---\n");
    }

    @Test
    void legacyPromptRepairsTemplateWithoutInput() {
        String prompt = builder.buildLegacyPrompt("apple", "Define the word.");

        assertThat(prompt).startsWith("Define the word.\n\nUser input: \"apple\"\n\n");
        assertThat(prompt).endsWith(PromptBuilder.FRONT_BACK_FORMAT);
    }

    @Test
    void validateAndFixTemplates() {
        assertThat(builder.validatePromptTemplate("Explain {{INPUT_TEXT}}")).isTrue();
        assertThat(builder.validatePromptTemplate("Explain")).isFalse();
        assertThat(builder.validatePromptTemplate(null)).isFalse();

        assertThat(builder.fixPromptTemplate(" ")).isEqualTo(PromptBuilder.DEFAULT_TEMPLATE);
        assertThat(builder.fixPromptTemplate("Explain")).isEqualTo("Explain\n\nUser input: \"{{INPUT_TEXT}}\"");
        assertThat(builder.fixPromptTemplate("Explain {{INPUT_TEXT}}")).isEqualTo("Explain {{INPUT_TEXT}}");
        assertThat(builder.validatePromptTemplate(builder.fixPromptTemplate("anything"))).isTrue();
    }

    @Test
    void loadPromptForModelPrefersNoteSettingsThenTemplatesThenCustom() {
        AppConfig base = new ConfigMigrator(new ProviderRegistry(new OrchestrationProperties()), new ConfigCodec())
                .defaultConfig();
        AppConfig config = base
                .withSection("ankiConfig", Map.of("promptTemplatesByModel", Map.of("gpt-5.2", "anki {{INPUT_TEXT}}")))
                .withSection("promptTemplates", Map.of(
                        "promptTemplatesByModel", Map.of("gpt-5.2", "ignored", "claude-opus-4-6", "claude {{INPUT_TEXT}}"),
                        "custom", "custom {{INPUT_TEXT}}"));

        assertThat(builder.loadPromptForModel("gpt-5.2", config)).isEqualTo("anki {{INPUT_TEXT}}");
        assertThat(builder.loadPromptForModel("claude-opus-4-6", config)).isEqualTo("claude {{INPUT_TEXT}}");
        assertThat(builder.loadPromptForModel("gemini-2.5-flash", config)).isEqualTo("custom {{INPUT_TEXT}}");
        assertThat(builder.loadPromptForModel("gemini-2.5-flash", base)).isEmpty();
    }
}
