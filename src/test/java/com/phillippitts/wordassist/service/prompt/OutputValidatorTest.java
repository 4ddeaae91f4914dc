package com.phillippitts.wordassist.service.prompt;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutputValidatorTest {

    private static final List<String> FIELDS = List.of("word", "meaning", "example");

    private final OutputValidator validator = new OutputValidator();

    @Test
    void acceptsSubsetOfFields() {
        ValidationResult result = validator.validateAIOutput("{\"meaning\":\"luck\",\"word\":\"serendipity\"}", FIELDS);

        assertThat(result.valid()).isTrue();
        assertThat(result.hasContent()).isTrue();
        assertThat(result.validFields()).containsExactly("word", "meaning");
        assertThat(result.invalidFields()).isEmpty();
        assertThat(result.error()).isNull();
        assertThat(result.parsedData().getString("word")).isEqualTo("serendipity");
    }

    @Test
    void reportsUnexpectedFieldsSorted() {
        ValidationResult result = validator.validateAIOutput(
                "{\"word\":\"x\",\"zeta\":1,\"alpha\":2}", FIELDS);

        assertThat(result.valid()).isFalse();
        assertThat(result.invalidFields()).containsExactly("alpha", "zeta");
        assertThat(result.validFields()).containsExactly("word");
    }

    @Test
    void blankAndNullValuesAreNotContent() {
        ValidationResult result = validator.validateAIOutput("{\"word\":\"  \",\"meaning\":null}", FIELDS);

        assertThat(result.valid()).isTrue();
        assertThat(result.validFields()).containsExactly("word", "meaning");
        assertThat(result.hasContent()).isFalse();
    }

    @Test
    void emptyObjectIsValidWithoutContent() {
        ValidationResult result = validator.validateAIOutput("{}", FIELDS);

        assertThat(result.valid()).isTrue();
        assertThat(result.validFields()).isEmpty();
        assertThat(result.hasContent()).isFalse();
    }

    @Test
    void nonStringValuesCountAsContent() {
        JSONObject parsed = new JSONObject().put("example", 42);

        ValidationResult result = validator.validateAIOutput(parsed, FIELDS);

        assertThat(result.hasContent()).isTrue();
        assertThat(result.parsedData()).isSameAs(parsed);
        assertThat(OutputValidator.valueAsText(parsed, "example")).isEqualTo("42");
        assertThat(OutputValidator.valueAsText(parsed, "missing")).isEmpty();
    }

    @Test
    void unparseableOutputIsReportedNotThrown() {
        ValidationResult result = validator.validateAIOutput("Sure! Here is your JSON:", FIELDS);

        assertThat(result.valid()).isFalse();
        assertThat(result.parsedData()).isNull();
        assertThat(result.hasContent()).isFalse();
        assertThat(result.error()).startsWith("JSON parse failed: ");
    }

    @Test
    void nullOutputIsAParseFailure() {
        ValidationResult result = validator.validateAIOutput(null, FIELDS);

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).startsWith("JSON parse failed: ");
    }
}
