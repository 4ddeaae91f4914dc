package com.phillippitts.wordassist.service.prompt;

import com.phillippitts.wordassist.domain.ParseResult;
import com.phillippitts.wordassist.exception.NoProvidersAvailableException;
import com.phillippitts.wordassist.exception.OutputValidationException;
import com.phillippitts.wordassist.service.provider.PreparedRequest;
import com.phillippitts.wordassist.testutil.OrchestrationFixture;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.wordassist.testutil.OrchestrationFixture.googleAnswer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class DynamicParsingServiceTest {

    private static final List<String> FIELDS = List.of("word", "reading", "meaning");

    @Test
    void temperatureDecaysPerAttemptWithFloor() {
        assertThat(DynamicParsingService.temperatureFor(1)).isEqualTo(0.3);
        assertThat(DynamicParsingService.temperatureFor(2)).isEqualTo(0.2);
        assertThat(DynamicParsingService.temperatureFor(3)).isEqualTo(0.1);
        assertThat(DynamicParsingService.temperatureFor(7)).isEqualTo(0.1);
    }

    @Test
    void retriesEmptyOutputWithLowerTemperature() {
        OrchestrationFixture f = new OrchestrationFixture().withKey("google", "g-key");
        f.transport.respond("google", 200, googleAnswer("{\"word\":\"  \"}"));
        f.transport.respond("google", 200, googleAnswer("{\"meaning\":\"small feline\",\"word\":\"cat\"}"));

        ParseResult result = f.dynamicParsing.runDynamicParsing("cat", FIELDS, null);

        assertThat(result.providerId()).isEqualTo("google");
        assertThat(result.fields()).containsExactly(
                entry("word", "cat"),
                entry("meaning", "small feline"));
        List<PreparedRequest> requests = f.transport.requests();
        assertThat(requests).hasSize(2);
        assertThat(temperatureOf(requests.get(0))).isEqualTo(0.3);
        assertThat(temperatureOf(requests.get(1))).isEqualTo(0.2);
    }

    @Test
    void wrongFieldsExhaustAttemptBudget() {
        OrchestrationFixture f = new OrchestrationFixture().withKey("google", "g-key");
        f.transport.respond("google", 200, googleAnswer("{\"word\":\"cat\",\"synonym\":\"kitty\"}"));

        assertThatThrownBy(() -> f.dynamicParsing.runDynamicParsing("cat", FIELDS, null))
                .isInstanceOf(OutputValidationException.class)
                .satisfies(e -> assertThat(((OutputValidationException) e).getInvalidFields())
                        .containsExactly("synonym"));
        assertThat(f.transport.callsTo("google")).isEqualTo(3);
    }

    @Test
    void attemptBudgetIsAtLeastConfiguredDynamicRetries() {
        OrchestrationFixture f = new OrchestrationFixture();
        f.props.setDynamicRetries(5);

        assertThat(f.dynamicParsing.attemptBudget()).isEqualTo(5);
    }

    @Test
    void noProvidersIsNotRetried() {
        OrchestrationFixture f = new OrchestrationFixture();

        assertThatThrownBy(() -> f.dynamicParsing.runDynamicParsing("cat", FIELDS, null))
                .isInstanceOf(NoProvidersAvailableException.class);
        assertThat(f.transport.requests()).isEmpty();
    }

    @Test
    void rejectsInvalidFieldLists() {
        OrchestrationFixture f = new OrchestrationFixture();

        assertThatThrownBy(() -> f.dynamicParsing.runDynamicParsing("cat", List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> f.dynamicParsing.runDynamicParsing("cat", List.of("word", " "), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> f.dynamicParsing.runDynamicParsing("cat", List.of("word", "word"), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("word");
    }

    private static double temperatureOf(PreparedRequest request) {
        return new JSONObject(request.body()).getJSONObject("generationConfig").getDouble("temperature");
    }
}
