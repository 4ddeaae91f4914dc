package com.phillippitts.wordassist.service;

import com.phillippitts.wordassist.domain.ConnectionTestResult;
import com.phillippitts.wordassist.domain.HealthStatus;
import com.phillippitts.wordassist.domain.ParseResult;
import com.phillippitts.wordassist.exception.RequestFailedException;
import com.phillippitts.wordassist.testutil.OrchestrationFixture;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static com.phillippitts.wordassist.testutil.OrchestrationFixture.googleAnswer;
import static com.phillippitts.wordassist.testutil.OrchestrationFixture.openAiAnswer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiOrchestrationServiceTest {

    @Test
    void parseWithFallbackPutsFrontAndBackFirst() {
        OrchestrationFixture f = new OrchestrationFixture().withActiveProvider("openai").withKey("openai", "sk");
        f.transport.respond("openai", 200,
                openAiAnswer("{\"zeta\":\"z\",\"back\":null,\"front\":\"cat\",\"alpha\":1}"));

        ParseResult result = f.orchestration.parseWithFallback("cat: a small animal", null);

        assertThat(result.fields().keySet()).containsExactly("front", "back", "alpha", "zeta");
        assertThat(result.field("front")).isEqualTo("cat");
        assertThat(result.field("back")).isEmpty();
        assertThat(result.field("alpha")).isEqualTo("1");
        assertThat(f.transport.requests().get(0).body()).contains("cat: a small animal");
    }

    @Test
    void parseRejectsBlankText() {
        OrchestrationFixture f = new OrchestrationFixture();

        assertThatThrownBy(() -> f.orchestration.parseWithFallback("  ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testConnectionSendsProbeAndRecordsHealth() {
        OrchestrationFixture f = new OrchestrationFixture();
        f.transport.respond("openai", 200, openAiAnswer("Hello there"));

        ConnectionTestResult result = f.orchestration.testConnection("chatgpt", "sk-test", null);

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("Connection successful: Hello there");
        JSONObject body = new JSONObject(f.transport.requests().get(0).body());
        assertThat(body.getString("model")).isEqualTo("gpt-5-mini");
        assertThat(body.getInt("max_tokens")).isEqualTo(16);
        assertThat(body.getDouble("temperature")).isEqualTo(0.0);
        assertThat(f.state("openai").healthStatus()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void testConnectionReportsFailureWithoutThrowing() {
        OrchestrationFixture f = new OrchestrationFixture();
        f.transport.respond("anthropic", 401, "{\"error\":{\"type\":\"authentication_error\",\"message\":\"invalid x-api-key\"}}");

        ConnectionTestResult result = f.orchestration.testConnection("anthropic", "bad-key-123", "claude-haiku-4-5");

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("invalid x-api-key").doesNotContain("bad-key-123");
        assertThat(f.transport.callsTo("anthropic")).isEqualTo(1);
        assertThat(f.state("anthropic").healthStatus()).isEqualTo(HealthStatus.ERROR);
    }

    @Test
    void testConnectionHandlesUnknownProviderAndMissingKey() {
        OrchestrationFixture f = new OrchestrationFixture();

        assertThat(f.orchestration.testConnection("mistral", "k", null).message())
                .isEqualTo("Unknown AI provider: mistral");
        ConnectionTestResult missingKey = f.orchestration.testConnection("google", "", null);
        assertThat(missingKey.success()).isFalse();
        assertThat(missingKey.message()).contains("Missing API key");
        assertThat(f.transport.requests()).isEmpty();
    }

    @Test
    void callProviderApiIsSingleShot() {
        OrchestrationFixture f = new OrchestrationFixture();
        f.transport.respond("openai", 503, "{\"error\":{\"message\":\"overloaded\"}}");

        assertThatThrownBy(() -> f.orchestration.callProviderApi("openai", "sk", "gpt-5.2", "hi", null))
                .isInstanceOf(RequestFailedException.class)
                .hasMessageContaining("overloaded");
        assertThat(f.transport.callsTo("openai")).isEqualTo(1);
        assertThat(f.sleeper.delays()).isEmpty();
    }

    @Test
    void testConnectionEncodesModelNameInPath() {
        OrchestrationFixture f = new OrchestrationFixture();
        f.transport.respond("google", 200, googleAnswer("pong"));

        ConnectionTestResult result = f.orchestration.testConnection("google", "g-key", "gemini 2.5 flash");

        assertThat(result.success()).isTrue();
        assertThat(f.transport.requests().get(0).url()).endsWith("/models/gemini%202.5%20flash:generateContent");
    }

    @Test
    void testConnectionReportsUnusableProxyUrlWithoutThrowing() {
        OrchestrationFixture f = new OrchestrationFixture().withApiUrl("google", "https://proxy.example.com/a b/models");

        ConnectionTestResult result = f.orchestration.testConnection("google", "g-key", null);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("Invalid request URL");
        assertThat(f.transport.requests()).isEmpty();
        assertThat(f.state("google").healthStatus()).isEqualTo(HealthStatus.ERROR);
    }
}
