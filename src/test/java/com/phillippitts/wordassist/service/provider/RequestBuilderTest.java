package com.phillippitts.wordassist.service.provider;

import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.domain.GenerationOptions;
import com.phillippitts.wordassist.exception.ProviderConfigurationException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestBuilderTest {

    private final OrchestrationProperties props = new OrchestrationProperties();
    private final ProviderRegistry registry = new ProviderRegistry(props);
    private final RequestBuilder builder = new RequestBuilder(props);

    private static final GenerationOptions OPTIONS = new GenerationOptions(0.5, 512);

    @Test
    void buildsOpenAiChatCompletion() {
        PreparedRequest request = builder.build(registry.require("openai"),
                new RequestContext("sk-1", "gpt-5.2", "hello", OPTIONS));

        assertThat(request.url()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers()).containsEntry("Authorization", "Bearer sk-1")
                .containsEntry("Content-Type", "application/json");
        JSONObject body = new JSONObject(request.body());
        assertThat(body.getString("model")).isEqualTo("gpt-5.2");
        assertThat(body.getJSONArray("messages").getJSONObject(0).getString("role")).isEqualTo("user");
        assertThat(body.getJSONArray("messages").getJSONObject(0).getString("content")).isEqualTo("hello");
        assertThat(body.getDouble("temperature")).isEqualTo(0.5);
        assertThat(body.getInt("max_tokens")).isEqualTo(512);
    }

    @Test
    void buildsGoogleGenerateContent() {
        PreparedRequest request = builder.build(registry.require("google"),
                new RequestContext("g-1", "gemini-2.5-flash", "hello", OPTIONS));

        assertThat(request.url()).isEqualTo(
                "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:generateContent");
        assertThat(request.headers()).containsEntry("x-goog-api-key", "g-1").doesNotContainKey("Authorization");
        JSONObject body = new JSONObject(request.body());
        assertThat(body.getJSONArray("contents").getJSONObject(0).getJSONArray("parts").getJSONObject(0)
                .getString("text")).isEqualTo("hello");
        JSONObject config = body.getJSONObject("generationConfig");
        assertThat(config.getDouble("temperature")).isEqualTo(0.5);
        assertThat(config.getInt("maxOutputTokens")).isEqualTo(512);
        assertThat(config.getDouble("topP")).isEqualTo(0.8);
        assertThat(config.getInt("topK")).isEqualTo(10);
    }

    @Test
    void buildsAnthropicMessages() {
        PreparedRequest request = builder.build(registry.require("claude"),
                new RequestContext("a-1", "claude-haiku-4-5", "hello", OPTIONS));

        assertThat(request.url()).isEqualTo("https://api.anthropic.com/v1/messages");
        assertThat(request.headers()).containsEntry("x-api-key", "a-1").containsEntry("anthropic-version", "2023-06-01");
        JSONObject body = new JSONObject(request.body());
        assertThat(body.getString("model")).isEqualTo("claude-haiku-4-5");
        assertThat(body.getInt("max_tokens")).isEqualTo(512);
        assertThat(body.getDouble("temperature")).isEqualTo(0.5);
    }

    @Test
    void appliesConfiguredDefaultsWhenOptionsAreAbsent() {
        PreparedRequest request = builder.build(registry.require("openai"),
                new RequestContext("sk-1", "gpt-5.2", "hello", null));

        JSONObject body = new JSONObject(request.body());
        assertThat(body.getDouble("temperature")).isEqualTo(0.3);
        assertThat(body.getInt("max_tokens")).isEqualTo(2000);
    }

    @Test
    void usesOverrideBaseUrl() {
        PreparedRequest request = builder.build(registry.require("anthropic"),
                new RequestContext("a-1", "claude-haiku-4-5", "hi", null, "https://gateway.local/anthropic/v1//"));

        assertThat(request.url()).isEqualTo("https://gateway.local/anthropic/v1/messages");
    }

    @Test
    void encodesGoogleModelAsPathSegment() {
        PreparedRequest request = builder.build(registry.require("google"),
                new RequestContext("g-1", "tuned models/v 2#a", "hi", null));

        assertThat(request.url()).isEqualTo(
                "https://generativelanguage.googleapis.com/v1beta/models/tuned%20models%2Fv%202%23a:generateContent");
    }

    @Test
    void rejectsOverrideThatIsNotAUsableUrl() {
        ProviderDescriptor anthropic = registry.require("anthropic");

        assertThatThrownBy(() -> builder.build(anthropic,
                new RequestContext("a-1", "claude-haiku-4-5", "hi", null, "https://gateway.local/my proxy")))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageStartingWith("Invalid request URL: https://gateway.local/my proxy/messages");
        assertThatThrownBy(() -> builder.build(anthropic,
                new RequestContext("a-1", "claude-haiku-4-5", "hi", null, "gateway/v1")))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageStartingWith("Request URL is not absolute");
    }

    @Test
    void rejectsMissingKeyOrModel() {
        ProviderDescriptor openai = registry.require("openai");

        assertThatThrownBy(() -> builder.build(openai, new RequestContext(" ", "gpt-5.2", "hi", null)))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessage("Missing API key (provider: openai)");
        assertThatThrownBy(() -> builder.build(openai, new RequestContext("sk", "", "hi", null)))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessage("Missing model name (provider: openai)");
    }

    @Test
    void toStringHidesHeaderValues() {
        PreparedRequest request = builder.build(registry.require("openai"),
                new RequestContext("sk-secret", "gpt-5.2", "hello", null));

        assertThat(request.toString()).contains("Authorization").doesNotContain("sk-secret");
    }

    @Test
    void buildUrlNormalizesSlashes() {
        assertThat(RequestBuilder.buildUrl("https://a.example/v1", null, "messages"))
                .isEqualTo("https://a.example/v1/messages");
        assertThat(RequestBuilder.buildUrl("https://a.example/v1", " ", "/messages"))
                .isEqualTo("https://a.example/v1/messages");
    }
}
