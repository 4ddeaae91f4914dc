package com.phillippitts.wordassist.service.provider;

import com.phillippitts.wordassist.service.provider.wire.AnthropicMessagesWireFormat;
import com.phillippitts.wordassist.service.provider.wire.GoogleGenerativeWireFormat;
import com.phillippitts.wordassist.service.provider.wire.OpenAiLikeWireFormat;
import com.phillippitts.wordassist.service.provider.wire.WireFormat;

/**
 * Wire-format family a provider's API matches. Each mode owns the strategy that builds
 * requests and parses responses for it; there is no fallback mode.
 */
public enum CompatibilityMode {
    OPENAI_LIKE("openai-like", new OpenAiLikeWireFormat()),
    GOOGLE_GENERATIVE("google-generative", new GoogleGenerativeWireFormat()),
    ANTHROPIC_MESSAGES("anthropic-messages", new AnthropicMessagesWireFormat());

    private final String tag;
    private final WireFormat wireFormat;

    CompatibilityMode(String tag, WireFormat wireFormat) {
        this.tag = tag;
        this.wireFormat = wireFormat;
    }

    public String tag() {
        return tag;
    }

    public WireFormat wireFormat() {
        return wireFormat;
    }
}
