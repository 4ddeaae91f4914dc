package com.phillippitts.wordassist.exception;

/**
 * Thrown when a provider cannot be called because of configuration: unknown provider id,
 * missing API key or missing model. Fatal to that provider's attempt and never retried.
 */
public class ProviderConfigurationException extends WordAssistException {

    private final String providerId;

    public ProviderConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
        this.providerId = "unknown";
    }

    public ProviderConfigurationException(String message, String providerId) {
        super(ErrorKind.CONFIGURATION, message + " (provider: " + providerId + ")");
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
