package com.phillippitts.wordassist.exception;

/**
 * Thrown when an API key cannot be encrypted or decrypted.
 * Decrypt failures are downgraded to an empty key and never reach callers.
 */
public class ApiKeyCryptoException extends WordAssistException {

    private final String providerId;

    public ApiKeyCryptoException(String message, String providerId, Throwable cause) {
        super(ErrorKind.CRYPTO, message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
