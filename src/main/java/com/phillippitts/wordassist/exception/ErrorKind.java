package com.phillippitts.wordassist.exception;

/**
 * Machine-readable category carried by every {@link WordAssistException}.
 *
 * <p>Callers (HTTP adapter, host UI) branch on the kind instead of inspecting message text.
 */
public enum ErrorKind {
    /** Missing or invalid provider id, API key or model. Not retried. */
    CONFIGURATION,
    /** Network failure, non-2xx status or unparsable success body. Retried per provider policy. */
    TRANSPORT,
    /** AI output has disallowed fields or no content. Retried by the dynamic parsing driver. */
    VALIDATION,
    /** API key could not be encrypted or decrypted. */
    CRYPTO,
    /** Configuration blob could not be read or written. */
    STORAGE,
    /** Every fallback candidate failed or none was eligible. */
    EXHAUSTED
}
