package com.phillippitts.wordassist.domain;

/**
 * Outcome of a credential test against one provider.
 *
 * @param success whether the provider answered the probe
 * @param message provider reply preview on success, failure message otherwise
 */
public record ConnectionTestResult(boolean success, String message) {

    public static ConnectionTestResult ok(String message) {
        return new ConnectionTestResult(true, message);
    }

    public static ConnectionTestResult failed(String message) {
        return new ConnectionTestResult(false, message);
    }
}
