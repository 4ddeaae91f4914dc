package com.phillippitts.wordassist.exception;

/**
 * Thrown when the configuration blob cannot be read from or written to its backing store.
 */
public class ConfigStorageException extends WordAssistException {

    private final String location;

    public ConfigStorageException(String message, String location, Throwable cause) {
        super(ErrorKind.STORAGE, message + " (location: " + location + ")", cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
