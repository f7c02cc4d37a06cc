package io.kubedevice.exceptions;

/**
 * Thrown when two objects cannot be diffed into a patch.
 */
public class DiffException extends DeviceStateException {

    public DiffException(String message) {
        super(message);
    }

    public DiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
