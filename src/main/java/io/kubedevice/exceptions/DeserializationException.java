package io.kubedevice.exceptions;

/**
 * Thrown when a device info annotation is present but is not valid serialized state.
 */
public class DeserializationException extends DeviceStateException {

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
