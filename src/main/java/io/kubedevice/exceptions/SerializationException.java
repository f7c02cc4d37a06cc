package io.kubedevice.exceptions;

/**
 * Thrown when a model or object cannot be written as JSON.
 */
public class SerializationException extends DeviceStateException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
