package io.kubedevice.exceptions;

/**
 * Thrown when the object handed to a restricted update is not the object fetched from the store.
 */
public class IdentityMismatchException extends DeviceStateException {

    public IdentityMismatchException(String message) {
        super(message);
    }
}
