package io.kubedevice.exceptions;

/**
 * Base class for failures while reading or writing device state on Kubernetes objects.
 * All of them are scoped to a single object and returned to the caller.
 */
public class DeviceStateException extends Exception {

    public DeviceStateException(String message) {
        super(message);
    }

    public DeviceStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
