package io.kubedevice.exceptions;

import lombok.Getter;

/**
 * Thrown when the store has no object with the requested name.
 */
@Getter
public class ObjectNotFoundException extends DeviceStateException {

    private final String kind;
    private final String namespace;
    private final String name;

    public ObjectNotFoundException(String kind, String namespace, String name) {
        super(namespace == null
                ? String.format("%s '%s' not found", kind, name)
                : String.format("%s '%s/%s' not found", kind, namespace, name));
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
    }
}
