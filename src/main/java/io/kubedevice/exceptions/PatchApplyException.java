package io.kubedevice.exceptions;

import io.kubedevice.store.SubResource;
import lombok.Getter;

/**
 * Thrown when the store rejects or fails a patch on one sub-resource.
 * Patches already applied to earlier sub-resources stay applied.
 */
@Getter
public class PatchApplyException extends DeviceStateException {

    private final String kind;
    private final String name;
    private final SubResource subResource;

    public PatchApplyException(String kind, String name, SubResource subResource, Throwable cause) {
        super(String.format("Failed to patch %s of %s '%s': %s",
                subResource.getDescription(), kind, name, cause.getMessage()), cause);
        this.kind = kind;
        this.name = name;
        this.subResource = subResource;
    }
}
