package io.kubedevice.store;

import lombok.Getter;

import static io.kubedevice.config.Constants.SUBRESOURCE_STATUS;

/**
 * Independently versioned facets of an object that are patched with separate calls.
 */
@Getter
public enum SubResource {
    DEFAULT(null, "metadata"),
    STATUS(SUBRESOURCE_STATUS, "status");

    // path segment appended to the object URL, null for the object itself
    private final String path;
    private final String description;

    SubResource(String path, String description) {
        this.path = path;
        this.description = description;
    }
}
