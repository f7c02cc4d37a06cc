package io.kubedevice.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device instance chosen for each requested resource name.
 */
public class ResourceLocation extends LinkedHashMap<String, String> {

    private static final long serialVersionUID = 1L;

    public ResourceLocation() {
        super();
    }

    public ResourceLocation(Map<String, String> locations) {
        super(locations);
    }
}
