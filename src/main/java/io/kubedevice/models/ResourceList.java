package io.kubedevice.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Amount per resource name, e.g. {@code {"nvidia.com/gpu": 2}}.
 */
public class ResourceList extends LinkedHashMap<String, Long> {

    private static final long serialVersionUID = 1L;

    public ResourceList() {
        super();
    }

    public ResourceList(Map<String, Long> resources) {
        super(resources);
    }

    public static ResourceList of(String name, long amount) {
        ResourceList list = new ResourceList();
        list.put(name, amount);
        return list;
    }
}
