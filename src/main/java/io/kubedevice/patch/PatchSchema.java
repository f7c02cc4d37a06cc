package io.kubedevice.patch;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.kubedevice.config.Constants.KIND_NODE;
import static io.kubedevice.config.Constants.KIND_POD;

/**
 * Merge strategy of each list field of an object kind, keyed by dotted JSON path with array
 * indices left out (for example {@code spec.containers.env}). Lists not declared here are
 * atomic.
 */
public final class PatchSchema {

    private static final List<String> CONTAINER_LISTS =
            List.of("spec.containers", "spec.initContainers", "spec.ephemeralContainers");

    @Getter
    private final String kind;
    private final Map<String, ListStrategy> listStrategies;

    private PatchSchema(String kind, Map<String, ListStrategy> listStrategies) {
        this.kind = kind;
        this.listStrategies = Collections.unmodifiableMap(new LinkedHashMap<>(listStrategies));
    }

    public ListStrategy strategyFor(String path) {
        return listStrategies.getOrDefault(path, ListStrategy.replace());
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    /**
     * Merge keys of core/v1 Node.
     */
    public static PatchSchema forNode() {
        return builder(KIND_NODE)
                .objectMeta()
                .list("spec.podCIDRs", ListStrategy.mergePrimitives())
                .list("status.conditions", ListStrategy.mergeOnKey("type"))
                .list("status.addresses", ListStrategy.mergeOnKey("type"))
                .build();
    }

    /**
     * Merge keys of core/v1 Pod.
     */
    public static PatchSchema forPod() {
        Builder builder = builder(KIND_POD).objectMeta();
        for (String containers : CONTAINER_LISTS) {
            builder.list(containers, ListStrategy.mergeOnKey("name"))
                    .list(containers + ".env", ListStrategy.mergeOnKey("name"))
                    .list(containers + ".ports", ListStrategy.mergeOnKey("containerPort"))
                    .list(containers + ".volumeMounts", ListStrategy.mergeOnKey("mountPath"))
                    .list(containers + ".volumeDevices", ListStrategy.mergeOnKey("devicePath"));
        }
        return builder
                .list("spec.volumes", ListStrategy.mergeOnKey("name"))
                .list("spec.imagePullSecrets", ListStrategy.mergeOnKey("name"))
                .list("spec.hostAliases", ListStrategy.mergeOnKey("ip"))
                .list("spec.topologySpreadConstraints", ListStrategy.mergeOnKey("topologyKey"))
                .list("spec.resourceClaims", ListStrategy.mergeOnKey("name"))
                .list("spec.schedulingGates", ListStrategy.mergeOnKey("name"))
                .list("status.conditions", ListStrategy.mergeOnKey("type"))
                .list("status.podIPs", ListStrategy.mergeOnKey("ip"))
                .list("status.hostIPs", ListStrategy.mergeOnKey("ip"))
                .build();
    }

    public static final class Builder {

        private final String kind;
        private final Map<String, ListStrategy> listStrategies = new LinkedHashMap<>();

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder list(String path, ListStrategy strategy) {
            listStrategies.put(path, strategy);
            return this;
        }

        /**
         * Lists shared by every object's metadata.
         */
        public Builder objectMeta() {
            return list("metadata.ownerReferences", ListStrategy.mergeOnKey("uid"))
                    .list("metadata.finalizers", ListStrategy.mergePrimitives());
        }

        public PatchSchema build() {
            return new PatchSchema(kind, listStrategies);
        }
    }
}
