package io.kubedevice.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device scheduler view of a node.
 * <p>
 * {@code kubeCap} and {@code kubeAlloc} mirror the node status reported by Kubernetes and are
 * overwritten on every read. {@code used} is owned by the scheduler, cannot be derived from
 * Kubernetes and is only ever merged into, never replaced.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class NodeInfo {

    @JsonProperty("name")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String name = "";

    @JsonProperty("kubecap")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceList kubeCap = new ResourceList();

    @JsonProperty("kubealloc")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceList kubeAlloc = new ResourceList();

    @JsonProperty("used")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceList used = new ResourceList();

    // fields written by other model versions, carried through untouched
    @JsonIgnore
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public NodeInfo() {
    }

    public NodeInfo(String name) {
        this.name = name;
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String key, Object value) {
        additionalProperties.put(key, value);
    }
}
