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
 * Device scheduler view of a pod.
 * <p>
 * {@code nodeName} is the device scheduler's own placement decision and is independent of
 * the node the pod is bound to in Kubernetes.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class PodInfo {

    @JsonProperty("podname")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String name = "";

    @JsonProperty("nodename")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String nodeName = "";

    @JsonProperty("initcontainer")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, ContainerInfo> initContainers = new LinkedHashMap<>();

    @JsonProperty("runningcontainer")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, ContainerInfo> runningContainers = new LinkedHashMap<>();

    @JsonIgnore
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public PodInfo() {
    }

    public PodInfo(String name) {
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
