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
 * Per-container device state.
 * <ul>
 *   <li>{@code requests}: resource requests as understood by the device scheduler</li>
 *   <li>{@code kubeRequests}: requests declared in the live container spec</li>
 *   <li>{@code devRequests}: device requests still to be satisfied</li>
 *   <li>{@code allocateFrom}: device instance assigned to each resource</li>
 * </ul>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ContainerInfo {

    @JsonProperty("kubereqs")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceList kubeRequests = new ResourceList();

    @JsonProperty("requests")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceList requests = new ResourceList();

    @JsonProperty("devrequests")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceList devRequests = new ResourceList();

    @JsonProperty("allocatefrom")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ResourceLocation allocateFrom = new ResourceLocation();

    @JsonIgnore
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    /**
     * Replaces any map left null by a caller with an empty one.
     *
     * @return this container, for chaining
     */
    public ContainerInfo fill() {
        if (kubeRequests == null) {
            kubeRequests = new ResourceList();
        }
        if (requests == null) {
            requests = new ResourceList();
        }
        if (devRequests == null) {
            devRequests = new ResourceList();
        }
        if (allocateFrom == null) {
            allocateFrom = new ResourceLocation();
        }
        return this;
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
