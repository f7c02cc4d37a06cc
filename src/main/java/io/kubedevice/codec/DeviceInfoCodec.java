package io.kubedevice.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.kubedevice.exceptions.DeserializationException;
import io.kubedevice.exceptions.SerializationException;
import io.kubedevice.models.NodeInfo;
import io.kubedevice.models.PodInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.kubedevice.config.Constants.DEVICE_INFO_ANNOTATION;

/**
 * Converts device scheduler state to and from the {@code KubeDevice/DeviceInfo} annotation.
 * <p>
 * A missing annotation means no state has been recorded yet and decodes to an empty model.
 * An annotation that is present but unreadable was corrupted by an earlier writer and is
 * reported as a {@link DeserializationException}. Unknown fields are tolerated and kept.
 */
@Slf4j
public class DeviceInfoCodec {

    private final ObjectMapper objectMapper;

    public DeviceInfoCodec() {
        this(strictObjectMapper());
    }

    public DeviceInfoCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper that keeps unknown fields but rejects amounts that are not JSON integers,
     * such as {@code 1.5} or {@code "2"}, instead of truncating or converting them.
     */
    public static ObjectMapper strictObjectMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .build();
    }

    public String encodeNodeInfo(NodeInfo nodeInfo) throws SerializationException {
        return encode(nodeInfo, "node info");
    }

    public String encodePodInfo(PodInfo podInfo) throws SerializationException {
        return encode(podInfo, "pod info");
    }

    public NodeInfo decodeNodeInfo(String value) throws DeserializationException {
        NodeInfo nodeInfo = decode(value, NodeInfo.class);
        return nodeInfo != null ? nodeInfo : new NodeInfo();
    }

    public PodInfo decodePodInfo(String value) throws DeserializationException {
        PodInfo podInfo = decode(value, PodInfo.class);
        return podInfo != null ? podInfo : new PodInfo();
    }

    public NodeInfo nodeInfoFromAnnotations(ObjectMeta meta) throws DeserializationException {
        return decodeNodeInfo(annotationValue(meta));
    }

    public PodInfo podInfoFromAnnotations(ObjectMeta meta) throws DeserializationException {
        return decodePodInfo(annotationValue(meta));
    }

    /**
     * Store the encoded node info on {@code meta}, leaving other annotations untouched.
     */
    public void nodeInfoToAnnotation(ObjectMeta meta, NodeInfo nodeInfo) throws SerializationException {
        putAnnotation(meta, encodeNodeInfo(nodeInfo));
        log.debug("NodeInfo: {} converted to annotations: {}", nodeInfo, meta.getAnnotations());
    }

    /**
     * Store the encoded pod info on {@code meta}, leaving other annotations untouched.
     */
    public void podInfoToAnnotation(ObjectMeta meta, PodInfo podInfo) throws SerializationException {
        putAnnotation(meta, encodePodInfo(podInfo));
        log.debug("PodInfo: {} converted to annotations: {}", podInfo, meta.getAnnotations());
    }

    private String encode(Object model, String description) throws SerializationException {
        try {
            return objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} {}: {}", description, model, e.getMessage());
            throw new SerializationException("Failed to serialize " + description, e);
        }
    }

    private <T> T decode(String value, Class<T> type) throws DeserializationException {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.readValue(value, type);
        } catch (JsonProcessingException e) {
            log.error("Annotation {} is not a valid {}: {}", DEVICE_INFO_ANNOTATION, type.getSimpleName(), e.getMessage());
            throw new DeserializationException(
                    "Failed to parse " + DEVICE_INFO_ANNOTATION + " annotation as " + type.getSimpleName(), e);
        }
    }

    private static String annotationValue(ObjectMeta meta) {
        if (meta == null || meta.getAnnotations() == null) {
            return null;
        }
        return meta.getAnnotations().get(DEVICE_INFO_ANNOTATION);
    }

    private static void putAnnotation(ObjectMeta meta, String value) {
        Map<String, String> annotations = meta.getAnnotations();
        if (annotations == null) {
            annotations = new LinkedHashMap<>();
            meta.setAnnotations(annotations);
        }
        annotations.put(DEVICE_INFO_ANNOTATION, value);
    }
}
