package io.kubedevice.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.kubedevice.exceptions.DeviceStateException;
import io.kubedevice.exceptions.IdentityMismatchException;
import io.kubedevice.exceptions.PatchApplyException;
import io.kubedevice.exceptions.SerializationException;
import io.kubedevice.patch.PatchSchema;
import io.kubedevice.patch.StrategicMergePatchBuilder;
import io.kubedevice.store.ObjectStore;
import io.kubedevice.store.SubResource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes local changes of one kind of object back to the store.
 * <p>
 * Changes go out either as strategic merge patches applied to an ordered list of
 * sub-resources, or as a restricted update that resubmits the live object with only its
 * annotations replaced. Neither path retries or locks; concurrent writers are arbitrated by
 * the store's optimistic concurrency.
 *
 * @param <T> object type
 */
@Slf4j
public class ObjectUpdater<T extends HasMetadata> {

    @Getter
    private final ObjectStore<T> store;
    private final StrategicMergePatchBuilder patchBuilder;
    private final PatchSchema schema;
    private final Class<T> type;
    private final ObjectMapper objectMapper;

    public ObjectUpdater(ObjectStore<T> store, StrategicMergePatchBuilder patchBuilder,
                         PatchSchema schema, Class<T> type) {
        this(store, patchBuilder, schema, type,
                new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    /**
     * @param objectMapper mapper used to deep copy objects
     */
    public ObjectUpdater(ObjectStore<T> store, StrategicMergePatchBuilder patchBuilder,
                         PatchSchema schema, Class<T> type, ObjectMapper objectMapper) {
        this.store = store;
        this.patchBuilder = patchBuilder;
        this.schema = schema;
        this.type = type;
        this.objectMapper = objectMapper;
    }

    /**
     * Patch both the object and its status sub-resource with the same patch.
     * <p>
     * If the status patch fails the metadata patch stays applied and the returned exception
     * names {@link SubResource#STATUS}.
     *
     * @return the object returned by the status patch
     */
    public T patchMetadataAndStatus(String name, T original, T modified) throws DeviceStateException {
        String patch = patchBuilder.buildPatch(original, modified, schema);
        return applySteps(namespaceOf(original), name, List.of(
                PatchStep.of(SubResource.DEFAULT, patch),
                PatchStep.of(SubResource.STATUS, patch)));
    }

    /**
     * Patch the object itself, leaving its status sub-resource alone.
     */
    public T patchMetadata(String name, T original, T modified) throws DeviceStateException {
        String patch = patchBuilder.buildPatch(original, modified, schema);
        return applySteps(namespaceOf(original), name, List.of(PatchStep.of(SubResource.DEFAULT, patch)));
    }

    /**
     * Apply patch steps in order, stopping at the first failure. Steps already applied are
     * not rolled back.
     *
     * @return the object returned by the last step
     * @throws PatchApplyException naming the sub-resource of the failed step
     */
    public T applySteps(String namespace, String name, List<PatchStep> steps) throws PatchApplyException {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("At least one patch step is required");
        }
        T updated = null;
        for (PatchStep step : steps) {
            log.trace("Patching {} of {} {}: {}",
                    step.getSubResource().getDescription(), store.getKind(), name, step.getPatch());
            try {
                updated = store.patch(namespace, name, step.getPatch(), step.getSubResource());
            } catch (RuntimeException e) {
                log.error("Failed to patch {} {} for {} {}: {}", step.getSubResource().getDescription(),
                        step.getPatch(), store.getKind(), name, e.getMessage());
                throw new PatchApplyException(store.getKind(), name, step.getSubResource(), e);
            }
            log.trace("Updated {} after {} patch: {}", store.getKind(), step.getSubResource().getDescription(), updated);
        }
        return updated;
    }

    /**
     * Replace the annotations of the live object with those of {@code desired}.
     * <p>
     * For objects whose full update would be rejected because an immutable field (such as a
     * pod's {@code spec.nodeName}) differs between the caller's copy and the live one. The live
     * object is fetched, cloned, given the desired annotations and submitted as a full update,
     * so every other field is sent back exactly as the store has it.
     *
     * @param desired object carrying the desired annotations
     * @return the object as stored after the update
     * @throws IdentityMismatchException if the fetched object has a different name or namespace
     */
    public T updateMetadataOnly(T desired) throws DeviceStateException {
        ObjectMeta desiredMeta = desired.getMetadata();
        T live = store.get(desiredMeta.getNamespace(), desiredMeta.getName());
        ObjectMeta liveMeta = live.getMetadata();
        if (!Objects.equals(desiredMeta.getName(), liveMeta.getName())
                || !Objects.equals(desiredMeta.getNamespace(), liveMeta.getNamespace())) {
            log.error("Refusing to update {} {}/{}: store returned {}/{}", store.getKind(),
                    desiredMeta.getNamespace(), desiredMeta.getName(), liveMeta.getNamespace(), liveMeta.getName());
            throw new IdentityMismatchException(String.format(
                    "Desired %s %s/%s does not match live %s/%s", store.getKind(),
                    desiredMeta.getNamespace(), desiredMeta.getName(),
                    liveMeta.getNamespace(), liveMeta.getName()));
        }

        T modified = copyOf(live);
        Map<String, String> annotations = desiredMeta.getAnnotations();
        modified.getMetadata().setAnnotations(annotations != null ? new LinkedHashMap<>(annotations) : null);
        log.debug("Updating annotations of {} {}/{}", store.getKind(), liveMeta.getNamespace(), liveMeta.getName());
        return store.update(modified);
    }

    /**
     * Deep copy of {@code object}, sharing no state with it.
     */
    public T copyOf(T object) throws SerializationException {
        try {
            return objectMapper.treeToValue(objectMapper.valueToTree(object), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException("Failed to copy " + store.getKind() + " "
                    + object.getMetadata().getName(), e);
        }
    }

    private static String namespaceOf(HasMetadata object) {
        return object.getMetadata() != null ? object.getMetadata().getNamespace() : null;
    }
}
