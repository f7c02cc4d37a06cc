package io.kubedevice.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kubedevice.exceptions.DiffException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.kubedevice.config.Constants.DELETE_FROM_PRIMITIVE_LIST_PREFIX;
import static io.kubedevice.config.Constants.PATCH_DIRECTIVE;
import static io.kubedevice.config.Constants.PATCH_DIRECTIVE_DELETE;
import static io.kubedevice.config.Constants.SET_ELEMENT_ORDER_PREFIX;

/**
 * Computes two-way strategic merge patches between two versions of an object.
 * <p>
 * The patch holds only the fields that differ, so applying it on the server leaves every
 * other field as the server currently has it, including fields written by someone else since
 * the original was read. Map keys missing from the modified object are deleted with
 * {@code null}. Lists follow the {@link PatchSchema}: atomic lists are replaced, keyed lists
 * are patched element by element, primitive sets get additions and
 * {@code $deleteFromPrimitiveList} removals.
 */
@Slf4j
public class StrategicMergePatchBuilder {

    private final ObjectMapper objectMapper;

    public StrategicMergePatchBuilder() {
        this(new ObjectMapper());
    }

    public StrategicMergePatchBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Build the patch turning {@code original} into {@code modified}.
     *
     * @param original object as last read from the store
     * @param modified desired object
     * @param schema merge strategies of the object kind
     * @return the patch document as JSON, {@code {}} if nothing changed
     * @throws DiffException if either object does not serialize to a JSON object
     */
    public String buildPatch(Object original, Object modified, PatchSchema schema) throws DiffException {
        ObjectNode originalTree = toTree(original, "original", schema);
        ObjectNode modifiedTree = toTree(modified, "modified", schema);
        ObjectNode patch = diffObjects(originalTree, modifiedTree, "", schema);
        try {
            return objectMapper.writeValueAsString(patch);
        } catch (JsonProcessingException e) {
            throw new DiffException("Failed to write patch for " + schema.getKind(), e);
        }
    }

    private ObjectNode toTree(Object object, String role, PatchSchema schema) throws DiffException {
        if (object == null) {
            throw new DiffException("Cannot diff null " + role + " " + schema.getKind());
        }
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(object);
        } catch (IllegalArgumentException e) {
            log.error("Failed to serialize {} {}: {}", role, schema.getKind(), e.getMessage());
            throw new DiffException("Failed to serialize " + role + " " + schema.getKind(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new DiffException(role + " " + schema.getKind() + " does not serialize to a JSON object");
        }
        return (ObjectNode) tree;
    }

    private ObjectNode diffObjects(ObjectNode original, ObjectNode modified, String path, PatchSchema schema) {
        ObjectNode patch = objectMapper.createObjectNode();

        Iterator<Map.Entry<String, JsonNode>> fields = modified.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode modifiedValue = field.getValue();
            JsonNode originalValue = original.get(key);

            if (isAbsent(modifiedValue)) {
                if (!isAbsent(originalValue)) {
                    patch.putNull(key);
                }
            } else if (isAbsent(originalValue)) {
                patch.set(key, modifiedValue.deepCopy());
            } else if (!originalValue.equals(modifiedValue)) {
                diffValues(patch, key, originalValue, modifiedValue, childPath(path, key), schema);
            }
        }

        Iterator<Map.Entry<String, JsonNode>> originalFields = original.fields();
        while (originalFields.hasNext()) {
            Map.Entry<String, JsonNode> field = originalFields.next();
            if (!modified.has(field.getKey()) && !isAbsent(field.getValue())) {
                patch.putNull(field.getKey());
            }
        }
        return patch;
    }

    private void diffValues(ObjectNode patch, String key, JsonNode original, JsonNode modified,
                            String path, PatchSchema schema) {
        if (original.isObject() && modified.isObject()) {
            ObjectNode nested = diffObjects((ObjectNode) original, (ObjectNode) modified, path, schema);
            if (nested.size() > 0) {
                patch.set(key, nested);
            }
        } else if (original.isArray() && modified.isArray()) {
            diffLists(patch, key, (ArrayNode) original, (ArrayNode) modified, path, schema);
        } else {
            patch.set(key, modified.deepCopy());
        }
    }

    private void diffLists(ObjectNode patch, String key, ArrayNode original, ArrayNode modified,
                           String path, PatchSchema schema) {
        ListStrategy strategy = schema.strategyFor(path);
        boolean merged = switch (strategy.getType()) {
            case MERGE_ON_KEY -> diffKeyedList(patch, key, original, modified, strategy.getMergeKey(), path, schema);
            case MERGE_PRIMITIVES -> diffPrimitiveList(patch, key, original, modified);
            case REPLACE -> false;
        };
        if (!merged) {
            patch.set(key, modified.deepCopy());
        }
    }

    /**
     * @return false if an element lacks the merge key and the list has to be replaced instead
     */
    private boolean diffKeyedList(ObjectNode patch, String key, ArrayNode original, ArrayNode modified,
                                  String mergeKey, String path, PatchSchema schema) {
        Map<JsonNode, ObjectNode> originalByKey = indexByMergeKey(original, mergeKey);
        Map<JsonNode, ObjectNode> modifiedByKey = indexByMergeKey(modified, mergeKey);
        if (originalByKey == null || modifiedByKey == null) {
            return false;
        }

        ArrayNode listPatch = objectMapper.createArrayNode();
        for (Map.Entry<JsonNode, ObjectNode> entry : modifiedByKey.entrySet()) {
            ObjectNode originalElement = originalByKey.get(entry.getKey());
            if (originalElement == null) {
                listPatch.add(entry.getValue().deepCopy());
                continue;
            }
            ObjectNode elementPatch = diffObjects(originalElement, entry.getValue(), path, schema);
            if (elementPatch.size() > 0) {
                ObjectNode keyed = objectMapper.createObjectNode();
                keyed.set(mergeKey, entry.getKey().deepCopy());
                keyed.setAll(elementPatch);
                listPatch.add(keyed);
            }
        }
        for (JsonNode originalKey : originalByKey.keySet()) {
            if (!modifiedByKey.containsKey(originalKey)) {
                ObjectNode deletion = objectMapper.createObjectNode();
                deletion.set(mergeKey, originalKey.deepCopy());
                deletion.put(PATCH_DIRECTIVE, PATCH_DIRECTIVE_DELETE);
                listPatch.add(deletion);
            }
        }

        boolean reordered = !commonOrder(originalByKey.keySet(), modifiedByKey.keySet())
                .equals(commonOrder(modifiedByKey.keySet(), originalByKey.keySet()));
        if (listPatch.size() > 0 || reordered) {
            ArrayNode order = objectMapper.createArrayNode();
            for (JsonNode modifiedKey : modifiedByKey.keySet()) {
                order.addObject().set(mergeKey, modifiedKey.deepCopy());
            }
            patch.set(SET_ELEMENT_ORDER_PREFIX + key, order);
            if (listPatch.size() > 0) {
                patch.set(key, listPatch);
            }
        }
        return true;
    }

    /**
     * @return false if the list holds anything other than scalars
     */
    private boolean diffPrimitiveList(ObjectNode patch, String key, ArrayNode original, ArrayNode modified) {
        List<JsonNode> originalValues = new ArrayList<>();
        List<JsonNode> modifiedValues = new ArrayList<>();
        for (JsonNode value : original) {
            if (value.isContainerNode()) {
                return false;
            }
            originalValues.add(value);
        }
        for (JsonNode value : modified) {
            if (value.isContainerNode()) {
                return false;
            }
            modifiedValues.add(value);
        }

        ArrayNode added = objectMapper.createArrayNode();
        ArrayNode removed = objectMapper.createArrayNode();
        modifiedValues.stream().filter(v -> !originalValues.contains(v)).distinct().forEach(added::add);
        originalValues.stream().filter(v -> !modifiedValues.contains(v)).distinct().forEach(removed::add);
        boolean reordered = !commonOrder(originalValues, modifiedValues)
                .equals(commonOrder(modifiedValues, originalValues));

        if (added.size() > 0 || removed.size() > 0 || reordered) {
            patch.set(SET_ELEMENT_ORDER_PREFIX + key, modified.deepCopy());
            if (added.size() > 0) {
                patch.set(key, added);
            }
            if (removed.size() > 0) {
                patch.set(DELETE_FROM_PRIMITIVE_LIST_PREFIX + key, removed);
            }
        }
        return true;
    }

    private static Map<JsonNode, ObjectNode> indexByMergeKey(ArrayNode list, String mergeKey) {
        Map<JsonNode, ObjectNode> byKey = new LinkedHashMap<>();
        for (JsonNode element : list) {
            if (!element.isObject() || isAbsent(element.get(mergeKey))) {
                return null;
            }
            byKey.put(element.get(mergeKey), (ObjectNode) element);
        }
        return byKey;
    }

    // elements of first that also appear in second, in first's order
    private static List<JsonNode> commonOrder(Iterable<JsonNode> first, Iterable<JsonNode> second) {
        Set<JsonNode> present = new HashSet<>();
        second.forEach(present::add);
        List<JsonNode> common = new ArrayList<>();
        for (JsonNode value : first) {
            if (present.contains(value)) {
                common.add(value);
            }
        }
        return common;
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull();
    }

    private static String childPath(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
}
