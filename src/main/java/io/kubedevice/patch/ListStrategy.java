package io.kubedevice.patch;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How a list field is merged by a strategic merge patch.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ListStrategy {

    public enum Type {
        /** The list is atomic and replaced whole when it changes. */
        REPLACE,
        /** Object elements are matched on a merge key and patched individually. */
        MERGE_ON_KEY,
        /** Scalar elements are treated as a set. */
        MERGE_PRIMITIVES
    }

    private static final ListStrategy REPLACE = new ListStrategy(Type.REPLACE, null);
    private static final ListStrategy MERGE_PRIMITIVES = new ListStrategy(Type.MERGE_PRIMITIVES, null);

    private final Type type;
    private final String mergeKey;

    private ListStrategy(Type type, String mergeKey) {
        this.type = type;
        this.mergeKey = mergeKey;
    }

    public static ListStrategy replace() {
        return REPLACE;
    }

    public static ListStrategy mergeOnKey(String mergeKey) {
        if (mergeKey == null || mergeKey.isBlank()) {
            throw new IllegalArgumentException("Merge key must not be blank");
        }
        return new ListStrategy(Type.MERGE_ON_KEY, mergeKey);
    }

    public static ListStrategy mergePrimitives() {
        return MERGE_PRIMITIVES;
    }
}
