package io.kubedevice.sync;

import io.kubedevice.store.SubResource;
import lombok.Value;

/**
 * One patch call in an ordered sequence: the sub-resource it targets and the patch body.
 */
@Value
public class PatchStep {
    SubResource subResource;
    String patch;

    public static PatchStep of(SubResource subResource, String patch) {
        return new PatchStep(subResource, patch);
    }
}
