package io.kubedevice.store;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubedevice.exceptions.ObjectNotFoundException;

/**
 * Remote repository of one kind of Kubernetes object.
 * <p>
 * Implementations perform a single request per call. Failures of the underlying transport
 * are thrown unchanged as unchecked exceptions; nothing is retried.
 *
 * @param <T> object type
 */
public interface ObjectStore<T extends HasMetadata> {

    /**
     * Kind of object held by this store, e.g. {@code Pod}.
     */
    String getKind();

    /**
     * Fetch the current object.
     *
     * @param namespace namespace, or null for cluster-scoped kinds
     * @param name object name
     * @throws ObjectNotFoundException if no such object exists
     */
    T get(String namespace, String name) throws ObjectNotFoundException;

    /**
     * Apply a strategic merge patch to one sub-resource of the object.
     *
     * @return the object as stored after the patch
     */
    T patch(String namespace, String name, String patch, SubResource subResource);

    /**
     * Replace the object. The store rejects the call if {@code resourceVersion} is stale.
     *
     * @return the object as stored after the update
     */
    T update(T object);
}
