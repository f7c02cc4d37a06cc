package io.kubedevice.store;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.kubedevice.exceptions.ObjectNotFoundException;
import lombok.extern.slf4j.Slf4j;

import static io.kubedevice.config.Constants.KIND_NODE;
import static io.kubedevice.config.Constants.KIND_POD;

/**
 * fabric8-based implementation of ObjectStore.
 */
@Slf4j
public class KubernetesObjectStore<T extends HasMetadata> implements ObjectStore<T> {

    private static final PatchContext STRATEGIC_MERGE = PatchContext.of(PatchType.STRATEGIC_MERGE);

    private final KubernetesClient client;
    private final Class<T> type;
    private final String kind;

    public KubernetesObjectStore(KubernetesClient client, Class<T> type, String kind) {
        this.client = client;
        this.type = type;
        this.kind = kind;
    }

    public static KubernetesObjectStore<Node> forNodes(KubernetesClient client) {
        return new KubernetesObjectStore<>(client, Node.class, KIND_NODE);
    }

    public static KubernetesObjectStore<Pod> forPods(KubernetesClient client) {
        return new KubernetesObjectStore<>(client, Pod.class, KIND_POD);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public T get(String namespace, String name) throws ObjectNotFoundException {
        log.debug("Getting {} {} from Kubernetes", kind, describe(namespace, name));
        T object = named(namespace, name).get();
        if (object == null) {
            log.warn("{} {} not found", kind, describe(namespace, name));
            throw new ObjectNotFoundException(kind, namespace, name);
        }
        return object;
    }

    @Override
    public T patch(String namespace, String name, String patch, SubResource subResource) {
        Resource<T> resource = named(namespace, name);
        if (subResource.getPath() == null) {
            return resource.patch(STRATEGIC_MERGE, patch);
        }
        return resource.subresource(subResource.getPath()).patch(STRATEGIC_MERGE, patch);
    }

    @Override
    public T update(T object) {
        String namespace = object.getMetadata().getNamespace();
        MixedOperation<T, KubernetesResourceList<T>, Resource<T>> operation = client.resources(type);
        Resource<T> resource = namespace == null
                ? operation.resource(object)
                : operation.inNamespace(namespace).resource(object);
        return resource.update();
    }

    private Resource<T> named(String namespace, String name) {
        MixedOperation<T, KubernetesResourceList<T>, Resource<T>> operation = client.resources(type);
        return namespace == null
                ? operation.withName(name)
                : operation.inNamespace(namespace).withName(name);
    }

    private static String describe(String namespace, String name) {
        return namespace == null ? name : namespace + "/" + name;
    }
}
