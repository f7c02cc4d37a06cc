package io.kubedevice.reconcile;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeStatus;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubedevice.codec.DeviceInfoCodec;
import io.kubedevice.exceptions.DeserializationException;
import io.kubedevice.models.ContainerInfo;
import io.kubedevice.models.NodeInfo;
import io.kubedevice.models.PodInfo;
import io.kubedevice.models.ResourceList;
import io.kubedevice.models.ResourceLocation;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the device scheduler view of nodes and pods from their live Kubernetes objects.
 * <p>
 * Private state is decoded from the device info annotation, then the fields Kubernetes is
 * authoritative for (node capacity and allocatable, container requests) are copied over it.
 */
@Slf4j
public class DeviceInfoReconciler {

    private final DeviceInfoCodec codec;

    public DeviceInfoReconciler(DeviceInfoCodec codec) {
        this.codec = codec;
    }

    /**
     * Decode node info from the annotations of {@code meta}.
     * <p>
     * Usage counters from {@code existing} replace decoded ones on key collision, since the
     * annotation may have been written from older counters than the caller holds.
     *
     * @param meta live node metadata
     * @param existing node info cached by the caller, may be null
     * @return the reconciled node info, kubeCap and kubeAlloc untouched
     * @throws DeserializationException if the annotation is present but malformed
     */
    public NodeInfo reconcileNodeMetadata(ObjectMeta meta, NodeInfo existing) throws DeserializationException {
        ObjectMeta nodeMeta = meta != null ? meta : new ObjectMeta();
        NodeInfo nodeInfo = codec.nodeInfoFromAnnotations(nodeMeta);
        if (nodeInfo.getName().isBlank()) {
            nodeInfo.setName(Objects.toString(nodeMeta.getName(), ""));
        }
        if (existing != null && existing.getUsed() != null) {
            nodeInfo.getUsed().putAll(existing.getUsed());
        }
        log.debug("Annotations: {} converted to NodeInfo: {}", nodeMeta.getAnnotations(), nodeInfo);
        return nodeInfo;
    }

    /**
     * Reconcile node metadata, then copy capacity and allocatable from the node status.
     */
    public NodeInfo reconcileNode(Node node, NodeInfo existing) throws DeserializationException {
        NodeInfo nodeInfo = reconcileNodeMetadata(node.getMetadata(), existing);
        NodeStatus status = node.getStatus();
        if (status != null) {
            Quantities.forEachValue(status.getCapacity(), nodeInfo.getKubeCap()::put);
            Quantities.forEachValue(status.getAllocatable(), nodeInfo.getKubeAlloc()::put);
        }
        return nodeInfo;
    }

    /**
     * Build pod info from the annotation and the live container specs.
     * <p>
     * With {@code invalidate} set, previous device assignments are discarded: every container
     * gets an empty allocateFrom and devRequests equal to its requests, and the pod loses its
     * device scheduler node assignment. Invalidating twice gives the same result as once.
     *
     * @param pod live pod
     * @param invalidate whether recorded allocations should be forgotten
     * @throws DeserializationException if the annotation is present but malformed
     */
    public PodInfo reconcilePod(Pod pod, boolean invalidate) throws DeserializationException {
        ObjectMeta meta = pod.getMetadata() != null ? pod.getMetadata() : new ObjectMeta();
        PodInfo podInfo = codec.podInfoFromAnnotations(meta);
        podInfo.setName(Objects.toString(meta.getName(), ""));

        List<Container> initContainers = pod.getSpec() != null ? pod.getSpec().getInitContainers() : null;
        List<Container> containers = pod.getSpec() != null ? pod.getSpec().getContainers() : null;
        mergeContainers(podInfo.getInitContainers(), initContainers, invalidate);
        mergeContainers(podInfo.getRunningContainers(), containers, invalidate);
        if (invalidate) {
            podInfo.setNodeName("");
        }
        log.debug("Kubernetes pod: {} converted to device scheduler pod info: {}", meta.getName(), podInfo);
        return podInfo;
    }

    private static void mergeContainers(Map<String, ContainerInfo> containerInfos,
                                        List<Container> containers,
                                        boolean invalidate) {
        if (containers != null) {
            for (Container container : containers) {
                ContainerInfo info = containerInfos.computeIfAbsent(container.getName(), name -> new ContainerInfo());
                info.fill();
                if (container.getResources() != null) {
                    Quantities.forEachValue(container.getResources().getRequests(), info.getKubeRequests()::put);
                }
            }
        }
        if (invalidate) {
            // includes containers recorded earlier that are no longer in the pod spec
            containerInfos.replaceAll((name, info) -> {
                ContainerInfo filled = info != null ? info.fill() : new ContainerInfo();
                filled.setAllocateFrom(new ResourceLocation());
                filled.setDevRequests(new ResourceList(filled.getRequests()));
                return filled;
            });
        }
    }
}
