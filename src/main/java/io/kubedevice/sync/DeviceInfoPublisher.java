package io.kubedevice.sync;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubedevice.codec.DeviceInfoCodec;
import io.kubedevice.exceptions.DeviceStateException;
import io.kubedevice.models.NodeInfo;
import io.kubedevice.models.PodInfo;
import io.kubedevice.reconcile.DeviceInfoReconciler;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes device state of nodes and pods against the live objects.
 * <p>
 * Node state is written by the device advertiser running on each node; pod state by the
 * scheduler once it has picked devices.
 */
@Slf4j
public class DeviceInfoPublisher {

    private final DeviceInfoCodec codec;
    private final DeviceInfoReconciler reconciler;
    private final ObjectUpdater<Node> nodeUpdater;
    private final ObjectUpdater<Pod> podUpdater;

    public DeviceInfoPublisher(DeviceInfoCodec codec,
                               DeviceInfoReconciler reconciler,
                               ObjectUpdater<Node> nodeUpdater,
                               ObjectUpdater<Pod> podUpdater) {
        this.codec = codec;
        this.reconciler = reconciler;
        this.nodeUpdater = nodeUpdater;
        this.podUpdater = podUpdater;
    }

    public NodeInfo readNodeInfo(String nodeName, NodeInfo existing) throws DeviceStateException {
        Node node = nodeUpdater.getStore().get(null, nodeName);
        return reconciler.reconcileNode(node, existing);
    }

    public PodInfo readPodInfo(String namespace, String podName, boolean invalidate) throws DeviceStateException {
        Pod pod = podUpdater.getStore().get(namespace, podName);
        return reconciler.reconcilePod(pod, invalidate);
    }

    /**
     * Write {@code nodeInfo} onto the live node, patching both metadata and status.
     */
    public Node publishNodeInfo(String nodeName, NodeInfo nodeInfo) throws DeviceStateException {
        Node live = nodeUpdater.getStore().get(null, nodeName);
        Node modified = nodeUpdater.copyOf(live);
        codec.nodeInfoToAnnotation(modified.getMetadata(), nodeInfo);
        log.debug("Publishing device info of node {}", nodeName);
        return nodeUpdater.patchMetadataAndStatus(nodeName, live, modified);
    }

    /**
     * Write {@code podInfo} onto the live pod with a metadata patch.
     */
    public Pod publishPodInfo(String namespace, String podName, PodInfo podInfo) throws DeviceStateException {
        Pod live = podUpdater.getStore().get(namespace, podName);
        Pod modified = podUpdater.copyOf(live);
        codec.podInfoToAnnotation(modified.getMetadata(), podInfo);
        log.debug("Publishing device info of pod {}/{}", namespace, podName);
        return podUpdater.patchMetadata(podName, live, modified);
    }

    /**
     * Write {@code podInfo} through a restricted update, for a cached pod that may differ
     * from the live one in fields the store does not allow to change.
     */
    public Pod updatePodInfo(Pod cached, PodInfo podInfo) throws DeviceStateException {
        Pod desired = podUpdater.copyOf(cached);
        codec.podInfoToAnnotation(desired.getMetadata(), podInfo);
        return podUpdater.updateMetadataOnly(desired);
    }
}
