package io.kubedevice.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.kubedevice.codec.DeviceInfoCodec;
import io.kubedevice.models.ContainerInfo;
import io.kubedevice.models.NodeInfo;
import io.kubedevice.models.PodInfo;
import io.kubedevice.models.ResourceList;
import io.kubedevice.patch.PatchSchema;
import io.kubedevice.patch.StrategicMergePatchBuilder;
import io.kubedevice.reconcile.DeviceInfoReconciler;
import io.kubedevice.store.ObjectStore;
import io.kubedevice.store.SubResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static io.kubedevice.config.Constants.DEVICE_INFO_ANNOTATION;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for DeviceInfoPublisher, wired with real codec, reconciler and patch builder.
 */
@ExtendWith(MockitoExtension.class)
class DeviceInfoPublisherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ObjectStore<Node> nodeStore;

    @Mock
    private ObjectStore<Pod> podStore;

    private DeviceInfoCodec codec;
    private DeviceInfoPublisher publisher;

    @BeforeEach
    void setUp() {
        lenient().when(nodeStore.getKind()).thenReturn("Node");
        lenient().when(podStore.getKind()).thenReturn("Pod");
        codec = new DeviceInfoCodec();
        StrategicMergePatchBuilder patchBuilder = new StrategicMergePatchBuilder();
        publisher = new DeviceInfoPublisher(codec, new DeviceInfoReconciler(codec),
                new ObjectUpdater<>(nodeStore, patchBuilder, PatchSchema.forNode(), Node.class),
                new ObjectUpdater<>(podStore, patchBuilder, PatchSchema.forPod(), Pod.class));
    }

    private Node liveNode() {
        return new NodeBuilder()
                .withNewMetadata()
                .withName("node-1")
                .withResourceVersion("3")
                .addToLabels("zone", "a")
                .addToAnnotations("owner", "infra")
                .endMetadata()
                .withNewStatus()
                .addToCapacity("nvidia.com/gpu", new Quantity("8"))
                .addToAllocatable("nvidia.com/gpu", new Quantity("8"))
                .endStatus()
                .build();
    }

    private Pod livePod(String nodeName) {
        return new PodBuilder()
                .withNewMetadata()
                .withName("pod-1")
                .withNamespace("default")
                .withResourceVersion("9")
                .addToAnnotations("owner", "infra")
                .endMetadata()
                .withNewSpec()
                .withNodeName(nodeName)
                .addNewContainer()
                .withName("main")
                .withNewResources().addToRequests("nvidia.com/gpu", new Quantity("2")).endResources()
                .endContainer()
                .endSpec()
                .build();
    }

    @Test
    void testPublishNodeInfoPatchesAnnotationOnBothSubResources() throws Exception {
        Node live = liveNode();
        when(nodeStore.get(null, "node-1")).thenReturn(live);
        when(nodeStore.patch(isNull(), eq("node-1"), anyString(), any(SubResource.class))).thenReturn(live);
        NodeInfo nodeInfo = new NodeInfo("node-1");
        nodeInfo.getUsed().put("nvidia.com/gpu", 2L);

        publisher.publishNodeInfo("node-1", nodeInfo);

        ArgumentCaptor<String> patches = ArgumentCaptor.forClass(String.class);
        verify(nodeStore).patch(isNull(), eq("node-1"), patches.capture(), eq(SubResource.DEFAULT));
        verify(nodeStore).patch(isNull(), eq("node-1"), patches.capture(), eq(SubResource.STATUS));
        JsonNode patch = objectMapper.readTree(patches.getAllValues().get(0));
        assertThat(patch.size()).isEqualTo(1);
        assertThat(patch.get("metadata").size()).isEqualTo(1);
        String annotation = patch.get("metadata").get("annotations").get(DEVICE_INFO_ANNOTATION).asText();
        assertThat(codec.decodeNodeInfo(annotation)).isEqualTo(nodeInfo);
        assertThat(patches.getAllValues().get(1)).isEqualTo(patches.getAllValues().get(0));
        // live object handed out by the store is left as it was
        assertThat(live.getMetadata().getAnnotations()).doesNotContainKey(DEVICE_INFO_ANNOTATION);
    }

    @Test
    void testPublishPodInfoPatchesMetadataOnly() throws Exception {
        Pod live = livePod("node-1");
        when(podStore.get("default", "pod-1")).thenReturn(live);
        when(podStore.patch(eq("default"), eq("pod-1"), anyString(), eq(SubResource.DEFAULT))).thenReturn(live);
        PodInfo podInfo = new PodInfo("pod-1");
        podInfo.setNodeName("node-1");

        publisher.publishPodInfo("default", "pod-1", podInfo);

        ArgumentCaptor<String> patch = ArgumentCaptor.forClass(String.class);
        verify(podStore).patch(eq("default"), eq("pod-1"), patch.capture(), eq(SubResource.DEFAULT));
        verify(podStore, never()).patch(any(), anyString(), anyString(), eq(SubResource.STATUS));
        JsonNode annotations = objectMapper.readTree(patch.getValue()).get("metadata").get("annotations");
        assertThat(codec.decodePodInfo(annotations.get(DEVICE_INFO_ANNOTATION).asText())).isEqualTo(podInfo);
    }

    @Test
    void testUpdatePodInfoKeepsLivePlacement() throws Exception {
        Pod cached = livePod("");
        Pod live = livePod("node-3");
        when(podStore.get("default", "pod-1")).thenReturn(live);
        when(podStore.update(any(Pod.class))).thenAnswer(invocation -> invocation.getArgument(0));
        PodInfo podInfo = new PodInfo("pod-1");
        podInfo.setNodeName("node-3");

        Pod updated = publisher.updatePodInfo(cached, podInfo);

        assertThat(updated.getSpec().getNodeName()).isEqualTo("node-3");
        assertThat(codec.podInfoFromAnnotations(updated.getMetadata())).isEqualTo(podInfo);
        assertThat(cached.getMetadata().getAnnotations()).doesNotContainKey(DEVICE_INFO_ANNOTATION);
    }

    @Test
    void testReadNodeInfoMergesCachedUsage() throws Exception {
        Node live = liveNode();
        NodeInfo annotated = new NodeInfo("node-1");
        annotated.getUsed().put("nvidia.com/gpu", 1L);
        codec.nodeInfoToAnnotation(live.getMetadata(), annotated);
        when(nodeStore.get(null, "node-1")).thenReturn(live);
        NodeInfo cached = new NodeInfo("node-1");
        cached.getUsed().put("nvidia.com/gpu", 6L);

        NodeInfo nodeInfo = publisher.readNodeInfo("node-1", cached);

        assertThat(nodeInfo.getUsed()).isEqualTo(Map.of("nvidia.com/gpu", 6L));
        assertThat(nodeInfo.getKubeCap()).isEqualTo(Map.of("nvidia.com/gpu", 8L));
    }

    @Test
    void testReadPodInfoInvalidates() throws Exception {
        Pod live = livePod("node-1");
        PodInfo annotated = new PodInfo("pod-1");
        annotated.setNodeName("node-1");
        ContainerInfo main = new ContainerInfo();
        main.setRequests(ResourceList.of("nvidia.com/gpu", 2L));
        main.getAllocateFrom().put("nvidia.com/gpu", "gpu/dev1");
        annotated.getRunningContainers().put("main", main);
        codec.podInfoToAnnotation(live.getMetadata(), annotated);
        when(podStore.get("default", "pod-1")).thenReturn(live);

        PodInfo podInfo = publisher.readPodInfo("default", "pod-1", true);

        assertThat(podInfo.getNodeName()).isEmpty();
        assertThat(podInfo.getRunningContainers().get("main").getAllocateFrom()).isEmpty();
        assertThat(podInfo.getRunningContainers().get("main").getDevRequests())
                .isEqualTo(Map.of("nvidia.com/gpu", 2L));
    }
}
