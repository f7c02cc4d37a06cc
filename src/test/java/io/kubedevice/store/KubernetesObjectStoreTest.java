package io.kubedevice.store;

import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.kubedevice.exceptions.ObjectNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for KubernetesObjectStore.
 */
@ExtendWith(MockitoExtension.class)
class KubernetesObjectStoreTest {

    private static final String PATCH = "{\"metadata\":{\"annotations\":{\"a\":\"b\"}}}";

    @Mock
    private KubernetesClient client;

    @Mock
    private MixedOperation<Pod, KubernetesResourceList<Pod>, Resource<Pod>> podOperation;

    @Mock
    private NonNamespaceOperation<Pod, KubernetesResourceList<Pod>, Resource<Pod>> namespacedPods;

    @Mock
    private Resource<Pod> podResource;

    @Mock
    private MixedOperation<Node, KubernetesResourceList<Node>, Resource<Node>> nodeOperation;

    @Mock
    private Resource<Node> nodeResource;

    @Mock
    private Resource<Node> nodeStatusResource;

    private KubernetesObjectStore<Pod> podStore;
    private KubernetesObjectStore<Node> nodeStore;

    @BeforeEach
    void setUp() {
        lenient().when(client.resources(Pod.class)).thenReturn(podOperation);
        lenient().when(client.resources(Node.class)).thenReturn(nodeOperation);
        lenient().when(podOperation.inNamespace("default")).thenReturn(namespacedPods);
        lenient().when(namespacedPods.withName("pod-1")).thenReturn(podResource);
        lenient().when(nodeOperation.withName("node-1")).thenReturn(nodeResource);

        podStore = KubernetesObjectStore.forPods(client);
        nodeStore = KubernetesObjectStore.forNodes(client);
    }

    private Pod pod() {
        return new PodBuilder().withNewMetadata().withName("pod-1").withNamespace("default").endMetadata().build();
    }

    private Node node() {
        return new NodeBuilder().withNewMetadata().withName("node-1").endMetadata().build();
    }

    @Test
    void testKinds() {
        assertThat(podStore.getKind()).isEqualTo("Pod");
        assertThat(nodeStore.getKind()).isEqualTo("Node");
    }

    @Test
    void testGetNamespacedObject() throws Exception {
        Pod pod = pod();
        when(podResource.get()).thenReturn(pod);

        assertThat(podStore.get("default", "pod-1")).isSameAs(pod);
    }

    @Test
    void testGetClusterScopedObject() throws Exception {
        Node node = node();
        when(nodeResource.get()).thenReturn(node);

        assertThat(nodeStore.get(null, "node-1")).isSameAs(node);
        verify(nodeOperation, never()).inNamespace(any());
    }

    @Test
    void testGetMissingObject() {
        when(podResource.get()).thenReturn(null);

        assertThatThrownBy(() -> podStore.get("default", "pod-1"))
                .isInstanceOf(ObjectNotFoundException.class)
                .hasMessage("Pod 'default/pod-1' not found")
                .satisfies(e -> {
                    ObjectNotFoundException notFound = (ObjectNotFoundException) e;
                    assertThat(notFound.getKind()).isEqualTo("Pod");
                    assertThat(notFound.getNamespace()).isEqualTo("default");
                    assertThat(notFound.getName()).isEqualTo("pod-1");
                });
    }

    @Test
    void testPatchDefaultSubResourceUsesStrategicMerge() {
        Pod patched = pod();
        when(podResource.patch(any(PatchContext.class), eq(PATCH))).thenReturn(patched);

        assertThat(podStore.patch("default", "pod-1", PATCH, SubResource.DEFAULT)).isSameAs(patched);

        ArgumentCaptor<PatchContext> context = ArgumentCaptor.forClass(PatchContext.class);
        verify(podResource).patch(context.capture(), eq(PATCH));
        assertThat(context.getValue().getPatchType()).isEqualTo(PatchType.STRATEGIC_MERGE);
        verify(podResource, never()).subresource(anyString());
    }

    @Test
    void testPatchStatusSubResource() {
        Node patched = node();
        doReturn(nodeStatusResource).when(nodeResource).subresource("status");
        when(nodeStatusResource.patch(any(PatchContext.class), eq(PATCH))).thenReturn(patched);

        assertThat(nodeStore.patch(null, "node-1", PATCH, SubResource.STATUS)).isSameAs(patched);
        verify(nodeResource, never()).patch(any(PatchContext.class), anyString());
    }

    @Test
    void testPatchErrorsPropagateUnchanged() {
        KubernetesClientException failure = new KubernetesClientException("conflict", 409, null);
        when(podResource.patch(any(PatchContext.class), eq(PATCH))).thenThrow(failure);

        assertThatThrownBy(() -> podStore.patch("default", "pod-1", PATCH, SubResource.DEFAULT))
                .isSameAs(failure);
    }

    @Test
    void testUpdateNamespacedObject() {
        Pod pod = pod();
        Pod updated = pod();
        when(namespacedPods.resource(pod)).thenReturn(podResource);
        when(podResource.update()).thenReturn(updated);

        assertThat(podStore.update(pod)).isSameAs(updated);
    }

    @Test
    void testUpdateClusterScopedObject() {
        Node node = node();
        when(nodeOperation.resource(node)).thenReturn(nodeResource);
        when(nodeResource.update()).thenReturn(node);

        assertThat(nodeStore.update(node)).isSameAs(node);
    }
}
