package io.kubedevice.models;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for NodeInfo and PodInfo models.
 */
class NodeInfoTest {

    @Test
    void testNodeInfoCreation() {
        NodeInfo nodeInfo = new NodeInfo();

        assertThat(nodeInfo.getName()).isEmpty();
        assertThat(nodeInfo.getKubeCap()).isEmpty();
        assertThat(nodeInfo.getKubeAlloc()).isEmpty();
        assertThat(nodeInfo.getUsed()).isEmpty();
    }

    @Test
    void testNodeInfoWithName() {
        assertThat(new NodeInfo("node-1").getName()).isEqualTo("node-1");
    }

    @Test
    void testEqualityIncludesUnknownFields() {
        NodeInfo first = new NodeInfo("node-1");
        NodeInfo second = new NodeInfo("node-1");
        assertThat(first).isEqualTo(second);

        second.setAdditionalProperty("scorer", "binpack");

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void testPodInfoCreation() {
        PodInfo podInfo = new PodInfo("pod-1");

        assertThat(podInfo.getName()).isEqualTo("pod-1");
        assertThat(podInfo.getNodeName()).isEmpty();
        assertThat(podInfo.getInitContainers()).isEmpty();
        assertThat(podInfo.getRunningContainers()).isEmpty();
    }
}
