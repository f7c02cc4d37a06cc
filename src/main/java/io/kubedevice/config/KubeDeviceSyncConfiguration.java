package io.kubedevice.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.kubedevice.codec.DeviceInfoCodec;
import io.kubedevice.patch.PatchSchema;
import io.kubedevice.patch.StrategicMergePatchBuilder;
import io.kubedevice.reconcile.DeviceInfoReconciler;
import io.kubedevice.store.KubernetesObjectStore;
import io.kubedevice.store.ObjectStore;
import io.kubedevice.sync.DeviceInfoPublisher;
import io.kubedevice.sync.ObjectUpdater;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for device state synchronization. Import it from the scheduler or device
 * advertiser application.
 */
@Slf4j
@Configuration
public class KubeDeviceSyncConfiguration {

    @Bean
    public KubeDeviceConfig kubeDeviceConfig() {
        KubeDeviceConfig config = new KubeDeviceConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(KubeDeviceConfig config) {
        log.info("Initializing Kubernetes client");
        return KubernetesClientFactory.create(config);
    }

    @Bean
    public ObjectStore<Node> nodeStore(KubernetesClient kubernetesClient) {
        return KubernetesObjectStore.forNodes(kubernetesClient);
    }

    @Bean
    public ObjectStore<Pod> podStore(KubernetesClient kubernetesClient) {
        return KubernetesObjectStore.forPods(kubernetesClient);
    }

    @Bean
    public DeviceInfoCodec deviceInfoCodec() {
        return new DeviceInfoCodec();
    }

    @Bean
    public DeviceInfoReconciler deviceInfoReconciler(DeviceInfoCodec codec) {
        return new DeviceInfoReconciler(codec);
    }

    /**
     * Mapper for Kubernetes objects, shared by the patch builder and the updaters.
     */
    @Bean
    public ObjectMapper kubernetesObjectMapper() {
        return new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public StrategicMergePatchBuilder strategicMergePatchBuilder(ObjectMapper kubernetesObjectMapper) {
        return new StrategicMergePatchBuilder(kubernetesObjectMapper);
    }

    @Bean
    public ObjectUpdater<Node> nodeUpdater(ObjectStore<Node> nodeStore, StrategicMergePatchBuilder patchBuilder,
                                           ObjectMapper kubernetesObjectMapper) {
        log.info("Initializing node updater");
        return new ObjectUpdater<>(nodeStore, patchBuilder, PatchSchema.forNode(), Node.class, kubernetesObjectMapper);
    }

    @Bean
    public ObjectUpdater<Pod> podUpdater(ObjectStore<Pod> podStore, StrategicMergePatchBuilder patchBuilder,
                                         ObjectMapper kubernetesObjectMapper) {
        log.info("Initializing pod updater");
        return new ObjectUpdater<>(podStore, patchBuilder, PatchSchema.forPod(), Pod.class, kubernetesObjectMapper);
    }

    @Bean
    public DeviceInfoPublisher deviceInfoPublisher(DeviceInfoCodec codec,
                                                   DeviceInfoReconciler reconciler,
                                                   ObjectUpdater<Node> nodeUpdater,
                                                   ObjectUpdater<Pod> podUpdater) {
        return new DeviceInfoPublisher(codec, reconciler, nodeUpdater, podUpdater);
    }
}
