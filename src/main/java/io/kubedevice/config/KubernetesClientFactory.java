package io.kubedevice.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds fabric8 clients from {@link KubeDeviceConfig}.
 */
@Slf4j
public final class KubernetesClientFactory {

    private KubernetesClientFactory() {
        // Utility class
    }

    /**
     * Client settings: in-cluster or kubeconfig auto-configuration, overridden by the
     * values present in {@code config}.
     */
    public static Config clientConfig(KubeDeviceConfig config) {
        ConfigBuilder builder = new ConfigBuilder(Config.autoConfigure(null))
                .withNamespace(config.getNamespace())
                .withRequestTimeout(config.getRequestTimeoutMillis());
        if (config.getMasterUrl() != null) {
            builder.withMasterUrl(config.getMasterUrl());
        }
        if (config.isTrustCerts()) {
            builder.withTrustCerts(true);
        }
        return builder.build();
    }

    public static KubernetesClient create(KubeDeviceConfig config) {
        Config clientConfig = clientConfig(config);
        log.info("Creating Kubernetes client for API server: {}", clientConfig.getMasterUrl());
        return new KubernetesClientBuilder().withConfig(clientConfig).build();
    }
}
