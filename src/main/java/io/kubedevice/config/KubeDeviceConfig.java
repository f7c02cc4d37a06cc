package io.kubedevice.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

import static io.kubedevice.config.Constants.*;

/**
 * Kubernetes connection settings.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class KubeDeviceConfig {

    // null leaves the master URL to the client's own auto-configuration
    private final String masterUrl;
    private final String namespace;
    private final boolean trustCerts;
    private final int requestTimeoutMillis;

    public KubeDeviceConfig() {
        this(loadYamlConfig(System.getenv(CONFIG_FILE_ENV_VAR)));
    }

    KubeDeviceConfig(ConfigModel config) {
        Kubernetes kubernetes = config.getKubernetes() != null ? config.getKubernetes() : new Kubernetes();
        this.masterUrl = parseMasterUrl(kubernetes);
        this.namespace = parseNamespace(kubernetes);
        this.trustCerts = kubernetes.getTrust_certs() != null ? kubernetes.getTrust_certs() : DEFAULT_TRUST_CERTS;
        this.requestTimeoutMillis = parseRequestTimeout(kubernetes);

        log.info("Loaded kubedevice config - master url: {}, namespace: {}, request timeout: {}ms",
                masterUrl != null ? masterUrl : "<auto>", namespace, requestTimeoutMillis);
    }

    static ConfigModel loadYamlConfig(String externalConfigPath) {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. External file named by the environment
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", CONFIG_FILE_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        }

        // 2. Classpath
        if (inputStream == null) {
            inputStream = KubeDeviceConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        try (InputStream is = inputStream) {
            Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
            ConfigModel config = yaml.load(is);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private static String parseMasterUrl(Kubernetes kubernetes) {
        String url = kubernetes.getMaster_url();
        return url != null && !url.isBlank() ? url.trim() : null;
    }

    private static String parseNamespace(Kubernetes kubernetes) {
        String ns = kubernetes.getNamespace();
        return ns != null && !ns.isBlank() ? ns.trim() : DEFAULT_NAMESPACE;
    }

    private static int parseRequestTimeout(Kubernetes kubernetes) {
        Integer timeout = kubernetes.getRequest_timeout_millis();
        if (timeout == null) {
            return DEFAULT_REQUEST_TIMEOUT_MILLIS;
        }
        if (timeout <= 0) {
            log.warn("Ignoring non-positive request timeout {}ms, using default {}ms", timeout, DEFAULT_REQUEST_TIMEOUT_MILLIS);
            return DEFAULT_REQUEST_TIMEOUT_MILLIS;
        }
        return timeout;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Kubernetes kubernetes;
    }

    @Data
    public static class Kubernetes {
        private String master_url;
        private String namespace;
        private Boolean trust_certs;
        private Integer request_timeout_millis;
    }
}
