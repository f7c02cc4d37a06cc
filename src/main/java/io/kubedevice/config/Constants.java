package io.kubedevice.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Annotation holding the serialized device state, on both nodes and pods.
    // Any other writer of that annotation must use exactly this key.
    public static final String DEVICE_INFO_ANNOTATION = "KubeDevice/DeviceInfo";

    // Object kinds, used in diagnostics
    public static final String KIND_NODE = "Node";
    public static final String KIND_POD = "Pod";

    // Sub-resource paths
    public static final String SUBRESOURCE_STATUS = "status";

    // Strategic merge patch directives
    public static final String PATCH_DIRECTIVE = "$patch";
    public static final String PATCH_DIRECTIVE_DELETE = "delete";
    public static final String SET_ELEMENT_ORDER_PREFIX = "$setElementOrder/";
    public static final String DELETE_FROM_PRIMITIVE_LIST_PREFIX = "$deleteFromPrimitiveList/";

    // Default configuration values
    public static final String DEFAULT_NAMESPACE = "default";
    public static final int DEFAULT_REQUEST_TIMEOUT_MILLIS = 10_000;
    public static final boolean DEFAULT_TRUST_CERTS = false;

    // Environment variable naming an external config file
    public static final String CONFIG_FILE_ENV_VAR = "KUBEDEVICE_CONFIG_FILE";
    public static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
}
