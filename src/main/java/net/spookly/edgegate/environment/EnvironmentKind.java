package net.spookly.edgegate.environment;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Environment flavours: one transport type crossed with one backend API family.
 */
@Getter
@Accessors(fluent = true)
public enum EnvironmentKind {
    DOCKER_SOCKET("docker-socket", TransportType.DIRECT_SOCKET, ApiFamily.DOCKER),
    DOCKER_HTTP("docker-http", TransportType.DIRECT_HTTP, ApiFamily.DOCKER),
    DOCKER_EDGE("docker-edge", TransportType.TUNNEL, ApiFamily.DOCKER),
    KUBERNETES_SOCKET("kubernetes-socket", TransportType.DIRECT_SOCKET, ApiFamily.KUBERNETES),
    KUBERNETES_HTTP("kubernetes-http", TransportType.DIRECT_HTTP, ApiFamily.KUBERNETES),
    KUBERNETES_EDGE("kubernetes-edge", TransportType.TUNNEL, ApiFamily.KUBERNETES);

    private final String configName;
    private final TransportType transportType;
    private final ApiFamily apiFamily;

    EnvironmentKind(String configName, TransportType transportType, ApiFamily apiFamily) {
        this.configName = configName;
        this.transportType = transportType;
        this.apiFamily = apiFamily;
    }

    public boolean isEdge() {
        return transportType == TransportType.TUNNEL;
    }

    /**
     * Whether an endpoint URL with this scheme makes sense for the kind.
     */
    public boolean accepts(EndpointUrl.Scheme scheme) {
        return allowedSchemes().contains(scheme);
    }

    private Set<EndpointUrl.Scheme> allowedSchemes() {
        switch (transportType) {
            case DIRECT_SOCKET:
                return EnumSet.of(EndpointUrl.Scheme.UNIX, EndpointUrl.Scheme.NPIPE);
            case DIRECT_HTTP:
                return EnumSet.of(EndpointUrl.Scheme.TCP, EndpointUrl.Scheme.HTTP, EndpointUrl.Scheme.HTTPS);
            default:
                return EnumSet.of(EndpointUrl.Scheme.TCP, EndpointUrl.Scheme.HTTP, EndpointUrl.Scheme.UNIX);
        }
    }

    public static EnvironmentKind fromConfig(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (EnvironmentKind kind : values()) {
                if (kind.configName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("must be one of: " + Arrays.stream(values())
                .map(EnvironmentKind::configName)
                .collect(Collectors.joining(", ")));
    }
}
