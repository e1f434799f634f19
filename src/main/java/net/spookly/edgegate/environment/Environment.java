package net.spookly.edgegate.environment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Immutable view of one managed environment. Status fields are written only through {@link EnvironmentService}.
 */
@Value
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class Environment {
    @NonNull
    String id;
    String name;
    @NonNull
    EnvironmentKind kind;
    /**
     * Endpoint URL for direct kinds; target inside the agent network for edge kinds (blank means agent default).
     */
    String url;
    @Builder.Default
    TlsSettings tls = TlsSettings.DISABLED;
    @ToString.Exclude
    String accessToken;
    String apiVersion;
    @ToString.Exclude
    String edgeKey;
    @Builder.Default
    EnvironmentStatus status = EnvironmentStatus.UNKNOWN;
    Instant lastProbeAt;
    Instant lastStatusChangeAt;

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }

    /**
     * Digest of the connection-relevant fields. Status and timestamps do not contribute.
     */
    public String fingerprint() {
        TlsSettings settings = tls == null ? TlsSettings.DISABLED : tls;
        StringBuilder canonical = new StringBuilder()
                .append(kind.name()).append('\n')
                .append(nullToEmpty(url)).append('\n')
                .append(settings.enabled()).append('\n')
                .append(settings.skipVerify()).append('\n')
                .append(nullToEmpty(settings.caCertPath())).append('\n')
                .append(nullToEmpty(settings.certPath())).append('\n')
                .append(nullToEmpty(settings.keyPath())).append('\n')
                .append(nullToEmpty(accessToken)).append('\n')
                .append(nullToEmpty(apiVersion)).append('\n')
                .append(nullToEmpty(edgeKey));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
