package net.spookly.edgegate.environment;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Client-side TLS material for a direct environment connection.
 */
@Value
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class TlsSettings {
    public static final TlsSettings DISABLED = TlsSettings.builder().build();

    boolean enabled;
    boolean skipVerify;
    String caCertPath;
    String certPath;
    String keyPath;
}
