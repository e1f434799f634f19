package net.spookly.edgegate.environment;

import java.util.List;
import java.util.Locale;

import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.config.EdgegateConfig;

/**
 * Loads the {@code environments} config section into the environment service.
 */
@Slf4j
public final class EnvironmentSeeder {
    private EnvironmentSeeder() {
    }

    public static int seed(EdgegateConfig config, EnvironmentService environments) {
        List<EdgegateConfig.EnvironmentConfig> entries = config == null ? null : config.environments;
        if (entries == null) {
            return 0;
        }
        int count = 0;
        for (EdgegateConfig.EnvironmentConfig entry : entries) {
            if (entry == null) {
                continue;
            }
            environments.save(toEnvironment(entry));
            count++;
        }
        log.info("Seeded {} environment(s) from config", count);
        return count;
    }

    public static Environment toEnvironment(EdgegateConfig.EnvironmentConfig entry) {
        EnvironmentKind kind = EnvironmentKind.fromConfig(entry.kind);
        return Environment.builder()
                .id(entry.id)
                .name(entry.name)
                .kind(kind)
                .url(entry.url == null ? null : entry.url.trim())
                .tls(toTls(entry.tls, entry.url))
                .accessToken(entry.accessToken)
                .apiVersion(entry.apiVersion)
                .edgeKey(entry.edgeKey)
                .build();
    }

    private static TlsSettings toTls(EdgegateConfig.EnvironmentTlsConfig tls, String url) {
        boolean httpsUrl = url != null && url.trim().toLowerCase(Locale.ROOT).startsWith("https://");
        if (tls == null) {
            return httpsUrl ? TlsSettings.builder().enabled(true).build() : TlsSettings.DISABLED;
        }
        return TlsSettings.builder()
                .enabled(httpsUrl || Boolean.TRUE.equals(tls.enabled))
                .skipVerify(Boolean.TRUE.equals(tls.skipVerify))
                .caCertPath(tls.ca)
                .certPath(tls.cert)
                .keyPath(tls.key)
                .build();
    }
}
