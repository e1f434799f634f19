package net.spookly.edgegate.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConfigPrinterTest {
    @Test
    void redactsSecrets() {
        EdgegateConfig config = ConfigValidatorTest.baseConfig();
        EdgegateConfig.EnvironmentConfig edge = ConfigValidatorTest.environment("edge-1", "docker-edge", null);
        edge.edgeKey = "super-secret-edge-key";
        edge.accessToken = "upstream-bearer";
        config.environments.add(edge);
        config.status = new EdgegateConfig.StatusConfig();
        config.status.auth = new EdgegateConfig.StatusAuthConfig();
        config.status.auth.sharedKey = "status-hmac-key";

        String yaml = ConfigPrinter.toYaml(config);

        assertFalse(yaml.contains("admin-token-0123456789"));
        assertFalse(yaml.contains("super-secret-edge-key"));
        assertFalse(yaml.contains("upstream-bearer"));
        assertFalse(yaml.contains("status-hmac-key"));
        assertTrue(yaml.contains(ConfigPrinter.REDACTED));
        assertTrue(yaml.contains("edge-1"));
        assertTrue(yaml.contains("name: admin"));
    }
}
