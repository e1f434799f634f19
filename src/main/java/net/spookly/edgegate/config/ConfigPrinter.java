package net.spookly.edgegate.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration as YAML with secrets replaced.
 */
public final class ConfigPrinter {
    static final String REDACTED = "<redacted>";
    private static final Set<String> SECRET_KEYS = Set.of("token", "accessToken", "edgeKey", "sharedKey");
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(EdgegateConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redact(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redact(Object node) {
        if (node instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) node).entrySet()) {
                if (SECRET_KEYS.contains(entry.getKey()) && entry.getValue() instanceof String) {
                    entry.setValue(REDACTED);
                } else {
                    redact(entry.getValue());
                }
            }
        } else if (node instanceof List) {
            for (Object item : (List<Object>) node) {
                redact(item);
            }
        }
    }
}
