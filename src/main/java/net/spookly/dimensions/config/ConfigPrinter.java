package net.spookly.dimensions.config;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with the Redis credentials redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(DimensionsConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        Object control = data.get("control");
        if (control instanceof Map) {
            Map<String, Object> controlMap = (Map<String, Object>) control;
            Object uri = controlMap.get("redisUri");
            if (uri instanceof String) {
                controlMap.put("redisUri", redactCredentials((String) uri));
            }
        }
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(dumperOptions).dump(data);
    }

    static String redactCredentials(String uri) {
        int scheme = uri.indexOf("://");
        int at = uri.lastIndexOf('@');
        if (scheme < 0 || at <= scheme) {
            return uri;
        }
        return uri.substring(0, scheme + 3) + REDACTED + uri.substring(at);
    }
}
