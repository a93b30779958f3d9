package com.sched.config;

import com.sched.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads plugin configuration from YAML files.
 * <p>
 * Example:
 * <pre>
 * plugin:
 *   mode: gthulhu
 *   scheduler:
 *     slice-ns-default: 5000000
 *     slice-ns-min: 500000
 *     pool-capacity: 4096
 *   api:
 *     enabled: true
 *     base-url: https://api.example.internal
 *     public-key-path: /etc/sched/api.pub.pem
 *     interval: 10
 *     auth-enabled: true
 *     mtls:
 *       enable: false
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SchedConfig load(String path) {
        log.info("Loading scheduler configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in: " + path, e);
        }
    }

    /**
     * Parse configuration from an already opened stream.
     */
    public static SchedConfig load(InputStream inputStream) {
        try {
            return parseYaml(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML configuration", e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static SchedConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The plugin section could be at root or under the 'plugin' key
        Map<String, Object> pluginConfig = root.containsKey("plugin")
                ? getMap(root, "plugin")
                : root;

        String mode = getString(pluginConfig, "mode", null);
        if (mode == null || mode.isBlank()) {
            throw new ConfigurationException("Configuration must name a scheduler 'mode'");
        }

        SchedulerConfig scheduler = parseSchedulerConfig(getMap(pluginConfig, "scheduler"));
        ApiConfig api = parseApiConfig(getMap(pluginConfig, "api"));

        SchedConfig config = new SchedConfig(mode, scheduler, api);

        log.info("Loaded scheduler configuration: mode={}, sliceNsDefault={}, sliceNsMin={}, poolCapacity={}, api={}",
                mode, scheduler.sliceNsDefault(), scheduler.sliceNsMin(), scheduler.poolCapacity(),
                api.isUsable() ? api.baseUrl() : "disabled");

        return config;
    }

    private static SchedulerConfig parseSchedulerConfig(Map<String, Object> map) {
        if (map == null) {
            return SchedulerConfig.defaults();
        }
        long sliceDefault = getLong(map, "slice-ns-default", 0);
        long sliceMin = getLong(map, "slice-ns-min", 0);
        int capacity = getInt(map, "pool-capacity", 0);
        if (sliceDefault < 0 || sliceMin < 0) {
            throw new ConfigurationException("scheduler slice values cannot be negative");
        }
        return new SchedulerConfig(sliceDefault, sliceMin, capacity);
    }

    private static ApiConfig parseApiConfig(Map<String, Object> map) {
        if (map == null) {
            return ApiConfig.disabled();
        }
        Map<String, Object> mtlsMap = getMap(map, "mtls");
        MtlsConfig mtls = mtlsMap == null
                ? MtlsConfig.disabled()
                : new MtlsConfig(
                        getBoolean(mtlsMap, "enable", false),
                        getString(mtlsMap, "cert-pem", null),
                        getString(mtlsMap, "key-pem", null),
                        getString(mtlsMap, "ca-pem", null));

        return new ApiConfig(
                getString(map, "public-key-path", null),
                getString(map, "base-url", null),
                getInt(map, "interval", ApiConfig.DEFAULT_INTERVAL_SECONDS),
                getBoolean(map, "enabled", false),
                getBoolean(map, "auth-enabled", true),
                mtls
        );
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Map) return (Map<String, Object>) value;
        throw new ConfigurationException("'" + key + "' must be a mapping");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer: " + value, e);
        }
    }
}
