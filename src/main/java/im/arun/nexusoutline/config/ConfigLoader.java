package im.arun.nexusoutline.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "nexus-outline.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final OutlineConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private OutlineConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), OutlineConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, OutlineConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new OutlineConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new OutlineConfig();
        }
    }

    public OutlineConfig load(Map<String, Object> userOptions) {
        OutlineConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "indent_width":
                    case "indentWidth":
                        Integer width = parseInteger(value);
                        if (width != null && width >= 1) {
                            config.setIndentWidth(width);
                        } else {
                            logger.warn("Ignoring invalid indent width: {}", value);
                        }
                        break;
                    case "unwrap_outer_fence":
                    case "unwrapOuterFence":
                        config.setUnwrapOuterFence(parseBoolean(value));
                        break;
                    case "group_variants":
                    case "groupVariants":
                        config.setGroupVariants(parseBoolean(value));
                        break;
                    case "pretty_print":
                    case "prettyPrint":
                        config.setPrettyPrint(parseBoolean(value));
                        break;
                    case "include_auxiliary_blocks":
                    case "includeAuxiliaryBlocks":
                        config.setIncludeAuxiliaryBlocks(parseBoolean(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private Integer parseInteger(Object value) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private OutlineConfig copyConfig(OutlineConfig source) {
        OutlineConfig copy = new OutlineConfig();
        copy.setIndentWidth(source.getIndentWidth());
        copy.setUnwrapOuterFence(source.isUnwrapOuterFence());
        copy.setGroupVariants(source.isGroupVariants());
        copy.setPrettyPrint(source.isPrettyPrint());
        copy.setIncludeAuxiliaryBlocks(source.isIncludeAuxiliaryBlocks());
        return copy;
    }
}
