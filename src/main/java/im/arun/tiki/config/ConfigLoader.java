package im.arun.tiki.config;

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

/**
 * Loads {@link TikiConfig} from YAML and merges caller overrides on top.
 * Lookup order: explicit path, {@code tiki.yaml} on the classpath, built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "tiki.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final TikiConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TikiConfig loadDefaultConfig(String configPath) {
        try {
            // Explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), TikiConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", path, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, TikiConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new TikiConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TikiConfig();
        }
    }

    public TikiConfig load() {
        return load(null);
    }

    public TikiConfig load(Map<String, Object> userOptions) {
        TikiConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "frontmatter_line_limit":
                case "frontmatterLineLimit":
                    Integer limit = parseInteger(value);
                    if (limit != null && limit >= 0) {
                        config.setFrontmatterLineLimit(limit);
                    } else {
                        logger.warn("Ignoring invalid frontmatter line limit: {}", value);
                    }
                    break;
                case "code_fence":
                case "codeFence":
                    if (value instanceof String && !((String) value).isBlank()) {
                        config.setCodeFence(((String) value).strip());
                    }
                    break;
                case "collapse_marker":
                case "collapseMarker":
                    if (value instanceof String) config.setCollapseMarker((String) value);
                    break;
                case "pretty_json":
                case "prettyJson":
                    config.setPrettyJson(parseBoolean(value));
                    break;
                case "styled":
                    config.setStyled(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
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
                return Integer.parseInt(((String) value).strip());
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

    private TikiConfig copyConfig(TikiConfig source) {
        TikiConfig copy = new TikiConfig();
        copy.setFrontmatterLineLimit(source.getFrontmatterLineLimit());
        copy.setCodeFence(source.getCodeFence());
        copy.setCollapseMarker(source.getCollapseMarker());
        copy.setPrettyJson(source.isPrettyJson());
        copy.setStyled(source.isStyled());
        return copy;
    }
}
