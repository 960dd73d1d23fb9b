package im.arun.linktree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "linktree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final LinkTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private LinkTreeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return validate(yamlMapper.readValue(path.toFile(), LinkTreeConfig.class));
                }
                logger.warn("Config file {} not found, falling back to {}", path, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return validate(yamlMapper.readValue(resourceStream, LinkTreeConfig.class));
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new LinkTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new LinkTreeConfig();
        }
    }

    public LinkTreeConfig load() {
        return load(null);
    }

    public LinkTreeConfig load(Map<String, Object> userOptions) {
        LinkTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "indent_unit":
                case "indentUnit":
                    config.setIndentUnit(parseInt(key, value));
                    break;
                case "path_separator":
                case "pathSeparator":
                    config.setPathSeparator(String.valueOf(value));
                    break;
                case "tag_delimiter":
                case "tagDelimiter":
                    config.setTagDelimiter(String.valueOf(value));
                    break;
                case "binding_mode":
                case "bindingMode":
                    config.setBindingMode(parseBindingMode(value));
                    break;
                case "default_tag":
                case "defaultTag":
                    config.setDefaultTag(value == null ? "" : String.valueOf(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return validate(config);
    }

    /**
     * Reject settings the parser and binder cannot work with.
     */
    public static LinkTreeConfig validate(LinkTreeConfig config) {
        if (config.getIndentUnit() < 1) {
            throw new IllegalArgumentException("indentUnit must be at least 1, got " + config.getIndentUnit());
        }
        if (config.getPathSeparator() == null || config.getPathSeparator().isEmpty()) {
            throw new IllegalArgumentException("pathSeparator must not be empty");
        }
        if (config.getTagDelimiter() == null || config.getTagDelimiter().isBlank()) {
            throw new IllegalArgumentException("tagDelimiter must not be blank");
        }
        if (config.getBindingMode() == null) {
            config.setBindingMode(BindingMode.KEYWORD);
        }
        if (config.getDefaultTag() == null) {
            config.setDefaultTag("");
        }
        return config;
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " expects an integer, got " + value, e);
        }
    }

    private BindingMode parseBindingMode(Object value) {
        if (value instanceof BindingMode) {
            return (BindingMode) value;
        }
        try {
            return BindingMode.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown binding mode: " + value, e);
        }
    }

    private LinkTreeConfig copyConfig(LinkTreeConfig source) {
        LinkTreeConfig copy = new LinkTreeConfig();
        copy.setIndentUnit(source.getIndentUnit());
        copy.setPathSeparator(source.getPathSeparator());
        copy.setTagDelimiter(source.getTagDelimiter());
        copy.setBindingMode(source.getBindingMode());
        copy.setDefaultTag(source.getDefaultTag());
        return copy;
    }
}
