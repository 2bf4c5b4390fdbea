package im.arun.booklink.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import im.arun.booklink.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link BookLinkConfig} from {@code booklink.yaml} and merges user options over it.
 * An explicit config path wins over the classpath default.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "booklink.yaml";

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    private final BookLinkConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private BookLinkConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), BookLinkConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath defaults", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, BookLinkConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new BookLinkConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new BookLinkConfig();
        }
    }

    public BookLinkConfig load(Map<String, Object> userOptions) {
        BookLinkConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "format":
                        if (value instanceof OutputFormat) {
                            config.setFormat((OutputFormat) value);
                        } else if (value instanceof String) {
                            config.setFormat(OutputFormat.valueOf(((String) value).trim().toUpperCase(Locale.ROOT)));
                        }
                        break;
                    case "number_sections":
                    case "numberSections":
                        config.setNumberSections(parseBoolean(value));
                        break;
                    case "number_preface_sections":
                    case "numberPrefaceSections":
                        config.setNumberPrefaceSections(parseBoolean(value));
                        break;
                    case "store_dir":
                    case "storeDir":
                        if (value instanceof String) config.setStoreDir((String) value);
                        break;
                    case "external_documents":
                    case "externalDocuments":
                        config.setExternalDocuments(parseList(value));
                        break;
                    case "link_extension":
                    case "linkExtension":
                        if (value instanceof String) config.setLinkExtension((String) value);
                        break;
                    case "bibliography_file":
                    case "bibliographyFile":
                        if (value instanceof String) config.setBibliographyFile((String) value);
                        break;
                    case "bibliography_uri":
                    case "bibliographyUri":
                        if (value instanceof String) config.setBibliographyUri((String) value);
                        break;
                    case "local_bibliography":
                    case "localBibliography":
                        config.setLocalBibliography(parseBoolean(value));
                        break;
                    case "strip_doctest_directives":
                    case "stripDoctestDirectives":
                        config.setStripDoctestDirectives(parseBoolean(value));
                        break;
                    case "highlight_doctests":
                    case "highlightDoctests":
                        config.setHighlightDoctests(parseBoolean(value));
                        break;
                    case "extra_builtins":
                    case "extraBuiltins":
                        config.setExtraBuiltins(parseList(value));
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

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private List<String> parseList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    result.add(item.toString().trim());
                }
            }
        } else if (value instanceof String) {
            for (String item : ((String) value).split(",")) {
                if (!item.isBlank()) {
                    result.add(item.trim());
                }
            }
        }
        return result;
    }

    private BookLinkConfig copyConfig(BookLinkConfig source) {
        BookLinkConfig copy = new BookLinkConfig();
        copy.setFormat(source.getFormat());
        copy.setNumberSections(source.isNumberSections());
        copy.setNumberPrefaceSections(source.isNumberPrefaceSections());
        copy.setStoreDir(source.getStoreDir());
        copy.setExternalDocuments(new ArrayList<>(source.getExternalDocuments()));
        copy.setLinkExtension(source.getLinkExtension());
        copy.setBibliographyFile(source.getBibliographyFile());
        copy.setBibliographyUri(source.getBibliographyUri());
        copy.setLocalBibliography(source.isLocalBibliography());
        copy.setStripDoctestDirectives(source.isStripDoctestDirectives());
        copy.setHighlightDoctests(source.isHighlightDoctests());
        copy.setExtraBuiltins(new ArrayList<>(source.getExtraBuiltins()));
        return copy;
    }
}
