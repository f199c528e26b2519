package io.github.sarps.solarpatch.config;

import io.github.sarps.solarpatch.exception.ConfigurationException;
import io.github.sarps.solarpatch.instrument.InstrumentProfile;
import io.github.sarps.solarpatch.instrument.InstrumentRole;
import io.github.sarps.solarpatch.model.RecodeGroup;
import io.github.sarps.solarpatch.model.RecodeTable;
import io.github.sarps.solarpatch.utilities.ObservationDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.*;

/**
 * SolarPatchConfigManager
 *
 * <p>Loads and queries the solarpatch YAML configuration:
 *   - Parses nested YAML into a Map&lt;String,Object&gt;.
 *   - Offers type safe getters (getDouble, getSection, getList, etc.) addressed by key path.
 *   - Validates required sections and reports missing paths.
 *   - Builds the immutable {@link InstrumentProfile} and {@link RecodeTable} objects the
 *     engine is constructed with.
 *
 * <p>Unlike a process-wide singleton, every instance holds its own copy of the parsed
 * file; nothing is shared or mutated after loading.</p>
 */
public class SolarPatchConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(SolarPatchConfigManager.class);

    /** Classpath location of the bundled configuration. */
    public static final String DEFAULT_RESOURCE = "/solarpatch.yml";

    /** Worker count used when the configuration names none. */
    public static final int DEFAULT_WORKERS = 4;

    private static final String OPEN_ENDED = "now";

    private final Map<String, Object> configData;
    private final String source;

    private SolarPatchConfigManager(Map<String, Object> configData, String source) {
        this.configData = Collections.unmodifiableMap(configData);
        this.source = source;
    }

    /**
     * Loads the configuration bundled with the library.
     *
     * @throws ConfigurationException if the resource is missing or unreadable
     */
    public static SolarPatchConfigManager loadDefault() {
        try (InputStream in = SolarPatchConfigManager.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Bundled configuration not found: " + DEFAULT_RESOURCE);
            }
            return new SolarPatchConfigManager(parse(new InputStreamReader(in, StandardCharsets.UTF_8),
                    DEFAULT_RESOURCE), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read bundled configuration " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file from disk.
     *
     * @param path YAML file
     * @throws IOException if the file cannot be read
     * @throws ConfigurationException if the file is not a YAML mapping
     */
    public static SolarPatchConfigManager load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            SolarPatchConfigManager mgr = new SolarPatchConfigManager(parse(reader, path.toString()), path.toString());
            logger.info("Loaded configuration from {}", path);
            return mgr;
        }
    }

    /**
     * Parses configuration from a YAML string, mainly for tests and embedding.
     */
    public static SolarPatchConfigManager fromYaml(String yamlText) {
        return new SolarPatchConfigManager(parse(new StringReader(yamlText), "<string>"), "<string>");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(Reader reader, String source) {
        Object loaded;
        try {
            loaded = new Yaml().load(reader);
        } catch (YAMLException e) {
            logger.error("Error parsing YAML: {}", source, e);
            throw new ConfigurationException("Invalid YAML in " + source, e);
        }
        if (!(loaded instanceof Map)) {
            logger.error("YAML root is not a map: {}", source);
            throw new ConfigurationException("YAML root of " + source + " is not a mapping");
        }
        return new LinkedHashMap<>((Map<String, Object>) loaded);
    }

    /**
     * Retrieves a nested value by key path.
     *
     * @param keys Sequence of keys (e.g., "instruments", "hmi", "image_size").
     * @return The value at the end of the key path, or null if not found.
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                logger.debug("Config path {} not found at '{}'", Arrays.toString(keys), key);
                return null;
            }
        }
        return current;
    }

    /**
     * @return String value or null.
     */
    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return v != null && !(v instanceof Map) && !(v instanceof List) ? v.toString() : null;
    }

    /**
     * @return Integer value or null.
     */
    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return integral(n, String.join("/", keys));
        try {
            return (v != null) ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    /**
     * @return Double value or null.
     */
    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    /**
     * @return List&lt;Object&gt; or null.
     */
    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    /**
     * @return Map&lt;String,Object&gt; or null.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    /**
     * Validate that all required configuration sections exist.
     * Returns list of missing sections.
     */
    public List<String> validateConfiguration() {
        List<String> missing = new ArrayList<>();

        Map<String, Object> instruments = getSection("instruments");
        if (instruments == null || instruments.isEmpty()) {
            missing.add("instruments (at least one required)");
        } else {
            String[] required = {"role", "image_size", "region_keyword", "coverage"};
            for (String name : instruments.keySet()) {
                for (String key : required) {
                    if (getConfigItem("instruments", name, key) == null) {
                        missing.add("instruments." + name + "." + key);
                    }
                }
                if (getString("instruments", name, "coverage", "start") == null) {
                    missing.add("instruments." + name + ".coverage.start");
                }
                String role = getString("instruments", name, "role");
                if ("secondary".equalsIgnoreCase(role) && getSection("instruments", name, "recode") == null) {
                    missing.add("instruments." + name + ".recode");
                }
            }
        }

        if (!missing.isEmpty()) {
            logger.error("Configuration validation failed for {}. Missing: {}", source, missing);
        } else {
            logger.info("Configuration validation passed for {}", source);
        }
        return missing;
    }

    /**
     * @return worker pool size for compositing sessions
     */
    public int getWorkerCount() {
        Integer workers = getInteger("session", "workers");
        if (workers == null) {
            return DEFAULT_WORKERS;
        }
        if (workers <= 0) {
            throw new ConfigurationException("session.workers must be positive, got " + workers);
        }
        return workers;
    }

    /**
     * @return configured instrument keys, in file order
     */
    public Set<String> getInstrumentNames() {
        Map<String, Object> instruments = getSection("instruments");
        return instruments == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(instruments.keySet()));
    }

    /**
     * Builds the profile of one configured instrument.
     *
     * @param name instrument key (e.g. "hmi")
     * @throws ConfigurationException if required entries are missing or malformed
     */
    public InstrumentProfile getInstrumentProfile(String name) {
        if (getSection("instruments", name) == null) {
            throw new ConfigurationException("No instrument '" + name + "' in " + source);
        }
        Integer imageSize = getInteger("instruments", name, "image_size");
        if (imageSize == null) {
            throw new ConfigurationException("instruments." + name + ".image_size is missing");
        }
        String role = requireString(name, "role");
        String start = getString("instruments", name, "coverage", "start");
        if (start == null) {
            throw new ConfigurationException("instruments." + name + ".coverage.start is missing");
        }
        String end = getString("instruments", name, "coverage", "end");
        LocalDateTime coverageEnd = end == null || OPEN_ENDED.equalsIgnoreCase(end.trim())
                ? null
                : ObservationDates.parse(end);

        String displayName = getString("instruments", name, "display_name");
        try {
            return new InstrumentProfile(
                    name,
                    displayName != null ? displayName : name.toUpperCase(),
                    InstrumentRole.fromString(role),
                    getString("instruments", name, "fulldisk_series"),
                    getString("instruments", name, "patch_series"),
                    requireString(name, "region_keyword"),
                    imageSize,
                    ObservationDates.parse(start),
                    coverageEnd,
                    parseLabels(name));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration for instrument " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds the recode table of one instrument.
     *
     * @param name instrument key (e.g. "mdi")
     * @return the table, or empty if the instrument has no {@code recode} section
     * @throws ConfigurationException if the section is malformed or inconsistent
     */
    public Optional<RecodeTable> getRecodeTable(String name) {
        Map<String, Object> recode = getSection("instruments", name, "recode");
        if (recode == null) {
            return Optional.empty();
        }
        Integer offset = getInteger("instruments", name, "recode", "offset");
        List<Object> rawGroups = getList("instruments", name, "recode", "groups");
        if (rawGroups == null) {
            throw new ConfigurationException("instruments." + name + ".recode.groups is missing");
        }

        List<RecodeGroup> groups = new ArrayList<>();
        for (Object raw : rawGroups) {
            if (!(raw instanceof Map<?, ?> group)) {
                throw new ConfigurationException("Recode group of " + name + " is not a mapping: " + raw);
            }
            Object sources = group.get("source");
            Object target = group.get("target");
            if (!(sources instanceof List<?> sourceList) || !(target instanceof Number targetCode)) {
                throw new ConfigurationException("Recode group of " + name + " needs a 'source' list and a numeric 'target': " + raw);
            }
            Set<Integer> codes = new LinkedHashSet<>();
            for (Object code : sourceList) {
                if (!(code instanceof Number n)) {
                    throw new ConfigurationException("Non-numeric source code in recode group of " + name + ": " + code);
                }
                codes.add(integral(n, "instruments/" + name + "/recode/groups/source"));
            }
            try {
                groups.add(new RecodeGroup(codes, integral(targetCode, "instruments/" + name + "/recode/groups/target")));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
        RecodeTable table = new RecodeTable(groups, offset != null ? offset : 0);
        logger.debug("Built recode table for {}: {}", name, table);
        return Optional.of(table);
    }

    private Map<Integer, String> parseLabels(String name) {
        Map<String, Object> section = getSection("instruments", name, "categories");
        Map<Integer, String> labels = new TreeMap<>();
        if (section == null) {
            return labels;
        }
        // SnakeYAML hands integer keys back as Integers despite the declared type
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) section).entrySet()) {
            try {
                labels.put(Integer.parseInt(entry.getKey().toString().trim()), String.valueOf(entry.getValue()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Category code of " + name + " is not an integer: " + entry.getKey(), e);
            }
        }
        return labels;
    }

    /**
     * Narrows a YAML number to an int, rejecting fractional and out-of-range values.
     */
    private static int integral(Number n, String path) {
        double d = n.doubleValue();
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            logger.error("Expected integer at {} but got {}", path, n);
            throw new ConfigurationException("Expected an integer at " + path + " but got " + n);
        }
        return n.intValue();
    }

    private String requireString(String instrument, String key) {
        String value = getString("instruments", instrument, key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("instruments." + instrument + "." + key + " is missing");
        }
        return value;
    }

    /**
     * @return where this configuration was loaded from
     */
    public String getSource() {
        return source;
    }
}
