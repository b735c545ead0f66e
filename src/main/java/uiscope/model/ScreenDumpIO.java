package uiscope.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Reads flattened screen dumps into {@link UIElement} lists and writes engine
 * results back out as JSON.
 *
 * <p>A dump is either a bare JSON array of elements or an object carrying them
 * under {@code "elements"}. On read the JSON is validated against
 * {@code element-dump-schema.json} before it is mapped; legacy attribute names
 * are normalized by {@link UIElement}'s own mapping.
 */
public class ScreenDumpIO {

    private static final Logger log = LoggerFactory.getLogger(ScreenDumpIO.class);
    private static final String SCHEMA_RESOURCE = "/element-dump-schema.json";
    private static final String ELEMENTS_FIELD  = "elements";

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private ScreenDumpIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a screen dump file.
     *
     * @param path path to the dump JSON file
     * @return elements in dump order
     * @throws IOException               if the file cannot be read or parsed
     * @throws SchemaValidationException if the JSON does not look like a screen dump
     */
    public static List<UIElement> read(Path path) throws IOException {
        log.debug("Reading screen dump from: {}", path);
        List<UIElement> elements = parse(Files.readString(path), path.toString());
        log.info("Loaded {} elements from {}", elements.size(), path);
        return elements;
    }

    /**
     * Parses a screen dump from a JSON string, with schema validation.
     *
     * @param source name used in error messages, e.g. a file name
     */
    public static List<UIElement> parse(String json, String source) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || root.isMissingNode()) {
            throw new SchemaValidationException("Empty document: " + source);
        }
        validateSchema(root, source);
        JsonNode elements = root.isArray() ? root : root.get(ELEMENTS_FIELD);
        return MAPPER.readerForListOf(UIElement.class).readValue(elements);
    }

    /**
     * Writes any engine result (discovery result, qualities, elements) to a file,
     * pretty-printed. Parent directories are created.
     */
    public static void write(Object value, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), value);
        log.info("Wrote {} to {}", value.getClass().getSimpleName(), path);
    }

    public static String toJson(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode root, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("element-dump-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (ScreenDumpIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = ScreenDumpIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
