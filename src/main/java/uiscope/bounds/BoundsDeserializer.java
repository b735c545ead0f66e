package uiscope.bounds;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson deserializer accepting {@code "bounds"} either as the dump string
 * {@code "[l,t][r,b]"}, a {@code {left,top,right,bottom}} object, or a
 * four-element array. Anything else deserializes to {@code null} so the
 * element still loads but stays out of geometric containment.
 */
public class BoundsDeserializer extends StdDeserializer<Bounds> {

    private static final Logger log = LoggerFactory.getLogger(BoundsDeserializer.class);

    public BoundsDeserializer() {
        super(Bounds.class);
    }

    @Override
    public Bounds deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || node.isNull() || node.isMissingNode()) return null;

        if (node.isTextual()) {
            return BoundsNormalizer.parse(node.asText());
        }
        if (node.isObject()) {
            Map<String, Object> quad = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> quad.put(e.getKey(), scalar(e.getValue())));
            return BoundsNormalizer.normalize(quad);
        }
        if (node.isArray() && node.size() == 4) {
            int[] quad = new int[4];
            for (int i = 0; i < 4; i++) {
                JsonNode v = node.get(i);
                if (!v.isNumber()) {
                    log.debug("Non-numeric bounds array entry: {}", node);
                    return null;
                }
                quad[i] = v.asInt();
            }
            return BoundsNormalizer.normalize(quad);
        }
        log.debug("Unsupported bounds JSON: {}", node);
        return null;
    }

    private static Object scalar(JsonNode v) {
        if (v.isNumber()) return v.numberValue();
        if (v.isTextual()) return v.asText();
        return null;
    }
}
