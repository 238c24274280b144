package io.datashape.core.spec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.datashape.core.error.TypeExpressionParseException;
import io.datashape.core.model.PrimitiveType;
import io.datashape.core.model.TypeExpression;
import io.datashape.core.model.TypeExpression.Any;
import io.datashape.core.model.TypeExpression.Atom;
import io.datashape.core.model.TypeExpression.Literal;
import io.datashape.core.model.TypeExpression.Mapping;
import io.datashape.core.model.TypeExpression.RecordField;
import io.datashape.core.model.TypeExpression.Sequence;
import io.datashape.core.model.TypeExpression.SetOf;
import io.datashape.core.model.TypeExpression.Tuple;
import io.datashape.core.model.TypeExpression.TypedRecord;
import io.datashape.core.model.TypeExpression.Union;
import io.datashape.core.model.TypeExpression.Unsupported;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles type-expression descriptors (JSON or YAML) into {@link TypeExpression} trees.
 *
 * <p>
 * A descriptor is either an atom name ({@code string}, {@code integer}, {@code float},
 * {@code number}, {@code boolean}, {@code none}, {@code any}) or a single-key object:
 *
 * <pre>
 * union: [string, integer]
 * optional: string
 * literal: [red, green, 3]
 * sequence: integer
 * set: string
 * tuple: [string, float]
 * mapping: {key: string, value: integer}
 * record: {id: integer, tags: {type: {sequence: string}, required: false}}
 * unsupported: callable
 * </pre>
 *
 * <p>
 * Every descriptor is first validated against the bundled JSON Schema
 * {@code type-expression.schema.json}; all violations are reported together. Compiled
 * expressions are cached by canonical descriptor text.
 *
 * <p>
 * Thread-safe: the cache is a {@link ConcurrentHashMap} and compiled expressions are immutable.
 */
public final class TypeExpressionParser {

    private static final Logger LOG = LoggerFactory.getLogger(TypeExpressionParser.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String DESCRIPTOR_SCHEMA = "/type-expression.schema.json";
    private static final String INLINE = "<inline>";

    private final JsonSchema descriptorSchema;
    private final Map<String, TypeExpression> cache = new ConcurrentHashMap<>();

    public TypeExpressionParser() {
        try (InputStream in = TypeExpressionParser.class.getResourceAsStream(DESCRIPTOR_SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DESCRIPTOR_SCHEMA);
            }
            this.descriptorSchema = SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read classpath resource " + DESCRIPTOR_SCHEMA, e);
        }
    }

    /** Parses descriptor text; YAML is accepted, and so JSON too. */
    public TypeExpression parse(String text) {
        JsonNode node;
        try {
            node = YAML_MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new TypeExpressionParseException("Failed to parse descriptor: " + e.getOriginalMessage(), e, INLINE);
        }
        return parse(node, INLINE);
    }

    /** Parses a descriptor file (YAML or JSON). */
    public TypeExpression parse(Path path) {
        String source = path.toString();
        JsonNode node;
        try {
            node = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new TypeExpressionParseException("Failed to read or parse descriptor: " + e.getMessage(), e, source);
        }
        return parse(node, source);
    }

    public TypeExpression parse(JsonNode descriptor) {
        return parse(descriptor, INLINE);
    }

    /** Number of distinct descriptors compiled so far. */
    public int cacheSize() {
        return cache.size();
    }

    private TypeExpression parse(JsonNode descriptor, String source) {
        if (descriptor == null || descriptor.isMissingNode()) {
            throw new TypeExpressionParseException("Descriptor is empty", source);
        }
        String key = canonical(descriptor, source);
        TypeExpression cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        Set<ValidationMessage> violations = descriptorSchema.validate(descriptor);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new TypeExpressionParseException("Invalid type expression descriptor: " + detail, source);
        }

        TypeExpression compiled = compile(descriptor, source);
        LOG.debug("Compiled type expression: source={}, label={}", source, compiled.label());
        TypeExpression existing = cache.putIfAbsent(key, compiled);
        return existing != null ? existing : compiled;
    }

    // ── Compilation ──

    private TypeExpression compile(JsonNode node, String source) {
        if (node.isTextual()) {
            return compileAtom(node.asText(), source);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        if (!node.isObject() || !fields.hasNext()) {
            throw new TypeExpressionParseException("Expected an atom name or a single-key object, got " + node, source);
        }
        Map.Entry<String, JsonNode> entry = fields.next();
        JsonNode body = entry.getValue();
        return switch (entry.getKey()) {
            case "union" -> new Union(compileAll(body, source));
            case "optional" -> TypeExpression.optional(compile(body, source));
            case "literal" -> new Literal(literalValues(body));
            case "sequence" -> new Sequence(compile(body, source));
            case "set" -> new SetOf(compile(body, source));
            case "tuple" -> new Tuple(compileAll(body, source));
            case "mapping" -> new Mapping(compile(body.get("key"), source), compile(body.get("value"), source));
            case "record" -> compileRecord(body, source);
            case "unsupported" -> new Unsupported(body.asText());
            default -> throw new TypeExpressionParseException("Unknown type expression '" + entry.getKey() + "'", source);
        };
    }

    private static TypeExpression compileAtom(String name, String source) {
        if ("any".equals(name)) {
            return TypeExpression.any();
        }
        PrimitiveType primitive = PrimitiveType.fromLabel(name);
        if (primitive == null) {
            throw new TypeExpressionParseException("Unknown atom '" + name + "'", source);
        }
        return TypeExpression.atom(primitive);
    }

    private List<TypeExpression> compileAll(JsonNode array, String source) {
        List<TypeExpression> out = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            out.add(compile(element, source));
        }
        return out;
    }

    private TypedRecord compileRecord(JsonNode body, String source) {
        List<RecordField> fields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = body.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            if (value.isObject() && value.has("type")) {
                boolean required = !value.has("required") || value.get("required").asBoolean();
                fields.add(new RecordField(entry.getKey(), compile(value.get("type"), source), required));
            } else {
                fields.add(RecordField.required(entry.getKey(), compile(value, source)));
            }
        }
        return new TypedRecord(fields);
    }

    private static List<Object> literalValues(JsonNode array) {
        List<Object> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            values.add(JSON_MAPPER.convertValue(element, Object.class));
        }
        return values;
    }

    private static String canonical(JsonNode descriptor, String source) {
        try {
            return JSON_MAPPER.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new TypeExpressionParseException("Cannot serialize descriptor: " + e.getOriginalMessage(), e, source);
        }
    }

    // ── Descriptor form ──

    /**
     * The descriptor of {@code expression}, accepted back by {@link #parse(JsonNode)}.
     *
     * @throws IllegalArgumentException for atoms bound to a Java class, which have no
     *                                  descriptor form
     */
    public static JsonNode toDescriptor(TypeExpression expression) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        if (expression instanceof Any) {
            return nodes.textNode("any");
        }
        if (expression instanceof Atom atom) {
            if (atom.primitive() == null) {
                throw new IllegalArgumentException("Class atom '" + atom.label() + "' has no descriptor form");
            }
            return nodes.textNode(atom.primitive().label());
        }
        ObjectNode out = nodes.objectNode();
        if (expression instanceof Union union) {
            ArrayNode variants = out.putArray("union");
            union.variants().forEach(v -> variants.add(toDescriptor(v)));
        } else if (expression instanceof Literal literal) {
            ArrayNode values = out.putArray("literal");
            literal.values().forEach(v -> values.add(JSON_MAPPER.valueToTree(v)));
        } else if (expression instanceof Sequence sequence) {
            out.set("sequence", toDescriptor(sequence.element()));
        } else if (expression instanceof SetOf setOf) {
            out.set("set", toDescriptor(setOf.element()));
        } else if (expression instanceof Tuple tuple) {
            ArrayNode elements = out.putArray("tuple");
            tuple.elements().forEach(e -> elements.add(toDescriptor(e)));
        } else if (expression instanceof Mapping mapping) {
            ObjectNode body = out.putObject("mapping");
            body.set("key", toDescriptor(mapping.key()));
            body.set("value", toDescriptor(mapping.value()));
        } else if (expression instanceof TypedRecord record) {
            ObjectNode body = out.putObject("record");
            for (RecordField field : record.fields()) {
                if (field.required()) {
                    body.set(field.key(), toDescriptor(field.type()));
                } else {
                    ObjectNode entry = body.putObject(field.key());
                    entry.set("type", toDescriptor(field.type()));
                    entry.put("required", false);
                }
            }
        } else if (expression instanceof Unsupported unsupported) {
            out.put("unsupported", unsupported.label());
        }
        return out;
    }
}
