package io.datashape.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregated result of a failed load or update. Schema-level errors are kept apart from errors
 * bound to a field; a field entry holds either its own errors, the error tree of a nested schema
 * load, or both. Errors for raw keys that match no field live in their own section, so a raw key
 * that happens to equal a field name never shares that field's entry.
 *
 * <p>
 * Immutable once built. Insertion order is preserved everywhere so that {@link #raw()} and the
 * exception message list errors in field declaration order.
 */
public final class ErrorTree {

    /** Key under which schema-level errors appear in {@link #raw()}. */
    public static final String SCHEMA_KEY = "_schema";

    /** Key under which errors for unmatched raw keys appear in {@link #raw()}. */
    public static final String UNKNOWN_KEY = "_unknown";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String schemaName;
    private final List<FieldError> schemaErrors;
    private final Map<String, Node> fields;
    private final Map<String, List<FieldError>> unknownKeys;

    private ErrorTree(
            String schemaName,
            List<FieldError> schemaErrors,
            Map<String, Node> fields,
            Map<String, List<FieldError>> unknownKeys) {
        this.schemaName = schemaName;
        this.schemaErrors = List.copyOf(schemaErrors);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.unknownKeys = Collections.unmodifiableMap(new LinkedHashMap<>(unknownKeys));
    }

    public static Builder builder(String schemaName) {
        return new Builder(schemaName);
    }

    /** An empty tree for {@code schemaName}. */
    public static ErrorTree empty(String schemaName) {
        return new Builder(schemaName).build();
    }

    public String schemaName() {
        return schemaName;
    }

    public boolean isEmpty() {
        return schemaErrors.isEmpty() && fields.isEmpty() && unknownKeys.isEmpty();
    }

    public List<FieldError> schemaErrors() {
        return schemaErrors;
    }

    /** Names of every declared field carrying errors, in insertion order. */
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /** Direct errors of {@code field}; empty when it has none or only nested ones. */
    public List<FieldError> fieldErrors(String field) {
        Node node = fields.get(field);
        return node == null ? List.of() : node.errors();
    }

    /** Raw keys that matched no field, in insertion order. */
    public Set<String> unknownKeys() {
        return unknownKeys.keySet();
    }

    /** Errors recorded for the unmatched raw key {@code key}. */
    public List<FieldError> unknownKeyErrors(String key) {
        return unknownKeys.getOrDefault(key, List.of());
    }

    /** The nested tree attached to {@code field}, if any. */
    public Optional<ErrorTree> nested(String field) {
        Node node = fields.get(field);
        return node == null ? Optional.empty() : Optional.ofNullable(node.nested());
    }

    /** Total number of errors, nested trees included. */
    public int errorCount() {
        int count = schemaErrors.size();
        for (Node node : fields.values()) {
            count += node.errors().size();
            if (node.nested() != null) {
                count += node.nested().errorCount();
            }
        }
        for (List<FieldError> errors : unknownKeys.values()) {
            count += errors.size();
        }
        return count;
    }

    /**
     * Plain-map rendering: field name to list of messages, or to the raw map of a nested tree.
     * A field with both direct and nested errors maps to a list of its messages followed by the
     * nested map. Schema-level messages are listed under {@link #SCHEMA_KEY}; unmatched raw keys
     * under {@link #UNKNOWN_KEY}, as a map of raw key to messages.
     */
    public Map<String, Object> raw() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (!schemaErrors.isEmpty()) {
            out.put(SCHEMA_KEY, messages(schemaErrors));
        }
        fields.forEach((name, node) -> {
            if (node.nested() == null) {
                out.put(name, messages(node.errors()));
            } else if (node.errors().isEmpty()) {
                out.put(name, node.nested().raw());
            } else {
                List<Object> mixed = new ArrayList<>(messages(node.errors()));
                mixed.add(node.nested().raw());
                out.put(name, mixed);
            }
        });
        if (!unknownKeys.isEmpty()) {
            Map<String, Object> unknown = new LinkedHashMap<>();
            unknownKeys.forEach((key, errors) -> unknown.put(key, messages(errors)));
            out.put(UNKNOWN_KEY, unknown);
        }
        return out;
    }

    /**
     * Flattened rendering keyed by dotted path ({@code owner.address.city}). Schema-level errors
     * of a nested tree appear under the nested field's own path; at the root under
     * {@link #SCHEMA_KEY}. Unmatched raw keys get the path segment {@link #UNKNOWN_KEY}
     * ({@code address._unknown.country}).
     */
    public Map<String, List<String>> flatten() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        flattenInto("", out);
        return out;
    }

    private void flattenInto(String prefix, Map<String, List<String>> out) {
        if (!schemaErrors.isEmpty()) {
            String key = prefix.isEmpty() ? SCHEMA_KEY : prefix;
            out.computeIfAbsent(key, k -> new ArrayList<>()).addAll(messages(schemaErrors));
        }
        fields.forEach((name, node) -> {
            String path = prefix.isEmpty() ? name : prefix + "." + name;
            if (!node.errors().isEmpty()) {
                out.computeIfAbsent(path, k -> new ArrayList<>()).addAll(messages(node.errors()));
            }
            if (node.nested() != null) {
                node.nested().flattenInto(path, out);
            }
        });
        String unknownPrefix = prefix.isEmpty() ? UNKNOWN_KEY : prefix + "." + UNKNOWN_KEY;
        unknownKeys.forEach((key, errors) -> out.computeIfAbsent(unknownPrefix + "." + key, k -> new ArrayList<>())
                .addAll(messages(errors)));
    }

    /** {@link #raw()} as a Jackson tree. */
    public JsonNode toJson() {
        return MAPPER.valueToTree(raw());
    }

    private static List<String> messages(List<FieldError> errors) {
        List<String> out = new ArrayList<>(errors.size());
        for (FieldError error : errors) {
            out.add(error.message());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorTree that)) return false;
        return Objects.equals(schemaName, that.schemaName)
                && schemaErrors.equals(that.schemaErrors)
                && fields.equals(that.fields)
                && unknownKeys.equals(that.unknownKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, schemaErrors, fields, unknownKeys);
    }

    @Override
    public String toString() {
        return "ErrorTree[" + schemaName + ", " + raw() + "]";
    }

    private record Node(List<FieldError> errors, ErrorTree nested) {}

    /** Collects errors of one operation; not thread-safe. */
    public static final class Builder {

        private final String schemaName;
        private final List<FieldError> schemaErrors = new ArrayList<>();
        private final Map<String, List<FieldError>> fieldErrors = new LinkedHashMap<>();
        private final Map<String, ErrorTree> nested = new LinkedHashMap<>();
        private final List<String> order = new ArrayList<>();
        private final Map<String, List<FieldError>> unknownKeys = new LinkedHashMap<>();

        private Builder(String schemaName) {
            this.schemaName = schemaName;
        }

        public Builder addSchemaError(FieldError error) {
            schemaErrors.add(Objects.requireNonNull(error, "error must not be null"));
            return this;
        }

        public Builder addFieldError(String field, FieldError error) {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(error, "error must not be null");
            touch(field);
            fieldErrors.computeIfAbsent(field, k -> new ArrayList<>()).add(error.withField(field));
            return this;
        }

        public Builder addFieldErrors(String field, List<FieldError> errors) {
            for (FieldError error : errors) {
                addFieldError(field, error);
            }
            return this;
        }

        /** Records an error for a raw key that matches no declared field. */
        public Builder addUnknownKey(String key, FieldError error) {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(error, "error must not be null");
            unknownKeys.computeIfAbsent(key, k -> new ArrayList<>()).add(error.withField(key));
            return this;
        }

        /** Attaches a nested tree under {@code field}; empty trees are ignored. */
        public Builder addNested(String field, ErrorTree tree) {
            Objects.requireNonNull(field, "field must not be null");
            if (tree == null || tree.isEmpty()) {
                return this;
            }
            touch(field);
            nested.put(field, tree);
            return this;
        }

        public boolean isEmpty() {
            return order.isEmpty() && schemaErrors.isEmpty() && unknownKeys.isEmpty();
        }

        private void touch(String field) {
            if (!fieldErrors.containsKey(field) && !nested.containsKey(field)) {
                order.add(field);
            }
        }

        public ErrorTree build() {
            Map<String, Node> nodes = new LinkedHashMap<>();
            for (String field : order) {
                nodes.put(field, new Node(List.copyOf(fieldErrors.getOrDefault(field, List.of())), nested.get(field)));
            }
            Map<String, List<FieldError>> unknown = new LinkedHashMap<>();
            unknownKeys.forEach((key, errors) -> unknown.put(key, List.copyOf(errors)));
            return new ErrorTree(schemaName, schemaErrors, nodes, unknown);
        }
    }
}
