package io.datashape.core.field;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.engine.SchemaEngine;
import io.datashape.core.engine.SchemaInstance;
import io.datashape.core.engine.SchemaType;
import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field holding an instance of another schema type. A raw mapping is loaded recursively and its
 * errors are attached under this field as a nested tree; an existing, complete instance of the
 * same type is stored as is.
 */
public class ObjectType extends FieldType<SchemaInstance> {

    private final SchemaType schemaType;

    public ObjectType(SchemaType schemaType) {
        this.schemaType = Objects.requireNonNull(schemaType, "schemaType must not be null");
    }

    public SchemaType schemaType() {
        return schemaType;
    }

    @Override
    public String label() {
        return schemaType.name();
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        if (raw instanceof SchemaInstance instance && acceptsInstance(instance)) {
            return instance;
        }
        Map<String, Object> mapping = SchemaEngine.asRawMap(raw);
        if (mapping == null) {
            throw new FieldValueException(
                    ErrorCode.INVALID_DATATYPE, "Value for this field must be a " + schemaType.name() + " object.", raw);
        }
        return mapping;
    }

    @Override
    @SuppressWarnings("unchecked")
    public SchemaInstance deserialize(Object resolved, LoadContext context) {
        if (resolved instanceof SchemaInstance instance) {
            return adopt(instance);
        }
        SchemaEngine.NestedLoad result = context.engine().loadNested(schemaType, (Map<String, Object>) resolved, allowed());
        if (!result.isSuccess()) {
            throw new FieldValueException(result.errors());
        }
        return result.instance();
    }

    @Override
    public Object serialize(SchemaInstance value, SchemaContext context) {
        return value.dump();
    }

    /** Whether an existing instance may be stored without a reload. */
    boolean acceptsInstance(SchemaInstance instance) {
        return instance.type() == schemaType && !instance.isPartial();
    }

    /** Turns an accepted instance into the stored value. */
    SchemaInstance adopt(SchemaInstance instance) {
        return instance;
    }

    /** Allow-list for nested loads; {@code null} loads every field. */
    Set<String> allowed() {
        return null;
    }
}
