package io.datashape.core.field;

import io.datashape.core.engine.SchemaInstance;
import io.datashape.core.engine.SchemaType;
import java.util.Collection;
import java.util.Set;

/**
 * Field holding a partial instance of another schema type: only an allow-list of its fields is
 * validated and accessible. The allow-list is given as {@code include} or as {@code exclude},
 * never both.
 *
 * <p>
 * A complete instance of the type is accepted and copied into a new partial instance; the
 * caller's instance is left untouched.
 */
public final class PartialType extends ObjectType {

    private final Set<String> allowed;

    public PartialType(SchemaType schemaType, Collection<String> include, Collection<String> exclude) {
        super(schemaType);
        this.allowed = schemaType.selectFields(include, exclude);
    }

    public Set<String> allowedFields() {
        return allowed;
    }

    @Override
    public String label() {
        return "partial[" + schemaType().name() + "]";
    }

    @Override
    boolean acceptsInstance(SchemaInstance instance) {
        return instance.type() == schemaType();
    }

    @Override
    SchemaInstance adopt(SchemaInstance instance) {
        return instance.restrictTo(allowed);
    }

    @Override
    Set<String> allowed() {
        return allowed;
    }
}
