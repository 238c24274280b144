package io.datashape.core.field;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.engine.SchemaEngine;
import java.util.Objects;

/**
 * What a field type sees while resolving one value.
 *
 * @param engine        the engine running the operation; nested loads go through it
 * @param schemaContext context of the instance being loaded or updated
 * @param fromRawData   {@code true} for loads and raw updates (keys are load keys, strictness is
 *                      {@code strictLoad}); {@code false} for assignment by field name
 */
public record LoadContext(SchemaEngine engine, SchemaContext schemaContext, boolean fromRawData) {

    public LoadContext {
        Objects.requireNonNull(engine, "engine must not be null");
    }
}
