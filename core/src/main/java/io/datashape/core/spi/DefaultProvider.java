package io.datashape.core.spi;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.field.FieldDescriptor;

/**
 * Computes a default value for a field absent from the input. Called once per load, with the
 * descriptor of the field and the context of the instance being built. The result is stored
 * without validation.
 */
@FunctionalInterface
public interface DefaultProvider<T> {

    T get(FieldDescriptor<T> descriptor, SchemaContext context);
}
