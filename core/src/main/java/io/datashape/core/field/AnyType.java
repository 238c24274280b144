package io.datashape.core.field;

/** Accepts every value unchanged. */
public final class AnyType extends FieldType<Object> {

    static final AnyType INSTANCE = new AnyType();

    private AnyType() {}

    @Override
    public String label() {
        return "any";
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        return raw;
    }
}
