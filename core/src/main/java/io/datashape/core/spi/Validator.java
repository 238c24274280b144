package io.datashape.core.spi;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.error.ValidationFailedException;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * A check attached to a field. Registered either as a raw validator (sees the input value before
 * deserialization) or as a post-coercion validator (sees the stored value).
 *
 * <p>
 * A validator reports failure by throwing {@link ValidationFailedException}, or
 * {@link IllegalArgumentException} / {@link IllegalStateException}; the exception message becomes
 * the field error message. Returning normally means the value passed. Any other exception is a
 * bug in the validator and propagates to the caller.
 *
 * @param <T> the value type the validator accepts
 */
@FunctionalInterface
public interface Validator<T> {

    void validate(T value, SchemaContext context);

    /** A predicate validator that fails with the default message when the predicate is false. */
    static <T> Validator<T> check(Predicate<? super T> predicate) {
        return check(predicate, null);
    }

    /**
     * A predicate validator failing with {@code message} (or the default message when
     * {@code null}) whenever the predicate is false.
     */
    static <T> Validator<T> check(Predicate<? super T> predicate, String message) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return (value, context) -> {
            if (!predicate.test(value)) {
                throw new ValidationFailedException(message);
            }
        };
    }

    /** Like {@link #check(Predicate, String)}, with access to the schema context. */
    static <T> Validator<T> checkWithContext(BiPredicate<? super T, SchemaContext> predicate, String message) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return (value, context) -> {
            if (!predicate.test(value, context)) {
                throw new ValidationFailedException(message);
            }
        };
    }
}
