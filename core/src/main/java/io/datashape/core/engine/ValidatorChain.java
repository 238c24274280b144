package io.datashape.core.engine;

import io.datashape.core.error.ValidationFailedException;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.FieldError;
import io.datashape.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable list of validators attached to one field. Each unit is either raw (runs on
 * the input value before deserialization) or post-coercion (runs on the stored value).
 *
 * <p>
 * Every validator of the selected mode runs, in registration order, even after an earlier one
 * failed; each failure yields one {@link ErrorCode#VALIDATION_FAILED} error.
 */
public final class ValidatorChain {

    private static final ValidatorChain EMPTY = new ValidatorChain(List.of());

    /** One registered validator and its mode. */
    public record Unit(Validator<?> validator, boolean raw) {
        public Unit {
            Objects.requireNonNull(validator, "validator must not be null");
        }
    }

    private final List<Unit> units;

    private ValidatorChain(List<Unit> units) {
        this.units = List.copyOf(units);
    }

    public static ValidatorChain empty() {
        return EMPTY;
    }

    /** A copy with {@code validator} appended. */
    public ValidatorChain with(Validator<?> validator, boolean raw) {
        List<Unit> next = new ArrayList<>(units);
        next.add(new Unit(validator, raw));
        return new ValidatorChain(next);
    }

    /** A copy without any unit holding {@code validator} (compared by identity). */
    public ValidatorChain without(Validator<?> validator) {
        List<Unit> next = new ArrayList<>(units.size());
        for (Unit unit : units) {
            if (unit.validator() != validator) {
                next.add(unit);
            }
        }
        return new ValidatorChain(next);
    }

    /** An empty chain. */
    public ValidatorChain cleared() {
        return EMPTY;
    }

    /** A copy without the units of the given mode. */
    public ValidatorChain cleared(boolean raw) {
        List<Unit> next = new ArrayList<>(units.size());
        for (Unit unit : units) {
            if (unit.raw() != raw) {
                next.add(unit);
            }
        }
        return new ValidatorChain(next);
    }

    /** Every unit, in registration order. */
    public List<Unit> walk() {
        return units;
    }

    /** The validators of one mode, in registration order. */
    public List<Validator<?>> walk(boolean raw) {
        List<Validator<?>> out = new ArrayList<>();
        for (Unit unit : units) {
            if (unit.raw() == raw) {
                out.add(unit.validator());
            }
        }
        return out;
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public int size() {
        return units.size();
    }

    /**
     * Runs every validator of one mode against {@code value}.
     *
     * @return the failures, unbound to a field name; empty when all passed
     */
    public List<FieldError> run(Object value, SchemaContext context, boolean raw) {
        List<FieldError> errors = new ArrayList<>();
        for (Unit unit : units) {
            if (unit.raw() != raw) {
                continue;
            }
            try {
                invoke(unit.validator(), value, context);
            } catch (ValidationFailedException e) {
                errors.add(FieldError.of(ErrorCode.VALIDATION_FAILED, e.getMessage())
                        .withValue(value)
                        .withState(e.state()));
            } catch (IllegalArgumentException | IllegalStateException e) {
                errors.add(FieldError.of(ErrorCode.VALIDATION_FAILED, e.getMessage()).withValue(value));
            }
        }
        return errors;
    }

    // raw validators take Object; post validators take the field's stored type
    @SuppressWarnings("unchecked")
    private static <T> void invoke(Validator<T> validator, Object value, SchemaContext context) {
        validator.validate((T) value, context);
    }

    @Override
    public String toString() {
        return "ValidatorChain" + units;
    }
}
