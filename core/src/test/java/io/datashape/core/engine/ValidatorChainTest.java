package io.datashape.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.datashape.core.error.ValidationFailedException;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.FieldError;
import io.datashape.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ValidatorChain")
class ValidatorChainTest {

    private final Validator<Object> failsWithState = (value, context) -> {
        throw new ValidationFailedException("too short", 3);
    };
    private final Validator<Object> failsWithIllegalArgument = (value, context) -> {
        throw new IllegalArgumentException("not allowed");
    };

    @Test
    @DisplayName("every validator runs, failures in registration order")
    void allValidatorsRun() {
        List<String> seen = new ArrayList<>();
        ValidatorChain chain = ValidatorChain.empty()
                .with(failsWithState, false)
                .with((value, context) -> seen.add("third"), false)
                .with(failsWithIllegalArgument, false);

        List<FieldError> errors = chain.run("x", null, false);

        assertThat(errors).extracting(FieldError::message).containsExactly("too short", "not allowed");
        assertThat(errors).allSatisfy(e -> assertThat(e.code()).isEqualTo(ErrorCode.VALIDATION_FAILED));
        assertThat(seen).containsExactly("third");
    }

    @Test
    void failureStateIsAttached() {
        List<FieldError> errors = ValidatorChain.empty().with(failsWithState, false).run("x", null, false);

        assertThat(errors.get(0).state()).isEqualTo(3);
        assertThat(errors.get(0).value()).isEqualTo("x");
    }

    @Test
    void predicateValidatorUsesDefaultMessage() {
        ValidatorChain chain = ValidatorChain.empty().with(Validator.<String>check(s -> s.startsWith("a")), false);

        assertThat(chain.run("abc", null, false)).isEmpty();
        assertThat(chain.run("xyz", null, false))
                .extracting(FieldError::message)
                .containsExactly("Validation failed for this field.");
    }

    @Test
    void predicateValidatorWithMessage() {
        ValidatorChain chain =
                ValidatorChain.empty().with(Validator.<Integer>check(n -> n % 2 == 0, "Must be even"), false);

        assertThat(chain.run(3, null, false)).extracting(FieldError::message).containsExactly("Must be even");
    }

    @Test
    @DisplayName("only the units of the requested mode run")
    void modesAreSeparate() {
        ValidatorChain chain = ValidatorChain.empty().with(failsWithState, true).with(failsWithIllegalArgument, false);

        assertThat(chain.run("x", null, true)).extracting(FieldError::message).containsExactly("too short");
        assertThat(chain.run("x", null, false)).extracting(FieldError::message).containsExactly("not allowed");
        assertThat(chain.walk(true)).containsExactly(failsWithState);
        assertThat(chain.walk(false)).containsExactly(failsWithIllegalArgument);
        assertThat(chain.walk()).hasSize(2);
    }

    @Test
    void removeAndClearReturnCopies() {
        ValidatorChain chain = ValidatorChain.empty().with(failsWithState, true).with(failsWithIllegalArgument, false);

        assertThat(chain.without(failsWithState).walk(true)).isEmpty();
        assertThat(chain.cleared(true).walk()).extracting(ValidatorChain.Unit::raw).containsExactly(false);
        assertThat(chain.cleared(false).walk()).extracting(ValidatorChain.Unit::raw).containsExactly(true);
        assertThat(chain.cleared().isEmpty()).isTrue();
        assertThat(chain.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("unexpected exceptions are bugs and propagate")
    void otherExceptionsPropagate() {
        ValidatorChain chain = ValidatorChain.empty().with((value, context) -> {
            throw new UnsupportedOperationException("bug");
        }, false);

        assertThatThrownBy(() -> chain.run("x", null, false)).isInstanceOf(UnsupportedOperationException.class);
    }
}
