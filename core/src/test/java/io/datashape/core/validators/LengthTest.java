package io.datashape.core.validators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.datashape.core.error.ValidationFailedException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Length")
class LengthTest {

    @Test
    void measuresStringsCollectionsMapsAndArrays() {
        Length two = Length.exactly(2);

        assertThatCode(() -> {
                    two.validate("ab", null);
                    two.validate(List.of(1, 2), null);
                    two.validate(Set.of("a", "b"), null);
                    two.validate(Map.of("a", 1, "b", 2), null);
                    two.validate(new String[] {"a", "b"}, null);
                })
                .doesNotThrowAnyException();
    }

    @Test
    void messagesDescribeTheBounds() {
        assertThatThrownBy(() -> Length.exactly(3).validate("ab", null)).hasMessage("Length must be exactly 3");
        assertThatThrownBy(() -> Length.atLeast(3).validate("ab", null)).hasMessage("Length must be at least 3");
        assertThatThrownBy(() -> Length.atMost(1).validate("ab", null)).hasMessage("Length must be at most 1");
        assertThatThrownBy(() -> new Length(3, 5).validate("ab", null)).hasMessage("Length must be between 3 and 5");
    }

    @Test
    @DisplayName("the measured length is attached as failure state")
    void lengthIsFailureState() {
        assertThatThrownBy(() -> Length.atMost(1).validate(List.of(1, 2, 3), null))
                .isInstanceOfSatisfying(
                        ValidationFailedException.class, e -> assertThat(e.state()).isEqualTo(3));
    }

    @Test
    void unmeasurableValue() {
        assertThatThrownBy(() -> Length.atLeast(1).validate(42, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Length cannot be measured for Integer");
    }

    @Test
    void invalidBounds() {
        assertThatThrownBy(() -> new Length(-1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Length(3, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
