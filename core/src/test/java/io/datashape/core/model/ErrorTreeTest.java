package io.datashape.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorTree")
class ErrorTreeTest {

    @Nested
    @DisplayName("Building")
    class Building {

        @Test
        @DisplayName("empty builder → empty tree")
        void emptyTree() {
            ErrorTree tree = ErrorTree.builder("User").build();

            assertThat(tree.isEmpty()).isTrue();
            assertThat(tree.raw()).isEmpty();
            assertThat(tree.errorCount()).isZero();
        }

        @Test
        @DisplayName("field errors are bound to the field name")
        void fieldErrorsAreBound() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addFieldError("age", FieldError.of(ErrorCode.INVALID_DATATYPE, "bad"))
                    .build();

            assertThat(tree.fieldErrors("age")).singleElement().satisfies(e -> {
                assertThat(e.field()).isEqualTo("age");
                assertThat(e.message()).isEqualTo("bad");
            });
            assertThat(tree.fieldErrors("name")).isEmpty();
        }

        @Test
        @DisplayName("empty nested tree is ignored")
        void emptyNestedIgnored() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addNested("address", ErrorTree.empty("Address"))
                    .build();

            assertThat(tree.isEmpty()).isTrue();
            assertThat(tree.nested("address")).isEmpty();
        }

        @Test
        @DisplayName("insertion order is preserved")
        void insertionOrder() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addFieldError("b", FieldError.of(ErrorCode.FIELD_REQUIRED))
                    .addFieldError("a", FieldError.of(ErrorCode.FIELD_REQUIRED))
                    .addFieldError("b", FieldError.of(ErrorCode.VALIDATION_FAILED))
                    .build();

            assertThat(tree.fieldNames()).containsExactly("b", "a");
            assertThat(tree.fieldErrors("b")).hasSize(2);
            assertThat(tree.errorCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        private final ErrorTree inner = ErrorTree.builder("Address")
                .addFieldError("city", FieldError.of(ErrorCode.FIELD_REQUIRED))
                .build();

        @Test
        @DisplayName("raw → messages per field, nested maps, schema errors under _schema")
        void rawForm() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addSchemaError(FieldError.of(ErrorCode.VALIDATION_FAILED, "passwords differ"))
                    .addFieldError("name", FieldError.of(ErrorCode.FIELD_REQUIRED))
                    .addNested("address", inner)
                    .build();

            assertThat(tree.raw())
                    .containsExactly(
                            Map.entry(ErrorTree.SCHEMA_KEY, List.of("passwords differ")),
                            Map.entry("name", List.of("This field is required.")),
                            Map.entry("address", Map.of("city", List.of("This field is required."))));
        }

        @Test
        @DisplayName("field with direct and nested errors → messages followed by nested map")
        void mixedEntry() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addFieldError("address", FieldError.of(ErrorCode.VALIDATION_FAILED, "not in service area"))
                    .addNested("address", inner)
                    .build();

            assertThat(tree.raw().get("address"))
                    .isEqualTo(List.of("not in service area", Map.of("city", List.of("This field is required."))));
            assertThat(tree.errorCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("flatten → dotted paths")
        void flatten() {
            ErrorTree outer = ErrorTree.builder("Order")
                    .addNested("customer", ErrorTree.builder("User").addNested("address", inner).build())
                    .addFieldError("total", FieldError.of(ErrorCode.INVALID_DATATYPE, "not a number"))
                    .build();

            assertThat(outer.flatten())
                    .containsExactly(
                            Map.entry("customer.address.city", List.of("This field is required.")),
                            Map.entry("total", List.of("not a number")));
        }

        @Test
        @DisplayName("unknown raw keys are kept apart from a field of the same name")
        void unknownKeysHaveTheirOwnSection() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addFieldError("id", FieldError.of(ErrorCode.FIELD_REQUIRED))
                    .addUnknownKey("id", FieldError.of(ErrorCode.UNKNOWN_FIELD))
                    .build();

            assertThat(tree.fieldErrors("id")).extracting(FieldError::code).containsExactly(ErrorCode.FIELD_REQUIRED);
            assertThat(tree.unknownKeyErrors("id")).extracting(FieldError::code).containsExactly(ErrorCode.UNKNOWN_FIELD);
            assertThat(tree.errorCount()).isEqualTo(2);
            assertThat(tree.raw())
                    .containsExactly(
                            Map.entry("id", List.of("This field is required.")),
                            Map.entry(ErrorTree.UNKNOWN_KEY, Map.of("id", List.of("Invalid or unknown field."))));
            assertThat(tree.flatten()).containsOnlyKeys("id", "_unknown.id");
        }

        @Test
        void unknownKeysAloneMakeTheTreeNonEmpty() {
            ErrorTree tree = ErrorTree.builder("User")
                    .addUnknownKey("extra", FieldError.of(ErrorCode.UNKNOWN_FIELD))
                    .build();

            assertThat(tree.isEmpty()).isFalse();
            assertThat(tree.fieldNames()).isEmpty();
            assertThat(tree.unknownKeys()).containsExactly("extra");
        }

        @Test
        @DisplayName("toJson mirrors raw")
        void toJson() {
            ErrorTree tree = ErrorTree.builder("User").addNested("address", inner).build();

            JsonNode json = tree.toJson();

            assertThat(json.path("address").path("city").get(0).asText()).isEqualTo("This field is required.");
        }
    }
}
