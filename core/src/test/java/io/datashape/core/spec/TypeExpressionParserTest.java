package io.datashape.core.spec;

import static io.datashape.core.model.TypeExpression.any;
import static io.datashape.core.model.TypeExpression.bool;
import static io.datashape.core.model.TypeExpression.floating;
import static io.datashape.core.model.TypeExpression.integer;
import static io.datashape.core.model.TypeExpression.literal;
import static io.datashape.core.model.TypeExpression.mapping;
import static io.datashape.core.model.TypeExpression.none;
import static io.datashape.core.model.TypeExpression.optional;
import static io.datashape.core.model.TypeExpression.record;
import static io.datashape.core.model.TypeExpression.sequence;
import static io.datashape.core.model.TypeExpression.setOf;
import static io.datashape.core.model.TypeExpression.string;
import static io.datashape.core.model.TypeExpression.tuple;
import static io.datashape.core.model.TypeExpression.union;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.datashape.core.engine.TypeExpressionValidator;
import io.datashape.core.error.TypeExpressionParseException;
import io.datashape.core.model.TypeExpression;
import io.datashape.core.model.TypeExpression.RecordField;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TypeExpressionParser")
class TypeExpressionParserTest {

    private final TypeExpressionParser parser = new TypeExpressionParser();

    @Nested
    @DisplayName("Valid descriptors")
    class ValidDescriptors {

        @Test
        void atoms() {
            assertThat(parser.parse("string")).isEqualTo(string());
            assertThat(parser.parse("integer")).isEqualTo(integer());
            assertThat(parser.parse("float")).isEqualTo(floating());
            assertThat(parser.parse("boolean")).isEqualTo(bool());
            assertThat(parser.parse("none")).isEqualTo(none());
            assertThat(parser.parse("any")).isEqualTo(any());
        }

        @Test
        void composites() {
            assertThat(parser.parse("union: [string, integer]")).isEqualTo(union(string(), integer()));
            assertThat(parser.parse("optional: string")).isEqualTo(optional(string()));
            assertThat(parser.parse("sequence: integer")).isEqualTo(sequence(integer()));
            assertThat(parser.parse("set: string")).isEqualTo(setOf(string()));
            assertThat(parser.parse("tuple: [string, float]")).isEqualTo(tuple(string(), floating()));
            assertThat(parser.parse("mapping: {key: string, value: integer}"))
                    .isEqualTo(mapping(string(), integer()));
        }

        @Test
        void literalValuesKeepTheirTypes() {
            assertThat(parser.parse("literal: [red, 3, true, null]")).isEqualTo(literal("red", 3, true, null));
        }

        @Test
        @DisplayName("record entries are required unless declared with required: false")
        void records() {
            TypeExpression parsed = parser.parse("record: {id: integer, tags: {type: {sequence: string}, required: false}}");

            assertThat(parsed)
                    .isEqualTo(record(
                            RecordField.required("id", integer()),
                            RecordField.optional("tags", sequence(string()))));
        }

        @Test
        void jsonIsAcceptedToo() {
            assertThat(parser.parse("{\"sequence\": {\"optional\": \"integer\"}}"))
                    .isEqualTo(sequence(optional(integer())));
        }

        @Test
        void unsupportedIsCompiledAsIs() {
            assertThat(parser.parse("unsupported: callable")).isEqualTo(TypeExpression.unsupported("callable"));
        }

        @Test
        @DisplayName("compiled expressions validate values")
        void compiledExpressionValidates() {
            TypeExpression expr = parser.parse("mapping: {key: string, value: {union: [integer, none]}}");
            TypeExpressionValidator validator = new TypeExpressionValidator(false);

            assertThat(validator.matches(Map.of("a", 1), expr)).isTrue();
            assertThat(validator.matches(Map.of("a", "x"), expr)).isFalse();
        }

        @Test
        void descriptorFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("point.yaml");
            Files.writeString(file, "tuple:\n  - integer\n  - integer\n");

            assertThat(parser.parse(file)).isEqualTo(tuple(integer(), integer()));
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        void sameDescriptorIsCompiledOnce() {
            TypeExpression first = parser.parse("sequence: string");
            TypeExpression second = parser.parse("{\"sequence\": \"string\"}");

            assertThat(second).isSameAs(first);
            assertThat(parser.cacheSize()).isEqualTo(1);
        }

        @Test
        void distinctDescriptorsAreCachedSeparately() {
            parser.parse("sequence: string");
            parser.parse("sequence: integer");

            assertThat(parser.cacheSize()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Invalid descriptors")
    class InvalidDescriptors {

        @ParameterizedTest
        @ValueSource(strings = {"text", "union: []", "mapping: {key: string}", "sequence: [string]", "{a: 1, b: 2}"})
        void rejectedBySchema(String descriptor) {
            assertThatThrownBy(() -> parser.parse(descriptor))
                    .isInstanceOf(TypeExpressionParseException.class)
                    .hasMessageStartingWith("Invalid type expression descriptor: ");
        }

        @Test
        void malformedYaml() {
            assertThatThrownBy(() -> parser.parse("union: [string"))
                    .isInstanceOfSatisfying(TypeExpressionParseException.class, e -> {
                        assertThat(e.getMessage()).startsWith("Failed to parse descriptor");
                        assertThat(e.source()).isEqualTo("<inline>");
                    });
        }

        @Test
        void emptyDescriptor() {
            assertThatThrownBy(() -> parser.parse(""))
                    .isInstanceOf(TypeExpressionParseException.class);
        }

        @Test
        void missingFileNamesThePath(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> parser.parse(missing))
                    .isInstanceOfSatisfying(TypeExpressionParseException.class, e -> assertThat(e.source())
                            .isEqualTo(missing.toString()));
        }
    }

    @Nested
    @DisplayName("Descriptor form")
    class DescriptorForm {

        @Test
        void descriptorIsParsedBackToTheSameExpression() {
            TypeExpression expr = record(
                    RecordField.required("id", integer()),
                    RecordField.optional("scores", mapping(string(), union(integer(), floating()))),
                    RecordField.required("kind", literal("a", 1)),
                    RecordField.required("pair", tuple(string(), setOf(bool()))));

            assertThat(parser.parse(TypeExpressionParser.toDescriptor(expr))).isEqualTo(expr);
        }

        @Test
        void classAtomsHaveNoDescriptor() {
            assertThatThrownBy(() -> TypeExpressionParser.toDescriptor(sequence(TypeExpression.instanceOf(LocalDate.class))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void simpleDescriptors() {
            assertThat(TypeExpressionParser.toDescriptor(sequence(string())).toString())
                    .isEqualTo("{\"sequence\":\"string\"}");
            assertThat(TypeExpressionParser.toDescriptor(any()).asText()).isEqualTo("any");
            assertThat(TypeExpressionParser.toDescriptor(literal("x")).path("literal").size()).isEqualTo(1);
            assertThat(TypeExpressionParser.toDescriptor(none()).asText()).isEqualTo("none");
        }
    }
}
