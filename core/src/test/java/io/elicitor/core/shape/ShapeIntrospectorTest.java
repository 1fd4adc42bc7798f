package io.elicitor.core.shape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.elicitor.core.error.DerivationException;
import io.elicitor.core.error.ShapeDefinitionException;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.testkit.Shapes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ShapeIntrospector} and {@link ShapeRegistry}. */
class ShapeIntrospectorTest {

    private final ShapeIntrospector introspector = new ShapeIntrospector();

    @Nested
    @DisplayName("Well-formed shapes")
    class WellFormed {

        @Test
        void recordBecomesStruct() {
            StructShape shape = (StructShape) introspector.introspect(Shapes.Signup.class);
            assertThat(shape.fields()).extracting(FieldDescriptor::name).containsExactly("name", "age");
            assertThat(shape.prelude()).isEqualTo("Tell us about yourself.");
            assertThat(shape.epilogue()).isEqualTo("Thanks!");

            FieldDescriptor age = shape.fields().get(1);
            assertThat(age.prompt()).isEqualTo("Your age");
            assertThat(age.type()).isEqualTo(new FieldType.Scalar(ScalarType.INT));
            assertThat(age.min()).isEqualTo(18.0);
            assertThat(age.max()).isEqualTo(120.0);
        }

        @Test
        void javaEnumVariantsFollowDeclarationOrder() {
            EnumShape shape = (EnumShape) introspector.introspect(Shapes.Color.class);
            assertThat(shape.variants()).extracting(VariantDescriptor::prompt).containsExactly("RED", "Bright green", "BLUE");
            assertThat(shape.variants()).allMatch(VariantDescriptor::isUnit);
            assertThat(shape.indexOf(Shapes.Color.BLUE)).isEqualTo(2);
        }

        @Test
        void sealedVariantsFollowPermitsOrder() {
            EnumShape shape = (EnumShape) introspector.introspect(Shapes.Payment.class);
            assertThat(shape.variants()).extracting(VariantDescriptor::name).containsExactly("Cash", "Card");
            assertThat(shape.variants().get(0).isUnit()).isTrue();
            assertThat(shape.variants().get(1).prompt()).isEqualTo("Credit card");
            assertThat(shape.indexOf(new Shapes.Payment.Card("4111"))).isEqualTo(1);
            assertThat(shape.indexOf("not a payment")).isEqualTo(-1);
        }

        @Test
        void positionalComponentsUseIndexSegments() {
            StructShape shape = (StructShape) introspector.introspect(Shapes.Point.class);
            assertThat(shape.fields()).extracting(FieldDescriptor::segment).containsExactly("field_0", "field_1");
        }

        @Test
        void multiSelectOverSealedInterface() {
            StructShape shape = (StructShape) introspector.introspect(Shapes.Phone.class);
            FieldType features = shape.fields().get(1).type();
            assertThat(features).isInstanceOf(FieldType.MultiSelect.class);
            assertThat(((FieldType.MultiSelect) features).shape().variants()).hasSize(3);
        }

        @Test
        void fieldValidatorsPropagateToNumericFieldsOnly() {
            StructShape shape = (StructShape) introspector.introspect(Shapes.Evens.class);
            assertThat(shape.fields().get(0).validators()).hasSize(1);
            assertThat(shape.fields().get(1).validators()).hasSize(1);
            assertThat(shape.fields().get(2).validators()).isEmpty();
        }

        @Test
        void optionalComponentsUnwrapToTheirScalar() {
            StructShape shape = (StructShape) introspector.introspect(Shapes.ProjectConfig.class);
            assertThat(shape.fields()).extracting(FieldDescriptor::optional)
                    .containsExactly(false, true, true, false, true);
            assertThat(shape.fields().get(1).type()).isEqualTo(new FieldType.Scalar(ScalarType.STRING));
            assertThat(shape.fields().get(2).type()).isEqualTo(new FieldType.Scalar(ScalarType.PATH));
            FieldDescriptor logLevel = shape.fields().get(4);
            assertThat(logLevel.type()).isEqualTo(new FieldType.Scalar(ScalarType.INT));
            assertThat(logLevel.max()).isEqualTo(5.0);
        }

        @Test
        void compositeValidatorsAreInstantiated() {
            StructShape shape = (StructShape) introspector.introspect(Shapes.Passwords.class);
            assertThat(shape.composites()).singleElement().isInstanceOf(Shapes.PasswordsMatch.class);
        }
    }

    @Nested
    @DisplayName("Malformed shapes")
    class Malformed {

        @Test
        void nestedShapeNeedsPrompt() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.Unprompted.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("needs @Ask")
                    .satisfies(e -> {
                        ShapeDefinitionException ex = (ShapeDefinitionException) e;
                        assertThat(ex.shapeType()).isEqualTo(Shapes.Unprompted.class);
                        assertThat(ex.path()).isEqualTo(ResponsePath.of("address"));
                    });
        }

        @Test
        void maskOnNumberIsRejected() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.MaskedNumber.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("string components only");
        }

        @Test
        void fractionalBoundOnIntegerIsRejected() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.FractionalBound.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("whole number");
        }

        @Test
        void invertedBoundsAreRejected() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.InvertedBounds.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("above @Max");
        }

        @Test
        void boundsOnTextAreRejected() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.BoundedText.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("numeric components only");
        }

        @Test
        void listOfEnumNeedsMultiSelect() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.PlainList.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("needs @MultiSelect");
        }

        @Test
        void multiSelectNeedsEnumElements() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.MultiSelectScalar.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("requires an enum element type");
        }

        @Test
        void unsupportedComponentType() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.Unsupported.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("Unsupported type java.time.Instant");
        }

        @Test
        void optionalMustWrapAPrimitive() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.OptionalAddress.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("must wrap a primitive")
                    .satisfies(e -> assertThat(((ShapeDefinitionException) e).path())
                            .isEqualTo(ResponsePath.of("address")));
            assertThatThrownBy(() -> introspector.introspect(Shapes.OptionalTags.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("concrete type argument");
        }

        @Test
        void recursiveShapeIsRejected() {
            assertThatThrownBy(() -> introspector.introspect(Shapes.Recursive.class))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("Recursive shape");
        }

        @Test
        void plainClassIsNotAShape() {
            assertThatThrownBy(() -> introspector.introspect(String.class))
                    .isInstanceOf(DerivationException.class)
                    .hasMessageContaining("Not a shape");
        }
    }

    @Nested
    class Registry {

        @Test
        void describesOnceAndCaches() {
            ShapeRegistry registry = new ShapeRegistry();
            ShapeDescriptor first = registry.describe(Shapes.Order.class);
            assertThat(registry.isCached(Shapes.Order.class)).isTrue();
            assertThat(registry.describe(Shapes.Order.class)).isSameAs(first);
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        void failuresAreNotCached() {
            ShapeRegistry registry = new ShapeRegistry();
            assertThatThrownBy(() -> registry.describe(Shapes.Recursive.class))
                    .isInstanceOf(ShapeDefinitionException.class);
            assertThat(registry.isCached(Shapes.Recursive.class)).isFalse();
        }
    }
}
