package io.elicitor.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.elicitor.core.error.AmbiguousPathException;
import io.elicitor.core.model.Question;
import io.elicitor.core.model.QuestionKind;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.SurveyDefinition;
import io.elicitor.core.shape.ShapeRegistry;
import io.elicitor.core.testkit.Shapes;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaDeriver}. */
class SchemaDeriverTest {

    private final ShapeRegistry registry = new ShapeRegistry();
    private final SchemaDeriver deriver = new SchemaDeriver();

    private SurveyDefinition derive(Class<?> type) {
        return deriver.derive(registry.describe(type));
    }

    private static Question find(SurveyDefinition definition, String dotted) {
        return definition.find(ResponsePath.parse(dotted)).orElseThrow();
    }

    @Nested
    class Kinds {

        @Test
        void primitivesMapToLeafKinds() {
            SurveyDefinition definition = derive(Shapes.Account.class);
            assertThat(definition.questions())
                    .extracting(q -> q.kind().getClass().getSimpleName())
                    .containsExactly("Input", "Masked", "Multiline", "Confirm", "Float", "Int", "Input");
        }

        @Test
        void optionalFieldsKeepTheirScalarKind() {
            SurveyDefinition definition = derive(Shapes.ProjectConfig.class);

            assertThat(definition.questions()).extracting(Question::optional)
                    .containsExactly(false, true, true, false, true);
            assertThat(find(definition, "description").kind()).isEqualTo(new QuestionKind.Input());
            assertThat(find(definition, "licensePath").kind()).isEqualTo(new QuestionKind.Input());
            assertThat(find(definition, "logLevel").kind()).isEqualTo(new QuestionKind.Int(0L, 5L));
        }

        @Test
        void integralKindsCarryBounds() {
            Question age = find(derive(Shapes.Signup.class), "age");
            assertThat(age.prompt()).isEqualTo("Your age");
            assertThat(age.kind()).isEqualTo(new QuestionKind.Int(18L, 120L));
        }

        @Test
        void listsMapToElementTypes() {
            SurveyDefinition definition = derive(Shapes.Tags.class);
            assertThat(definition.questions())
                    .extracting(Question::kind)
                    .containsExactly(
                            new QuestionKind.ListOf(QuestionKind.ElementType.STRING, null, null),
                            new QuestionKind.ListOf(QuestionKind.ElementType.INT, 0.0, 10.0),
                            new QuestionKind.ListOf(QuestionKind.ElementType.FLOAT, null, null));
        }

        @Test
        void nestedStructIsAllOfWithRerootedChildren() {
            Question address = find(derive(Shapes.Person.class), "address");
            assertThat(address.kind()).isInstanceOf(QuestionKind.AllOf.class);
            assertThat(address.children())
                    .extracting(q -> q.path().asDottedString())
                    .containsExactly("address.street", "address.city");
        }

        @Test
        void nestedEnumIsOneOfWithAlternatives() {
            SurveyDefinition definition = derive(Shapes.Order.class);
            Question payment = find(definition, "payment");
            QuestionKind.OneOf oneOf = (QuestionKind.OneOf) payment.kind();

            assertThat(oneOf.variants()).extracting(Question::prompt).containsExactly("Cash", "Credit card");
            assertThat(oneOf.variants().get(0).kind()).isInstanceOf(QuestionKind.Unit.class);
            assertThat(find(definition, "payment.alternatives.1.number").prompt()).isEqualTo("Card number");
            assertThat(payment.valuePath().asDottedString()).isEqualTo("payment.selected_alternative");
        }

        @Test
        void multiSelectIsAnyOf() {
            SurveyDefinition definition = derive(Shapes.Phone.class);
            Question features = find(definition, "features");
            assertThat(features.kind()).isInstanceOf(QuestionKind.AnyOf.class);
            assertThat(features.valuePath()).isEqualTo(ResponsePath.of("features"));
            assertThat(find(definition, "features.alternatives.2.megapixels").kind())
                    .isEqualTo(new QuestionKind.Int(null, null));
        }

        @Test
        void topLevelEnumIsSingleRootQuestion() {
            SurveyDefinition definition = derive(Shapes.Color.class);
            assertThat(definition.questions()).hasSize(1);
            Question root = definition.questions().get(0);
            assertThat(root.path().isRoot()).isTrue();
            assertThat(root.prompt()).isEqualTo("Color");
            assertThat(root.valuePath().asDottedString()).isEqualTo("selected_alternative");
        }

        @Test
        void positionalFieldsUseIndexPaths() {
            assertThat(derive(Shapes.Point.class).questions())
                    .extracting(q -> q.path().asDottedString())
                    .containsExactly("field_0", "field_1");
        }

        @Test
        void preludeAndEpilogueAreCarried() {
            SurveyDefinition definition = derive(Shapes.Signup.class);
            assertThat(definition.prelude()).isEqualTo("Tell us about yourself.");
            assertThat(definition.epilogue()).isEqualTo("Thanks!");
        }
    }

    @Nested
    class Paths {

        @Test
        void everyPathIsUnique() {
            SurveyDefinition definition = derive(Shapes.Phone.class);
            Set<ResponsePath> seen = new HashSet<>();
            for (Question question : definition.allQuestions()) {
                assertThat(seen.add(question.path())).as("duplicate %s", question.path()).isTrue();
            }
        }

        @Test
        void pathsStayUniqueThroughEnumInVariantInStruct() {
            SurveyDefinition definition = derive(Shapes.Fleet.class);
            Set<String> seen = new HashSet<>();
            for (Question question : definition.allQuestions()) {
                assertThat(seen.add(question.path().asDottedString())).as("duplicate %s", question.path()).isTrue();
                ResponsePath valuePath = question.valuePath();
                if (valuePath != null && !valuePath.equals(question.path())) {
                    assertThat(seen.add(valuePath.asDottedString())).as("duplicate %s", valuePath).isTrue();
                }
            }

            Question innerFuel = find(definition, "depot.vehicle.alternatives.0.fuel");
            assertThat(innerFuel.valuePath().asDottedString())
                    .isEqualTo("depot.vehicle.alternatives.0.fuel.selected_alternative");
            assertThat(innerFuel.children())
                    .extracting(q -> q.path().asDottedString())
                    .containsExactly(
                            "depot.vehicle.alternatives.0.fuel.alternatives.0",
                            "depot.vehicle.alternatives.0.fuel.alternatives.1");
            assertThat(find(definition, "fuel").valuePath().asDottedString()).isEqualTo("fuel.selected_alternative");
            assertThat(seen).contains("depot.vehicle.alternatives.0.axles", "depot.vehicle.alternatives.1");
        }

        @Test
        void derivationIsDeterministic() {
            assertThat(derive(Shapes.Order.class)).isEqualTo(new SchemaDeriver().derive(registry.describe(Shapes.Order.class)));
        }

        @Test
        void dottedKeyCollidingWithNestedPathIsAmbiguous() {
            assertThatThrownBy(() -> derive(Shapes.DottedKey.class))
                    .isInstanceOf(AmbiguousPathException.class)
                    .hasMessageContaining("address.street")
                    .satisfies(e -> {
                        AmbiguousPathException ex = (AmbiguousPathException) e;
                        assertThat(List.of(ex.path(), ex.other()))
                                .containsExactlyInAnyOrder(
                                        ResponsePath.of("address.street"), ResponsePath.parse("address.street"));
                    });
        }

        @Test
        void dottedKeyCollidingWithSelectionIsAmbiguous() {
            assertThatThrownBy(() -> derive(Shapes.SelectionKey.class))
                    .isInstanceOf(AmbiguousPathException.class)
                    .hasMessageContaining("pay.selected_alternative");
        }
    }
}
