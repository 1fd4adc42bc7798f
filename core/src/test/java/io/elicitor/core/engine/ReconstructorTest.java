package io.elicitor.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.elicitor.core.error.MissingResponseException;
import io.elicitor.core.error.ReconstructionException;
import io.elicitor.core.error.ResponseTypeMismatchException;
import io.elicitor.core.error.ShapeInstantiationException;
import io.elicitor.core.error.UnknownVariantException;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import io.elicitor.core.testkit.Shapes;
import io.elicitor.core.testkit.Shapes.Feature;
import io.elicitor.core.testkit.Shapes.Payment;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Reconstructor}, through {@link Survey#reconstruct}. */
class ReconstructorTest {

    @Nested
    @DisplayName("Structs")
    class Structs {

        private final Survey<Shapes.Signup> survey = Survey.of(Shapes.Signup.class);

        @Test
        void flatStruct() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("Alice"))
                    .put("age", ResponseValue.of(30))
                    .build();
            assertThat(survey.reconstruct(responses)).isEqualTo(new Shapes.Signup("Alice", 30));
        }

        @Test
        void outOfBoundsStoreFailsValidationBeforeReconstruction() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("Alice"))
                    .put("age", ResponseValue.of(17))
                    .build();
            assertThat(survey.validateAll(responses)).containsKey(ResponsePath.of("age"));
        }

        @Test
        void reconstructionIsIdempotentAndLeavesStoreUntouched() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("Alice"))
                    .put("age", ResponseValue.of(30))
                    .build();
            Responses copy = Responses.of(responses.asMap());
            assertThat(survey.reconstruct(responses)).isEqualTo(survey.reconstruct(responses));
            assertThat(responses).isEqualTo(copy);
        }

        @Test
        void everyPrimitiveType() {
            Responses responses = Responses.builder()
                    .put("user", ResponseValue.of("ada"))
                    .put("password", ResponseValue.of("s3cret"))
                    .put("bio", ResponseValue.of("line one\nline two"))
                    .put("newsletter", ResponseValue.of(true))
                    .put("height", ResponseValue.of(1.72))
                    .put("lucky", ResponseValue.of(7))
                    .put("home", ResponseValue.of("/home/ada"))
                    .build();
            Shapes.Account account = Survey.of(Shapes.Account.class).reconstruct(responses);
            assertThat(account)
                    .isEqualTo(new Shapes.Account(
                            "ada", "s3cret", "line one\nline two", true, 1.72, (byte) 7, Path.of("/home/ada")));
        }

        @Test
        void lists() {
            Responses responses = Responses.builder()
                    .put("tags", new ResponseValue.StringList(List.of("x", "y")))
                    .put("scores", new ResponseValue.IntList(List.of(3L, 4L)))
                    .put("weights", new ResponseValue.FloatList(List.of()))
                    .build();
            assertThat(Survey.of(Shapes.Tags.class).reconstruct(responses))
                    .isEqualTo(new Shapes.Tags(List.of("x", "y"), List.of(3, 4), List.of()));
        }

        @Test
        void positionalStruct() {
            Responses responses = Responses.builder()
                    .put("field_0", ResponseValue.of(1.0))
                    .put("field_1", ResponseValue.of(-2.5))
                    .build();
            assertThat(Survey.of(Shapes.Point.class).reconstruct(responses)).isEqualTo(new Shapes.Point(1.0, -2.5));
        }
    }

    @Nested
    @DisplayName("Nested structs")
    class NestedStructs {

        private final Survey<Shapes.Person> survey = Survey.of(Shapes.Person.class);

        @Test
        void nestedReconstruction() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("Bob"))
                    .put("address.street", ResponseValue.of("Main"))
                    .put("address.city", ResponseValue.of("Reno"))
                    .build();
            assertThat(survey.reconstruct(responses))
                    .isEqualTo(new Shapes.Person("Bob", new Shapes.Address("Main", "Reno")));
        }

        @Test
        void missingNestedValueNamesFullPath() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("Bob"))
                    .put("address.street", ResponseValue.of("Main"))
                    .build();
            assertThatThrownBy(() -> survey.reconstruct(responses))
                    .isInstanceOf(MissingResponseException.class)
                    .satisfies(e -> assertThat(((ReconstructionException) e).path())
                            .isEqualTo(ResponsePath.parse("address.city")));
        }

        @Test
        void siblingPrefixesDoNotLeak() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("Bob"))
                    .put("address.street", ResponseValue.of("Main"))
                    .put("addressx.city", ResponseValue.of("Elsewhere"))
                    .build();
            assertThatThrownBy(() -> survey.reconstruct(responses)).isInstanceOf(MissingResponseException.class);
        }
    }

    @Nested
    @DisplayName("Optional fields")
    class OptionalFields {

        private final Survey<Shapes.ProjectConfig> survey = Survey.of(Shapes.ProjectConfig.class);

        @Test
        void absentAnswersBecomeEmpty() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("elicitor"))
                    .put("debug", ResponseValue.of(false))
                    .build();
            assertThat(survey.reconstruct(responses))
                    .isEqualTo(new Shapes.ProjectConfig(
                            "elicitor", Optional.empty(), Optional.empty(), false, Optional.empty()));
        }

        @Test
        void presentAnswersAreWrapped() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("elicitor"))
                    .put("description", ResponseValue.of("Surveys from records"))
                    .put("licensePath", ResponseValue.of("LICENSE"))
                    .put("debug", ResponseValue.of(true))
                    .put("logLevel", ResponseValue.of(3))
                    .build();
            assertThat(survey.reconstruct(responses))
                    .isEqualTo(new Shapes.ProjectConfig(
                            "elicitor",
                            Optional.of("Surveys from records"),
                            Optional.of(Path.of("LICENSE")),
                            true,
                            Optional.of(3)));
        }

        @Test
        void requiredFieldsStayRequired() {
            Responses responses = Responses.builder().put("debug", ResponseValue.of(true)).build();
            assertThatThrownBy(() -> survey.reconstruct(responses))
                    .isInstanceOf(MissingResponseException.class)
                    .satisfies(e -> assertThat(((MissingResponseException) e).path()).isEqualTo(ResponsePath.of("name")));
        }

        @Test
        void presentAnswerWithWrongTagIsMismatch() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of("elicitor"))
                    .put("debug", ResponseValue.of(true))
                    .put("logLevel", ResponseValue.of("three"))
                    .build();
            assertThatThrownBy(() -> survey.reconstruct(responses)).isInstanceOf(ResponseTypeMismatchException.class);
        }
    }

    @Nested
    @DisplayName("Enums")
    class Enums {

        private final Survey<Shapes.Order> survey = Survey.of(Shapes.Order.class);

        private Responses.Builder order() {
            return Responses.builder().put("item", ResponseValue.of("Tea")).put("quantity", ResponseValue.of(2));
        }

        @Test
        void selectedVariantWithPayload() {
            Responses responses = order()
                    .put("payment.selected_alternative", ResponseValue.chosen(1))
                    .put("payment.alternatives.1.number", ResponseValue.of("4111"))
                    .build();
            assertThat(survey.reconstruct(responses).payment()).isEqualTo(new Payment.Card("4111"));
        }

        @Test
        void unitVariant() {
            Responses responses = order().put("payment.selected_alternative", ResponseValue.chosen(0)).build();
            assertThat(survey.reconstruct(responses).payment()).isEqualTo(new Payment.Cash());
        }

        @Test
        void unselectedPayloadsAreIgnored() {
            Responses responses = order()
                    .put("payment.selected_alternative", ResponseValue.chosen(0))
                    .put("payment.alternatives.1.number", ResponseValue.of("stale"))
                    .build();
            assertThat(survey.reconstruct(responses).payment()).isEqualTo(new Payment.Cash());
        }

        @Test
        void unknownVariantIndex() {
            Responses responses = order().put("payment.selected_alternative", ResponseValue.chosen(5)).build();
            assertThatThrownBy(() -> survey.reconstruct(responses))
                    .isInstanceOf(UnknownVariantException.class)
                    .satisfies(e -> {
                        UnknownVariantException ex = (UnknownVariantException) e;
                        assertThat(ex.index()).isEqualTo(5);
                        assertThat(ex.variantCount()).isEqualTo(2);
                        assertThat(ex.path()).isEqualTo(ResponsePath.parse("payment.selected_alternative"));
                    });
        }

        @Test
        void enumInsideVariantInsideStruct() {
            Responses responses = Responses.builder()
                    .put("depot.name", ResponseValue.of("North"))
                    .put("depot.vehicle.selected_alternative", ResponseValue.chosen(0))
                    .put("depot.vehicle.alternatives.0.fuel.selected_alternative", ResponseValue.chosen(1))
                    .put("depot.vehicle.alternatives.0.axles", ResponseValue.of(3))
                    .put("fuel.selected_alternative", ResponseValue.chosen(0))
                    .build();
            assertThat(Survey.of(Shapes.Fleet.class).reconstruct(responses))
                    .isEqualTo(new Shapes.Fleet(
                            new Shapes.Depot("North", new Shapes.Vehicle.Truck(Shapes.Fuel.ELECTRIC, 3)),
                            Shapes.Fuel.DIESEL));
        }

        @Test
        void topLevelEnum() {
            Responses responses = Responses.builder()
                    .put("selected_alternative", ResponseValue.chosen(1))
                    .build();
            assertThat(Survey.of(Shapes.Color.class).reconstruct(responses)).isEqualTo(Shapes.Color.GREEN);
        }

        @Test
        void topLevelSealedInterface() {
            Responses responses = Responses.builder()
                    .put("selected_alternative", ResponseValue.chosen(1))
                    .put("alternatives.1.number", ResponseValue.of("5500"))
                    .build();
            assertThat(Survey.of(Payment.class).reconstruct(responses)).isEqualTo(new Payment.Card("5500"));
        }
    }

    @Nested
    @DisplayName("Multi-select")
    class MultiSelect {

        private final Survey<Shapes.Phone> survey = Survey.of(Shapes.Phone.class);

        @Test
        void elementsFollowAscendingIndices() {
            Responses responses = Responses.builder()
                    .put("model", ResponseValue.of("X1"))
                    .put("features", ResponseValue.chosenAll(2, 0))
                    .put("features.alternatives.2.megapixels", ResponseValue.of(12))
                    .build();
            assertThat(survey.reconstruct(responses).features())
                    .containsExactly(new Feature.Gps(), new Feature.Camera(12));
        }

        @Test
        void unitOnlySelection() {
            Responses responses = Responses.builder()
                    .put("model", ResponseValue.of("X1"))
                    .put("features", ResponseValue.chosenAll(0, 1))
                    .build();
            assertThat(survey.reconstruct(responses).features()).containsExactly(new Feature.Gps(), new Feature.Bluetooth());
        }

        @Test
        void javaEnumSelection() {
            Responses responses = Responses.builder().put("colors", ResponseValue.chosenAll(0, 2)).build();
            assertThat(Survey.of(Shapes.Palette.class).reconstruct(responses).colors())
                    .containsExactly(Shapes.Color.RED, Shapes.Color.BLUE);
        }

        @Test
        void missingPayloadOfSelectedVariantNamesFullPath() {
            Responses responses = Responses.builder()
                    .put("model", ResponseValue.of("X1"))
                    .put("features", ResponseValue.chosenAll(2))
                    .build();
            assertThatThrownBy(() -> survey.reconstruct(responses))
                    .isInstanceOf(MissingResponseException.class)
                    .satisfies(e -> assertThat(((ReconstructionException) e).path())
                            .isEqualTo(ResponsePath.parse("features.alternatives.2.megapixels")));
        }

        @Test
        void unknownIndexIsReportedAtField() {
            Responses responses = Responses.builder()
                    .put("model", ResponseValue.of("X1"))
                    .put("features", ResponseValue.chosenAll(7))
                    .build();
            assertThatThrownBy(() -> survey.reconstruct(responses))
                    .isInstanceOf(UnknownVariantException.class)
                    .satisfies(e -> assertThat(((UnknownVariantException) e).path()).isEqualTo(ResponsePath.of("features")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void wrongTag() {
            Responses responses = Responses.builder()
                    .put("name", ResponseValue.of(1))
                    .put("age", ResponseValue.of(30))
                    .build();
            assertThatThrownBy(() -> Survey.of(Shapes.Signup.class).reconstruct(responses))
                    .isInstanceOf(ResponseTypeMismatchException.class);
        }

        @Test
        void integerOverflowIsMismatch() {
            Responses responses = Responses.builder().put("count", ResponseValue.of(40_000)).build();
            assertThatThrownBy(() -> Survey.of(Shapes.Counter.class).reconstruct(responses))
                    .isInstanceOf(ResponseTypeMismatchException.class)
                    .hasMessageContaining("does not fit short");
        }

        @Test
        void floatOverflowIsMismatch() {
            Responses responses = Responses.builder()
                    .put("reading", ResponseValue.of(1e300))
                    .put("history", new ResponseValue.FloatList(List.of()))
                    .build();
            assertThatThrownBy(() -> Survey.of(Shapes.Gauge.class).reconstruct(responses))
                    .isInstanceOf(ResponseTypeMismatchException.class)
                    .hasMessageContaining("does not fit float")
                    .satisfies(e -> assertThat(((ResponseTypeMismatchException) e).path()).isEqualTo(ResponsePath.of("reading")));
        }

        @Test
        void floatListElementOverflowIsMismatch() {
            Responses responses = Responses.builder()
                    .put("reading", ResponseValue.of(1.5))
                    .put("history", new ResponseValue.FloatList(List.of(2.0, -1e300)))
                    .build();
            assertThatThrownBy(() -> Survey.of(Shapes.Gauge.class).reconstruct(responses))
                    .isInstanceOf(ResponseTypeMismatchException.class)
                    .hasMessageContaining("does not fit float");
        }

        @Test
        void floatInRangeAndInfinityAreKept() {
            Responses responses = Responses.builder()
                    .put("reading", ResponseValue.of(Double.POSITIVE_INFINITY))
                    .put("history", new ResponseValue.FloatList(List.of(2.5, (double) Float.MAX_VALUE)))
                    .build();
            assertThat(Survey.of(Shapes.Gauge.class).reconstruct(responses))
                    .isEqualTo(new Shapes.Gauge(Float.POSITIVE_INFINITY, List.of(2.5f, Float.MAX_VALUE)));
        }

        @Test
        void constructorFailureIsWrapped() {
            Responses responses = Responses.builder().put("value", ResponseValue.of(-1)).build();
            assertThatThrownBy(() -> Survey.of(Shapes.Rejecting.class).reconstruct(responses))
                    .isInstanceOf(ShapeInstantiationException.class)
                    .hasMessageContaining("must not be negative")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }
}
