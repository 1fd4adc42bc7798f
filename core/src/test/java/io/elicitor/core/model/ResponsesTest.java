package io.elicitor.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.elicitor.core.error.MissingResponseException;
import io.elicitor.core.error.ResponseTypeMismatchException;
import io.elicitor.core.model.ResponseValue.ValueTag;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Responses} and {@link ResponseValue}. */
class ResponsesTest {

    private static Responses person() {
        return Responses.builder()
                .put("name", ResponseValue.of("Alice"))
                .put("address.street", ResponseValue.of("Main"))
                .put("address.city", ResponseValue.of("Reno"))
                .build();
    }

    @Nested
    class Store {

        @Test
        void preservesInsertionOrder() {
            assertThat(person().paths())
                    .extracting(ResponsePath::asDottedString)
                    .containsExactly("name", "address.street", "address.city");
        }

        @Test
        void laterPutReplacesEarlier() {
            Responses responses = Responses.builder()
                    .put("age", ResponseValue.of(17))
                    .put("age", ResponseValue.of(30))
                    .build();
            assertThat(responses.size()).isEqualTo(1);
            assertThat(responses.getInt(ResponsePath.of("age"))).isEqualTo(30);
        }

        @Test
        void builderRejectsNulls() {
            assertThatThrownBy(() -> Responses.builder().put(ResponsePath.of("a"), null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        void viewIsUnmodifiable() {
            assertThatThrownBy(() -> person().asMap().clear()).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void emptyStoresAreEqual() {
            assertThat(Responses.builder().build()).isEqualTo(Responses.empty());
            assertThat(Responses.of(null)).isSameAs(Responses.empty());
        }
    }

    @Nested
    class TypedAccess {

        @Test
        void missingPathRaisesMissingResponse() {
            assertThatThrownBy(() -> person().getString(ResponsePath.of("email")))
                    .isInstanceOf(MissingResponseException.class)
                    .satisfies(e -> assertThat(((MissingResponseException) e).path()).isEqualTo(ResponsePath.of("email")));
        }

        @Test
        void wrongTagRaisesMismatch() {
            assertThatThrownBy(() -> person().getInt(ResponsePath.of("name")))
                    .isInstanceOf(ResponseTypeMismatchException.class)
                    .satisfies(e -> {
                        ResponseTypeMismatchException mismatch = (ResponseTypeMismatchException) e;
                        assertThat(mismatch.expected()).isEqualTo(ValueTag.INT);
                        assertThat(mismatch.actual()).isEqualTo(ValueTag.STRING);
                    });
        }

        @Test
        void listAccessors() {
            Responses responses = Responses.builder()
                    .put("tags", new ResponseValue.StringList(List.of("a", "b")))
                    .put("scores", new ResponseValue.IntList(List.of(1L, 2L)))
                    .put("weights", new ResponseValue.FloatList(List.of(0.5)))
                    .build();
            assertThat(responses.getStringList(ResponsePath.of("tags"))).containsExactly("a", "b");
            assertThat(responses.getIntList(ResponsePath.of("scores"))).containsExactly(1L, 2L);
            assertThat(responses.getFloatList(ResponsePath.of("weights"))).containsExactly(0.5);
        }
    }

    @Nested
    class DerivedStores {

        @Test
        void filterPrefixStripsMatchingKeys() {
            Responses address = person().filterPrefix(ResponsePath.of("address"));
            assertThat(address.paths())
                    .extracting(ResponsePath::asDottedString)
                    .containsExactly("street", "city");
        }

        @Test
        void filterPrefixIgnoresPartialSegmentMatches() {
            Responses responses = Responses.builder()
                    .put("addr.city", ResponseValue.of("X"))
                    .put("address.city", ResponseValue.of("Y"))
                    .build();
            Responses filtered = responses.filterPrefix(ResponsePath.of("addr"));
            assertThat(filtered.size()).isEqualTo(1);
            assertThat(filtered.getString(ResponsePath.of("city"))).isEqualTo("X");
        }

        @Test
        void rerootInvertsFilterPrefix() {
            ResponsePath prefix = ResponsePath.of("address");
            Responses sub = person().filterPrefix(prefix);
            assertThat(sub.reroot(prefix).paths())
                    .extracting(ResponsePath::asDottedString)
                    .containsExactly("address.street", "address.city");
            assertThat(sub.reroot(prefix).getString(ResponsePath.parse("address.city"))).isEqualTo("Reno");
        }

        @Test
        void mergeLetsOtherWin() {
            Responses overlay = Responses.builder().put("name", ResponseValue.of("Bob")).build();
            Responses merged = person().merge(overlay);
            assertThat(merged.getString(ResponsePath.of("name"))).isEqualTo("Bob");
            assertThat(merged.size()).isEqualTo(3);
        }

        @Test
        void withLeavesOriginalUntouched() {
            Responses original = person();
            Responses changed = original.with(ResponsePath.of("age"), ResponseValue.of(30));
            assertThat(original.contains(ResponsePath.of("age"))).isFalse();
            assertThat(changed.getInt(ResponsePath.of("age"))).isEqualTo(30);
        }
    }

    @Nested
    class Values {

        @Test
        void chosenVariantsAreSortedAndDistinct() {
            ResponseValue a = new ResponseValue.ChosenVariants(List.of(2, 0, 2));
            ResponseValue b = ResponseValue.chosenAll(0, 2);
            assertThat(a).isEqualTo(b);
            assertThat(((ResponseValue.ChosenVariants) a).indices()).containsExactly(0, 2);
        }

        @Test
        void negativeIndicesAreRejected() {
            assertThatThrownBy(() -> ResponseValue.chosen(-1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ResponseValue.chosenAll(1, -2)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void tagsMatchVariants() {
            assertThat(ResponseValue.of("x").tag()).isEqualTo(ValueTag.STRING);
            assertThat(ResponseValue.of(1L).tag()).isEqualTo(ValueTag.INT);
            assertThat(ResponseValue.of(1.5).tag()).isEqualTo(ValueTag.FLOAT);
            assertThat(ResponseValue.of(true).tag()).isEqualTo(ValueTag.BOOL);
            assertThat(ResponseValue.chosen(0).tag()).isEqualTo(ValueTag.CHOSEN_VARIANT);
        }
    }
}
