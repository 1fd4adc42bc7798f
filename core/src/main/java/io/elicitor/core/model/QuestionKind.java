package io.elicitor.core.model;

import io.elicitor.core.model.ResponseValue.ValueTag;
import java.util.List;
import java.util.Objects;

/**
 * What a {@link Question} asks for. A closed set of variants, so presenters and document
 * generators can switch over it exhaustively.
 *
 * <p>
 * Leaf kinds carry the {@link ValueTag} their answer must have ({@link #valueTag()}). Group kinds
 * ({@link AllOf}, {@link OneOf}, {@link AnyOf}) hold child questions whose paths are already
 * rooted under the group's own path.
 */
public sealed interface QuestionKind {

    /**
     * Tag of the value this kind stores, or {@code null} for kinds that store nothing themselves
     * ({@link Unit}, {@link AllOf}). For {@link OneOf} this is the tag of the selection stored at
     * {@code path.selected_alternative}.
     */
    ValueTag valueTag();

    /** Element type of a {@link ListOf} question. */
    enum ElementType {
        STRING(ValueTag.STRING_LIST),
        INT(ValueTag.INT_LIST),
        FLOAT(ValueTag.FLOAT_LIST);

        private final ValueTag listTag;

        ElementType(ValueTag listTag) {
            this.listTag = listTag;
        }

        public ValueTag listTag() {
            return listTag;
        }
    }

    /** An enum variant without data. Nothing is collected. */
    record Unit() implements QuestionKind {
        @Override
        public ValueTag valueTag() {
            return null;
        }
    }

    /** Single-line text. */
    record Input() implements QuestionKind {
        @Override
        public ValueTag valueTag() {
            return ValueTag.STRING;
        }
    }

    /** Multi-line text. */
    record Multiline() implements QuestionKind {
        @Override
        public ValueTag valueTag() {
            return ValueTag.STRING;
        }
    }

    /** Text whose input is hidden while typed. */
    record Masked() implements QuestionKind {
        @Override
        public ValueTag valueTag() {
            return ValueTag.STRING;
        }
    }

    /**
     * Integer input with optional inclusive bounds.
     *
     * @param min lower bound, or {@code null}
     * @param max upper bound, or {@code null}
     */
    record Int(Long min, Long max) implements QuestionKind {
        public Int {
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
            }
        }

        @Override
        public ValueTag valueTag() {
            return ValueTag.INT;
        }
    }

    /**
     * Floating-point input with optional inclusive bounds.
     *
     * @param min lower bound, or {@code null}
     * @param max upper bound, or {@code null}
     */
    record Float(Double min, Double max) implements QuestionKind {
        public Float {
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
            }
        }

        @Override
        public ValueTag valueTag() {
            return ValueTag.FLOAT;
        }
    }

    /** Yes/no. */
    record Confirm() implements QuestionKind {
        @Override
        public ValueTag valueTag() {
            return ValueTag.BOOL;
        }
    }

    /**
     * A list of one primitive type. Numeric bounds, when present, apply to every element.
     */
    record ListOf(ElementType elementType, Double min, Double max) implements QuestionKind {
        public ListOf {
            Objects.requireNonNull(elementType, "elementType must not be null");
            if (elementType == ElementType.STRING && (min != null || max != null)) {
                throw new IllegalArgumentException("String lists cannot carry numeric bounds");
            }
        }

        @Override
        public ValueTag valueTag() {
            return elementType.listTag();
        }
    }

    /**
     * Multi-select over the variants of an enum shape. Each option may be chosen independently;
     * the selection is stored as {@link ResponseValue.ChosenVariants} at the question's path.
     *
     * @param variants one question per variant, at {@code path.alternatives.N}
     */
    record AnyOf(List<Question> variants) implements QuestionKind {
        public AnyOf {
            variants = List.copyOf(variants);
        }

        @Override
        public ValueTag valueTag() {
            return ValueTag.CHOSEN_VARIANTS;
        }
    }

    /**
     * Ordered group of questions that must all be answered; a nested struct.
     *
     * @param questions child questions at {@code path.field}
     */
    record AllOf(List<Question> questions) implements QuestionKind {
        public AllOf {
            questions = List.copyOf(questions);
        }

        @Override
        public ValueTag valueTag() {
            return null;
        }
    }

    /**
     * Exactly one of N variant groups is answered; an enum. The selection is stored as {@link
     * ResponseValue.ChosenVariant} at {@code path.selected_alternative}, and only the selected
     * group's descendants are required to have values.
     *
     * @param variants one question per variant, at {@code path.alternatives.N}
     */
    record OneOf(List<Question> variants) implements QuestionKind {
        public OneOf {
            variants = List.copyOf(variants);
            if (variants.isEmpty()) {
                throw new IllegalArgumentException("OneOf requires at least one variant");
            }
        }

        @Override
        public ValueTag valueTag() {
            return ValueTag.CHOSEN_VARIANT;
        }
    }
}
