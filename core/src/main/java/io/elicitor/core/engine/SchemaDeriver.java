package io.elicitor.core.engine;

import io.elicitor.core.error.AmbiguousPathException;
import io.elicitor.core.model.DefaultValue;
import io.elicitor.core.model.Question;
import io.elicitor.core.model.QuestionKind;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.SurveyDefinition;
import io.elicitor.core.shape.EnumShape;
import io.elicitor.core.shape.FieldDescriptor;
import io.elicitor.core.shape.FieldType;
import io.elicitor.core.shape.ScalarType;
import io.elicitor.core.shape.ShapeDescriptor;
import io.elicitor.core.shape.StructShape;
import io.elicitor.core.shape.VariantDescriptor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link SurveyDefinition} from a {@link ShapeDescriptor}. Deterministic and free of
 * side effects: the same descriptor always yields an equal definition.
 *
 * <p>
 * Kind precedence for a record component (first match wins): masked, multiline, boolean,
 * integral, floating, string, list of primitive, multi-select, nested record, nested enum.
 *
 * <p>
 * Nested shapes are derived on their own and spliced in by re-rooting every descendant path under
 * the parent field's path.
 */
public final class SchemaDeriver {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDeriver.class);

    /**
     * Derives the schema of {@code shape}.
     *
     * @throws AmbiguousPathException if two questions share a path or spell the same dotted path
     */
    public SurveyDefinition derive(ShapeDescriptor shape) {
        List<Question> questions;
        if (shape instanceof StructShape struct) {
            questions = structQuestions(struct);
        } else {
            EnumShape enumShape = (EnumShape) shape;
            questions = List.of(new Question(
                    ResponsePath.root(), enumShape.type().getSimpleName(), oneOf(enumShape)));
        }
        SurveyDefinition definition = new SurveyDefinition(shape.prelude(), shape.epilogue(), questions);
        checkPaths(shape.type(), definition);
        LOG.info(
                "schema.derived type={} questions={}",
                shape.type().getName(),
                definition.allQuestions().size());
        return definition;
    }

    // ── Structs ──

    private List<Question> structQuestions(StructShape struct) {
        List<Question> questions = new ArrayList<>(struct.fields().size());
        for (FieldDescriptor field : struct.fields()) {
            questions.add(fieldQuestion(field));
        }
        return questions;
    }

    private Question fieldQuestion(FieldDescriptor field) {
        ResponsePath path = ResponsePath.of(field.segment());
        return new Question(path, field.prompt(), fieldKind(field, path), DefaultValue.NONE, field.optional());
    }

    private QuestionKind fieldKind(FieldDescriptor field, ResponsePath path) {
        FieldType type = field.type();
        if (field.masked()) {
            return new QuestionKind.Masked();
        }
        if (field.multiline()) {
            return new QuestionKind.Multiline();
        }
        if (type instanceof FieldType.Scalar scalar) {
            return scalarKind(scalar.scalar(), field);
        }
        if (type instanceof FieldType.ListOf list) {
            return new QuestionKind.ListOf(elementType(list.element()), field.min(), field.max());
        }
        if (type instanceof FieldType.MultiSelect multi) {
            return new QuestionKind.AnyOf(reroot(variantQuestions(multi.shape()), path));
        }
        ShapeDescriptor nested = ((FieldType.Nested) type).shape();
        if (nested instanceof StructShape struct) {
            return new QuestionKind.AllOf(reroot(structQuestions(struct), path));
        }
        return new QuestionKind.OneOf(reroot(variantQuestions((EnumShape) nested), path));
    }

    private static QuestionKind scalarKind(ScalarType scalar, FieldDescriptor field) {
        if (scalar == ScalarType.BOOL) {
            return new QuestionKind.Confirm();
        }
        if (scalar.isIntegral()) {
            return new QuestionKind.Int(
                    field.min() != null ? field.min().longValue() : null,
                    field.max() != null ? field.max().longValue() : null);
        }
        if (scalar.isFloating()) {
            return new QuestionKind.Float(field.min(), field.max());
        }
        return new QuestionKind.Input();
    }

    private static QuestionKind.ElementType elementType(ScalarType element) {
        if (element.isIntegral()) {
            return QuestionKind.ElementType.INT;
        }
        if (element.isFloating()) {
            return QuestionKind.ElementType.FLOAT;
        }
        return QuestionKind.ElementType.STRING;
    }

    // ── Enums ──

    private QuestionKind.OneOf oneOf(EnumShape shape) {
        return new QuestionKind.OneOf(variantQuestions(shape));
    }

    /** One question per variant at {@code alternatives.N}, relative to the enum's own root. */
    private List<Question> variantQuestions(EnumShape shape) {
        List<Question> variants = new ArrayList<>(shape.variants().size());
        for (int i = 0; i < shape.variants().size(); i++) {
            VariantDescriptor variant = shape.variants().get(i);
            ResponsePath path = ResponsePath.root().alternative(i);
            QuestionKind kind = variant.isUnit()
                    ? new QuestionKind.Unit()
                    : new QuestionKind.AllOf(reroot(structQuestions(variant.payload()), path));
            variants.add(new Question(path, variant.prompt(), kind));
        }
        return variants;
    }

    private static List<Question> reroot(List<Question> questions, ResponsePath prefix) {
        List<Question> rerooted = new ArrayList<>(questions.size());
        for (Question question : questions) {
            rerooted.add(question.reroot(prefix));
        }
        return rerooted;
    }

    // ── Path checks ──

    /**
     * Rejects identical paths and distinct paths with the same dotted spelling. Both question paths
     * and value paths take part, so a literal {@code @Key("pay.selected_alternative")} collides
     * with the selection of an enum field {@code pay}.
     */
    private static void checkPaths(Class<?> shapeType, SurveyDefinition definition) {
        Map<String, ResponsePath> byDotted = new HashMap<>();
        for (Question question : definition.allQuestions()) {
            claim(shapeType, byDotted, question.path());
            ResponsePath valuePath = question.valuePath();
            if (valuePath != null && !valuePath.equals(question.path())) {
                claim(shapeType, byDotted, valuePath);
            }
        }
    }

    private static void claim(Class<?> shapeType, Map<String, ResponsePath> byDotted, ResponsePath path) {
        ResponsePath previous = byDotted.putIfAbsent(path.asDottedString(), path);
        if (previous == null) {
            return;
        }
        String reason = previous.equals(path)
                ? "Two questions share the path '" + path + "'"
                : "Paths " + previous.segments() + " and " + path.segments() + " both spell '" + path + "'";
        throw new AmbiguousPathException(reason + " in " + shapeType.getName(), shapeType, path, previous);
    }
}
