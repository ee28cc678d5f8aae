package io.validata.core.engine;

import io.validata.core.engine.predicate.ComparativePredicates;
import io.validata.core.engine.predicate.FilePredicates;
import io.validata.core.engine.predicate.FormatPredicates;
import io.validata.core.engine.predicate.FormatPredicates.DateFormat;
import io.validata.core.engine.predicate.MembershipPredicates;
import io.validata.core.engine.predicate.NumericPredicates;
import io.validata.core.engine.predicate.ShapePredicates;
import io.validata.core.error.RuleEvaluationException;
import io.validata.core.error.UniquenessCheckException;
import io.validata.core.model.Field;
import io.validata.core.model.RuleSpec;
import io.validata.core.model.SizeLimit;
import io.validata.core.model.UniqueTarget;
import io.validata.core.model.UploadedFile;
import io.validata.core.model.ValidationReport;
import io.validata.core.model.Value;
import io.validata.core.spec.FileSizeParser;
import io.validata.core.spec.RuleChainParser;
import io.validata.core.spi.UniquenessChecker;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Routes a rule to the check registered for the value's kind.
 *
 * <p>
 * Each kind has a table of plain rules (no argument) and a table of parameterized rules keyed by
 * the text before the first {@code ':'}. Rule names a kind does not know are no-ops. Kinds that
 * contain other values (references, nested records and sequences) have a fallback that applies to
 * every rule: references unwrap to their target, records recurse, and sequences run the rule over
 * each element.
 *
 * <p>
 * Built once; the tables are never modified afterwards and the dispatcher is thread-safe.
 */
public final class TypeDispatcher {

    private static final String TEXT_SUFFIX = ".string";
    private static final String NUMERIC_SUFFIX = ".numeric";

    private final Map<Value.Kind, KindRules> table = new EnumMap<>(Value.Kind.class);

    public TypeDispatcher() {
        table.put(Value.Kind.TEXT, textRules());
        KindRules integers = integerRules();
        table.put(Value.Kind.SIGNED_INT, integers);
        table.put(Value.Kind.UNSIGNED_INT, integers);
        table.put(Value.Kind.FLOAT, floatRules());
        table.put(Value.Kind.FILE, fileRules());
        table.put(Value.Kind.SEQUENCE, sequenceRules());
        table.put(Value.Kind.REFERENCE, new KindRules().fallback(this::unwrapReference));
        table.put(Value.Kind.NESTED, new KindRules().fallback(TypeDispatcher::recurse));
        table.put(Value.Kind.BOOL, new KindRules());
        table.put(Value.Kind.OPAQUE, new KindRules());
    }

    /**
     * Applies {@code rule} to {@code value}.
     *
     * @return the violation, or empty when the rule holds or does not apply to the kind
     * @throws RuleEvaluationException   if the rule's arguments cannot be evaluated
     * @throws UniquenessCheckException if the uniqueness store cannot answer
     */
    public Optional<Violation> dispatch(Value value, RuleSpec rule, EvaluationContext context) {
        RuleCheck check = table.get(value.kind()).lookup(rule);
        if (check == null) {
            return Optional.empty();
        }
        return check.check(value, rule, context);
    }

    /** Whether {@code kind} has a check for {@code rule}; used by diagnostics and tests. */
    public boolean handles(Value.Kind kind, RuleSpec rule) {
        return table.get(kind).lookup(rule) != null;
    }

    // --- Kind tables ---

    private static KindRules textRules() {
        KindRules rules = new KindRules()
                .plain("string", text("string", ShapePredicates::isNotString))
                .plain("ascii", text("ascii", ShapePredicates::isNotAscii))
                .plain("alpha", text("alpha", ShapePredicates::isNotAlpha))
                .plain("numeric", text("numeric", ShapePredicates::isNotNumeric))
                .plain("alpha_numeric", text("alpha_numeric", ShapePredicates::isNotAlphaNumeric))
                .plain("email", text("email", FormatPredicates::isNotEmail))
                .plain("phone", text("phone", FormatPredicates::isNotPhone))
                .plain("phone_with_code", text("phone_with_code", FormatPredicates::isNotPhoneWithCode))
                .plain("username", text("username", FormatPredicates::isNotUsername))
                .plain("gh_card", text("gh_card", FormatPredicates::isNotGhCard))
                .plain("gh_gps", text("gh_gps", FormatPredicates::isNotGhGps));
        for (DateFormat format : DateFormat.values()) {
            rules.plain(format.ruleName(), text(format.messageKey(), s -> FormatPredicates.isNotDate(s, format)));
        }
        comparatives(rules, TEXT_SUFFIX);
        crossField(rules);
        rules.parameterized("unique", TypeDispatcher::checkUnique);
        return rules;
    }

    private static KindRules integerRules() {
        KindRules rules = new KindRules()
                .plain("int", value("int", NumericPredicates::isNotInt))
                .plain("uint", value("uint", NumericPredicates::isNotUint));
        comparatives(rules, NUMERIC_SUFFIX);
        crossField(rules);
        return rules;
    }

    private static KindRules floatRules() {
        KindRules rules = new KindRules().plain("float", value("float", NumericPredicates::isNotFloat));
        comparatives(rules, NUMERIC_SUFFIX);
        crossField(rules);
        return rules;
    }

    private static KindRules fileRules() {
        return new KindRules()
                .plain("image", (v, r, c) -> checkMimes(v, FilePredicates.IMAGE_EXTENSIONS, c)
                        ? Optional.of(Violation.of("image"))
                        : Optional.empty())
                .plain("file", (v, r, c) -> FilePredicates.isNotFile(file(v))
                        ? Optional.of(Violation.of("file"))
                        : Optional.empty())
                .parameterized("image", mimes("image_type"))
                .parameterized("file", mimes("file_type"))
                .parameterized("mimes", mimes("mimes"))
                .parameterized("size", TypeDispatcher::checkFileSize);
    }

    private KindRules sequenceRules() {
        return new KindRules().parameterized("slice", this::checkSlice).fallback(this::checkElements);
    }

    /** min, max, equal, size, from and between with kind-specific message keys. */
    private static void comparatives(KindRules rules, String suffix) {
        rules.parameterized("min", (v, r, c) -> ComparativePredicates.isNotMin(v, r.argument(), r.token())
                        ? Optional.of(Violation.of("min" + suffix, r.argument()))
                        : Optional.empty())
                .parameterized("max", (v, r, c) -> ComparativePredicates.isNotMax(v, r.argument(), r.token())
                        ? Optional.of(Violation.of("max" + suffix, r.argument()))
                        : Optional.empty())
                .parameterized("equal", (v, r, c) -> ComparativePredicates.isNotEqual(v, r.argument(), r.token())
                        ? Optional.of(Violation.of("equal" + suffix, r.argument()))
                        : Optional.empty())
                .parameterized("size", (v, r, c) -> ComparativePredicates.isNotEqual(v, r.argument(), r.token())
                        ? Optional.of(Violation.of("size" + suffix, r.argument()))
                        : Optional.empty())
                .parameterized("from", (v, r, c) -> {
                    List<String> bounds = twoBounds(r);
                    return ComparativePredicates.isNotFrom(v, bounds.get(0), bounds.get(1), r.token())
                            ? Optional.of(Violation.of("from" + suffix, bounds.get(0), bounds.get(1)))
                            : Optional.empty();
                })
                .parameterized("between", (v, r, c) -> {
                    List<String> bounds = twoBounds(r);
                    return ComparativePredicates.isNotBetween(v, bounds.get(0), bounds.get(1), r.token())
                            ? Optional.of(Violation.of("between" + suffix, bounds.get(0), bounds.get(1)))
                            : Optional.empty();
                });
    }

    /** enum, same and match. */
    private static void crossField(KindRules rules) {
        rules.parameterized("enum", (v, r, c) -> MembershipPredicates.isNotEnum(v.asText(), r.argument())
                        ? Optional.of(Violation.of("enum", r.argument()))
                        : Optional.empty())
                .parameterized("same", (v, r, c) -> isNotSameAs(v, r.argument(), c)
                        ? Optional.of(Violation.of("same", r.argument()))
                        : Optional.empty())
                .parameterized("match", (v, r, c) -> isNotSameAs(v, r.argument(), c)
                        ? Optional.of(Violation.of("match"))
                        : Optional.empty());
    }

    // --- Checks ---

    private static boolean isNotSameAs(Value value, String otherLabel, EvaluationContext context) {
        Optional<Field> other = context.findField(otherLabel);
        return other.isEmpty()
                || MembershipPredicates.isNotSame(value.asText(), other.get().value().asText());
    }

    private static Optional<Violation> checkUnique(Value value, RuleSpec rule, EvaluationContext context) {
        UniqueTarget target = RuleChainParser.parseUniqueTarget(rule.argument());
        if (target == null) {
            return Optional.empty();
        }
        UniquenessChecker checker = context.config().uniquenessChecker();
        if (checker == null) {
            throw new RuleEvaluationException(
                    "rule '" + rule.token() + "' requires a configured uniqueness checker", rule.token());
        }
        boolean exists;
        try {
            exists = checker.exists(target, value.asText());
        } catch (UniquenessCheckException e) {
            if (e.fieldLabel() != null) {
                throw e;
            }
            throw new UniquenessCheckException(e.getMessage(), e, context.fieldLabel());
        }
        return exists ? Optional.of(Violation.of("unique")) : Optional.empty();
    }

    private static Optional<Violation> checkFileSize(Value value, RuleSpec rule, EvaluationContext context) {
        SizeLimit limit = FileSizeParser.parse(rule.argument());
        if (limit == null || !FilePredicates.isTooLarge(file(value), limit)) {
            return Optional.empty();
        }
        return Optional.of(Violation.of(limit.messageKey(), limit.amount()));
    }

    private static boolean checkMimes(Value value, String extensions, EvaluationContext context) {
        return FilePredicates.isNotMimes(file(value), extensions, context.config().contentSniffer());
    }

    /** {@code slice:min:N} and {@code slice:max:N} on the element count, then the element pass. */
    private Optional<Violation> checkSlice(Value value, RuleSpec rule, EvaluationContext context) {
        String argument = rule.argument();
        int colon = argument.indexOf(':');
        if (colon >= 0) {
            String op = argument.substring(0, colon);
            String bound = argument.substring(colon + 1);
            if ("min".equals(op) && ComparativePredicates.isNotMin(value, bound, rule.token())) {
                return Optional.of(Violation.of("min.slice", bound));
            }
            if ("max".equals(op) && ComparativePredicates.isNotMax(value, bound, rule.token())) {
                return Optional.of(Violation.of("max.slice", bound));
            }
        }
        return checkElements(value, rule, context);
    }

    /**
     * Applies the rule to every element as if it were a field of the element's kind. Only failing
     * elements contribute, in element order, labelled {@code "<label> (<i>)"}.
     */
    private Optional<Violation> checkElements(Value value, RuleSpec rule, EvaluationContext context) {
        List<Value> elements = ((Value.Sequence) value).elements();
        List<Object> entries = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            Optional<Violation> result = dispatch(elements.get(i), rule, context);
            if (result.isEmpty()) {
                continue;
            }
            Violation violation = result.get();
            if (violation instanceof Violation.Failed failed) {
                entries.add(context.render(failed, FieldLabels.element(context.displayLabel(), i + 1), rule));
            } else if (violation instanceof Violation.Nested nested) {
                entries.add(nested.report());
            } else if (violation instanceof Violation.Elements inner) {
                entries.add(inner.entries());
            }
        }
        return entries.isEmpty() ? Optional.empty() : Optional.of(new Violation.Elements(entries));
    }

    private Optional<Violation> unwrapReference(Value value, RuleSpec rule, EvaluationContext context) {
        Value target = ((Value.Reference) value).target();
        return target == null ? Optional.empty() : dispatch(target, rule, context);
    }

    private static Optional<Violation> recurse(Value value, RuleSpec rule, EvaluationContext context) {
        ValidationReport report = context.validateNested(((Value.Nested) value).record());
        return report.isEmpty() ? Optional.empty() : Optional.of(new Violation.Nested(report));
    }

    // --- Helpers ---

    private static RuleCheck text(String key, Predicate<String> isNot) {
        return (v, r, c) -> isNot.test(v.asText()) ? Optional.of(Violation.of(key)) : Optional.empty();
    }

    private static RuleCheck value(String key, Predicate<Value> isNot) {
        return (v, r, c) -> isNot.test(v) ? Optional.of(Violation.of(key)) : Optional.empty();
    }

    private static RuleCheck mimes(String key) {
        return (v, r, c) -> checkMimes(v, r.argument(), c)
                ? Optional.of(Violation.of(key, r.argument()))
                : Optional.empty();
    }

    private static UploadedFile file(Value value) {
        return ((Value.File) value).file();
    }

    private static List<String> twoBounds(RuleSpec rule) {
        List<String> bounds = RuleChainParser.splitBounds(rule.argument());
        if (bounds.size() < 2) {
            throw new RuleEvaluationException(
                    "rule '" + rule.token() + "' requires two comma-separated bounds", rule.token());
        }
        return bounds;
    }

    /** Plain and parameterized checks for one kind, plus an optional catch-all. */
    private static final class KindRules {

        private final Map<String, RuleCheck> plain = new HashMap<>();
        private final Map<String, RuleCheck> parameterized = new HashMap<>();
        private RuleCheck fallback;

        KindRules plain(String name, RuleCheck check) {
            plain.put(name, check);
            return this;
        }

        KindRules parameterized(String name, RuleCheck check) {
            parameterized.put(name, check);
            return this;
        }

        KindRules fallback(RuleCheck check) {
            this.fallback = check;
            return this;
        }

        RuleCheck lookup(RuleSpec rule) {
            RuleCheck check = rule.hasArgument() ? parameterized.get(rule.name()) : plain.get(rule.name());
            return check != null ? check : fallback;
        }
    }
}
