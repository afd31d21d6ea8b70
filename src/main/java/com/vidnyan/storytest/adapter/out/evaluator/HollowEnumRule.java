package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberKind;
import com.vidnyan.storytest.domain.model.TypeDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags enums with fewer than two values, or whose values are all placeholders.
 */
public class HollowEnumRule implements Rule {

    public static final String ID = "HOLLOW-ENUM-001";

    static final Set<String> PLACEHOLDER_NAMES = Set.of(
            "none", "default", "undefined", "placeholder", "todo", "temp", "unknown");

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Hollow enumeration"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.PLACEHOLDER_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (!candidate.isTypeLevel() || !candidate.type().isEnum()) {
            return RuleOutcome.pass();
        }
        TypeDescriptor type = candidate.type();
        List<String> values = type.membersOfKind(MemberKind.ENUM_VALUE).stream()
                .map(MemberDescriptor::name)
                .toList();
        if (values.size() < 2) {
            return RuleOutcome.violation("Enum '%s' declares %d value(s); it needs at least two",
                    type.name(), values.size());
        }
        boolean allPlaceholders = values.stream()
                .allMatch(v -> PLACEHOLDER_NAMES.contains(v.toLowerCase(Locale.ROOT)));
        if (allPlaceholders) {
            return RuleOutcome.violation("Enum '%s' has only placeholder values: %s",
                    type.name(), String.join(", ", values));
        }
        return RuleOutcome.pass();
    }
}
