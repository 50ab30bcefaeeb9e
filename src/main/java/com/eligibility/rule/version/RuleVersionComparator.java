package com.eligibility.rule.version;

import com.eligibility.expression.ExpressionJson;
import com.eligibility.rule.Requirement;
import com.eligibility.rule.RuleVersion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares the requirements of two rule versions.
 */
public final class RuleVersionComparator {

    private RuleVersionComparator() {
    }

    public static RuleVersionDiff compare(RuleVersion from, RuleVersion to) {
        Map<String, Requirement> before = byCode(from.requirements());
        Map<String, Requirement> after = byCode(to.requirements());

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<RuleVersionDiff.Modification> modified = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();

        for (Map.Entry<String, Requirement> entry : after.entrySet()) {
            Requirement old = before.get(entry.getKey());
            if (old == null) {
                added.add(entry.getKey());
                continue;
            }
            List<RuleVersionDiff.FieldChange> changes = changes(old, entry.getValue());
            if (changes.isEmpty()) {
                unchanged.add(entry.getKey());
            } else {
                modified.add(new RuleVersionDiff.Modification(entry.getKey(), changes));
            }
        }
        for (String code : before.keySet()) {
            if (!after.containsKey(code)) {
                removed.add(code);
            }
        }

        return new RuleVersionDiff(from.id(), to.id(), added, removed, modified, unchanged);
    }

    private static List<RuleVersionDiff.FieldChange> changes(Requirement old, Requirement current) {
        List<RuleVersionDiff.FieldChange> changes = new ArrayList<>();
        if (!Objects.equals(old.label(), current.label())) {
            changes.add(new RuleVersionDiff.FieldChange("label", old.label(), current.label()));
        }
        if (old.mandatory() != current.mandatory()) {
            changes.add(new RuleVersionDiff.FieldChange("mandatory",
                    String.valueOf(old.mandatory()), String.valueOf(current.mandatory())));
        }
        // compare rendered JSON so 25000 and 25000L count as the same literal
        String oldExpression = ExpressionJson.toJson(old.expression());
        String newExpression = ExpressionJson.toJson(current.expression());
        if (!oldExpression.equals(newExpression)) {
            changes.add(new RuleVersionDiff.FieldChange("expression", oldExpression, newExpression));
        }
        return changes;
    }

    private static Map<String, Requirement> byCode(List<Requirement> requirements) {
        Map<String, Requirement> map = new LinkedHashMap<>();
        for (Requirement requirement : requirements) {
            map.put(requirement.code(), requirement);
        }
        return map;
    }
}
