package com.semsql.service;

import com.semsql.model.DimensionUsage;
import com.semsql.model.JoinKind;
import org.springframework.stereotype.Service;

/**
 * Decides INNER vs LEFT for a dimension from its usage hint and optionality.
 * <p>
 * Filtering always wins: a dimension that restricts rows must be matched, so {@code filter}
 * and {@code both} are INNER even when optional. Unknown usages fall back to LEFT.
 */
@Service
public class JoinTypeResolver {

    public JoinKind resolve(DimensionUsage usage, boolean optional) {
        if (usage == null) {
            return JoinKind.LEFT;
        }
        switch (usage) {
            case FILTER:
            case BOTH:
                return JoinKind.INNER;
            case SELECT:
                return optional ? JoinKind.LEFT : JoinKind.INNER;
            default:
                return JoinKind.LEFT;
        }
    }

    public JoinKind resolve(String usage, boolean optional) {
        return resolve(DimensionUsage.fromValue(usage).orElse(null), optional);
    }

    public String explain(DimensionUsage usage, boolean optional) {
        JoinKind kind = resolve(usage, optional);
        if (usage == null) {
            return kind + " (unrecognized usage, keeps grain rows)";
        }
        switch (usage) {
            case FILTER:
                return kind + " (filter restricts rows)";
            case BOTH:
                return kind + " (filtered and selected, filtering takes precedence)";
            default:
                return optional
                    ? kind + " (optional select keeps unmatched grain rows)"
                    : kind + " (required select)";
        }
    }
}
