package com.vidnyan.storytest.domain.rule;

import java.util.List;

/**
 * A named, ordered group of rules producing its own result bucket.
 */
public record ValidationPhase(
    String name,
    List<Rule> rules
) {

    public ValidationPhase {
        rules = List.copyOf(rules);
    }
}
