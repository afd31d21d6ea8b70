package com.vidnyan.storytest.domain.rule;

import com.vidnyan.storytest.domain.model.AttributeRef;

import java.util.List;
import java.util.Map;

/**
 * The justification-carrying attribute that opts a symbol out of all rules.
 */
public final class ExemptionMarker {

    public static final String ATTRIBUTE_NAME = "StoryIgnore";
    public static final String REASON_ARGUMENT = "reason";

    public enum Status {
        NONE,
        VALID,
        MISSING_REASON
    }

    private ExemptionMarker() {
    }

    public static Status inspect(List<AttributeRef> attributes) {
        Status status = Status.NONE;
        for (AttributeRef attribute : attributes) {
            if (!attribute.matches(ATTRIBUTE_NAME)) {
                continue;
            }
            if (hasReason(attribute)) {
                return Status.VALID;
            }
            status = Status.MISSING_REASON;
        }
        return status;
    }

    private static boolean hasReason(AttributeRef attribute) {
        for (Map.Entry<String, Object> argument : attribute.arguments().entrySet()) {
            if (REASON_ARGUMENT.equalsIgnoreCase(argument.getKey())
                    && argument.getValue() instanceof String reason
                    && !reason.isBlank()) {
                return true;
            }
        }
        return false;
    }
}
