package com.vidnyan.storytest.domain.rule;

/**
 * A detected rule violation.
 * Immutable value object.
 */
public record Violation(
    String ruleId,
    String ruleName,
    ViolationCategory category,
    String typeName,
    String memberName,
    String message
) {

    /**
     * Type-qualified symbol the violation points at.
     */
    public String symbol() {
        return memberName == null ? typeName : typeName + "::" + memberName;
    }

    public boolean isTypeLevel() {
        return memberName == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String ruleName;
        private ViolationCategory category = ViolationCategory.OTHER;
        private String typeName;
        private String memberName;
        private String message;

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder ruleName(String name) { this.ruleName = name; return this; }
        public Builder category(ViolationCategory category) { this.category = category; return this; }
        public Builder typeName(String typeName) { this.typeName = typeName; return this; }
        public Builder memberName(String memberName) { this.memberName = memberName; return this; }
        public Builder message(String msg) { this.message = msg; return this; }

        public Violation build() {
            return new Violation(ruleId, ruleName, category, typeName, memberName, message);
        }
    }
}
