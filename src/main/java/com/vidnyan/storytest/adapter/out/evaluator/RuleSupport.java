package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.ParameterDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Naming conventions shared by several rules.
 */
final class RuleSupport {

    /** Methods a host runtime invokes by name rather than through a call site. */
    static final Set<String> ENTRY_POINTS = Set.of(
            "Main", "Awake", "Start", "Update", "FixedUpdate", "LateUpdate",
            "Reset", "Dispose", "Finalize", "ToString", "Equals", "GetHashCode");

    private RuleSupport() {
    }

    static boolean isEventHandler(MemberDescriptor member) {
        String name = member.name();
        if (name.length() > 2 && name.startsWith("On") && Character.isUpperCase(name.charAt(2))) {
            return true;
        }
        if (name.endsWith("Handler") || name.endsWith("Callback")) {
            return true;
        }
        List<ParameterDescriptor> parameters = member.parameters();
        return parameters.size() == 2
                && parameters.get(1).typeName() != null
                && parameters.get(1).typeName().endsWith("EventArgs");
    }

    /**
     * Splits an identifier into words on underscores and lower-to-upper case boundaries.
     * "DebugDrawGizmo" gives [Debug, Draw, Gizmo]; "HTTPTemp_value" gives [HTTP, Temp, value].
     */
    static List<String> nameTokens(String name) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || !Character.isLetterOrDigit(c)) {
                flush(tokens, current);
                continue;
            }
            boolean boundary = current.length() > 0 && Character.isUpperCase(c)
                    && (Character.isLowerCase(current.charAt(current.length() - 1))
                        || (i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))
                            && Character.isUpperCase(current.charAt(current.length() - 1))));
            if (boundary) {
                flush(tokens, current);
            }
            current.append(c);
        }
        flush(tokens, current);
        return tokens;
    }

    private static void flush(List<String> tokens, StringBuilder current) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
