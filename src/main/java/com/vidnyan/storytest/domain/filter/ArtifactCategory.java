package com.vidnyan.storytest.domain.filter;

import com.vidnyan.storytest.domain.model.AttributeRef;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.TypeDescriptor;

import java.util.List;
import java.util.Set;

/**
 * Categories of compiler- or tool-synthesized code. Each constant is one independent check.
 */
public enum ArtifactCategory {

    /** Closure and anonymous-type markers: angle brackets and dollar signs never appear in hand-written names. */
    CLOSURE_MARKER {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            return hasClosureMarker(type.name());
        }

        @Override
        boolean matchesMember(MemberDescriptor member, AttributeReader attributes) {
            return hasClosureMarker(member.name());
        }
    },

    STATE_MACHINE {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            return type.name().contains("d__") || type.name().endsWith("StateMachine");
        }
    },

    DISPLAY_CLASS {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            return type.name().contains("DisplayClass");
        }
    },

    SOURCE_GENERATOR {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            String name = type.name();
            return name.contains("__Generated") || name.contains("__SourceGen")
                    || name.contains("__Codegen") || name.endsWith("_Generated");
        }
    },

    ITERATOR_HELPER {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            return type.name().contains("__Iterator");
        }

        @Override
        boolean matchesMember(MemberDescriptor member, AttributeReader attributes) {
            String name = member.name();
            if (!name.contains(".")) {
                return false;
            }
            return name.contains("IEnumerator") || name.contains("IEnumerable")
                    || name.contains("IAsyncStateMachine");
        }
    },

    GENERATED_ATTRIBUTE {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            return hasAny(attributes.of(type), GENERATED_MARKERS);
        }

        @Override
        boolean matchesMember(MemberDescriptor member, AttributeReader attributes) {
            return hasAny(attributes.of(member), GENERATED_MARKERS);
        }
    },

    TEST_FIXTURE {
        @Override
        boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
            if (hasAny(attributes.of(type), TEST_TYPE_MARKERS)) {
                return true;
            }
            return type.members().stream()
                    .anyMatch(m -> hasAny(attributes.of(m), TEST_MEMBER_MARKERS));
        }
    },

    BACKING_FIELD {
        @Override
        boolean matchesMember(MemberDescriptor member, AttributeReader attributes) {
            return member.name().contains("k__BackingField");
        }
    },

    LAMBDA_METHOD {
        @Override
        boolean matchesMember(MemberDescriptor member, AttributeReader attributes) {
            return member.name().contains("b__");
        }
    };

    static final Set<String> GENERATED_MARKERS = Set.of(
            "CompilerGenerated", "GeneratedCode", "Generated", "DebuggerNonUserCode");

    static final Set<String> TEST_TYPE_MARKERS = Set.of("TestFixture", "TestClass");

    static final Set<String> TEST_MEMBER_MARKERS = Set.of(
            "Test", "TestMethod", "Fact", "Theory", "TestCase", "UnityTest");

    boolean matchesType(TypeDescriptor type, AttributeReader attributes) {
        return false;
    }

    boolean matchesMember(MemberDescriptor member, AttributeReader attributes) {
        return false;
    }

    private static boolean hasClosureMarker(String name) {
        return name.indexOf('<') >= 0 || name.indexOf('>') >= 0 || name.indexOf('$') >= 0;
    }

    private static boolean hasAny(List<AttributeRef> attributes, Set<String> names) {
        for (AttributeRef attribute : attributes) {
            for (String name : names) {
                if (attribute.matches(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Attribute access that never throws.
     */
    interface AttributeReader {
        List<AttributeRef> of(TypeDescriptor type);

        List<AttributeRef> of(MemberDescriptor member);
    }
}
