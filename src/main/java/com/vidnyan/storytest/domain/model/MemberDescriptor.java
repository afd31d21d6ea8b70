package com.vidnyan.storytest.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A method, property, field or enum value of a {@link TypeDescriptor}.
 * Instances are created only through the owning type's builder.
 */
public final class MemberDescriptor {

    public static final String VOID = "void";

    private final MemberKind kind;
    private final String name;
    private final TypeDescriptor declaringType;
    private final String returnType;
    private final byte[] body;
    private final Supplier<List<AttributeRef>> attributeSource;
    private final Set<MemberModifier> modifiers;
    private final List<ParameterDescriptor> parameters;
    private final int metadataToken;
    private final List<Integer> accessorTokens;

    private MemberDescriptor(Builder builder, TypeDescriptor declaringType) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.declaringType = declaringType;
        this.returnType = builder.returnType;
        this.body = builder.body == null ? null : builder.body.clone();
        this.attributeSource = builder.attributeSource;
        this.modifiers = builder.modifiers.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MemberModifier.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.modifiers));
        this.parameters = List.copyOf(builder.parameters);
        this.metadataToken = builder.metadataToken;
        this.accessorTokens = List.copyOf(builder.accessorTokens);
    }

    public MemberKind kind() { return kind; }
    public String name() { return name; }
    public TypeDescriptor declaringType() { return declaringType; }
    public String returnType() { return returnType; }
    public Set<MemberModifier> modifiers() { return modifiers; }
    public List<ParameterDescriptor> parameters() { return parameters; }
    public int metadataToken() { return metadataToken; }
    public List<Integer> accessorTokens() { return accessorTokens; }

    /**
     * Copy of the raw method body, if the member has one.
     */
    public Optional<byte[]> body() {
        return body == null ? Optional.empty() : Optional.of(body.clone());
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public List<AttributeRef> attributes() {
        List<AttributeRef> attributes = attributeSource.get();
        return attributes == null ? List.of() : attributes;
    }

    public boolean hasAttribute(String attributeName) {
        return attributes().stream().anyMatch(a -> a.matches(attributeName));
    }

    public boolean is(MemberModifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isMethod() {
        return kind == MemberKind.METHOD;
    }

    public boolean returnsVoid() {
        return returnType == null || VOID.equalsIgnoreCase(returnType)
                || "System.Void".equals(returnType);
    }

    public String qualifiedName() {
        return declaringType.fullName() + "::" + name;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }

    public static Builder method(String name) {
        return new Builder(MemberKind.METHOD, name);
    }

    public static Builder property(String name) {
        return new Builder(MemberKind.PROPERTY, name).returnType("object");
    }

    public static Builder field(String name) {
        return new Builder(MemberKind.FIELD, name).returnType("object");
    }

    public static Builder enumValue(String name) {
        return new Builder(MemberKind.ENUM_VALUE, name).modifiers(MemberModifier.PUBLIC,
                MemberModifier.STATIC, MemberModifier.LITERAL);
    }

    public static class Builder {
        private final MemberKind kind;
        private final String name;
        private String returnType = VOID;
        private byte[] body;
        private Supplier<List<AttributeRef>> attributeSource = List::of;
        private Set<MemberModifier> modifiers = EnumSet.noneOf(MemberModifier.class);
        private List<ParameterDescriptor> parameters = List.of();
        private int metadataToken;
        private List<Integer> accessorTokens = List.of();

        private Builder(MemberKind kind, String name) {
            this.kind = kind;
            this.name = name;
        }

        public Builder returnType(String returnType) { this.returnType = returnType; return this; }
        public Builder body(byte... body) { this.body = body; return this; }
        public Builder body(int... body) {
            byte[] bytes = new byte[body.length];
            for (int i = 0; i < body.length; i++) {
                bytes[i] = (byte) body[i];
            }
            this.body = bytes;
            return this;
        }
        public Builder attributes(AttributeRef... attributes) {
            List<AttributeRef> list = List.of(attributes);
            this.attributeSource = () -> list;
            return this;
        }
        public Builder attributeSource(Supplier<List<AttributeRef>> source) { this.attributeSource = source; return this; }
        public Builder modifiers(MemberModifier... modifiers) {
            Set<MemberModifier> set = EnumSet.noneOf(MemberModifier.class);
            set.addAll(List.of(modifiers));
            this.modifiers = set;
            return this;
        }
        public Builder parameters(ParameterDescriptor... parameters) { this.parameters = List.of(parameters); return this; }
        public Builder token(int metadataToken) { this.metadataToken = metadataToken; return this; }
        public Builder accessorTokens(Integer... tokens) { this.accessorTokens = List.of(tokens); return this; }

        MemberDescriptor build(TypeDescriptor declaringType) {
            if (name == null || name.isEmpty()) {
                throw new IllegalStateException("Member name is required");
            }
            return new MemberDescriptor(this, declaringType);
        }
    }
}
