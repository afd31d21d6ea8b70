package com.vidnyan.storytest.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A type as exposed by compiled metadata.
 * Immutable once built; members and nested types hold back-references to it.
 */
public final class TypeDescriptor {

    private final String name;
    private final String namespace;
    private final Set<TypeFlag> flags;
    private final Supplier<List<AttributeRef>> attributeSource;
    private final List<MemberDescriptor> members;
    private final List<TypeDescriptor> nestedTypes;
    private final TypeDescriptor enclosingType;
    private final List<String> unimplementedAbstractMembers;

    private TypeDescriptor(Builder builder, TypeDescriptor enclosingType) {
        this.name = builder.name;
        this.namespace = builder.namespace;
        this.flags = builder.flags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(TypeFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
        this.attributeSource = builder.attributeSource;
        this.enclosingType = enclosingType;
        this.unimplementedAbstractMembers = List.copyOf(builder.unimplementedAbstractMembers);

        List<MemberDescriptor> builtMembers = new ArrayList<>();
        for (MemberDescriptor.Builder member : builder.members) {
            builtMembers.add(member.build(this));
        }
        this.members = List.copyOf(builtMembers);

        List<TypeDescriptor> builtNested = new ArrayList<>();
        for (Builder nested : builder.nestedTypes) {
            builtNested.add(new TypeDescriptor(nested, this));
        }
        this.nestedTypes = List.copyOf(builtNested);
    }

    public String name() { return name; }
    public String namespace() { return namespace; }
    public Set<TypeFlag> flags() { return flags; }
    public List<MemberDescriptor> members() { return members; }
    public List<TypeDescriptor> nestedTypes() { return nestedTypes; }
    public Optional<TypeDescriptor> enclosingType() { return Optional.ofNullable(enclosingType); }
    public List<String> unimplementedAbstractMembers() { return unimplementedAbstractMembers; }

    /**
     * Attributes applied to this type. The loader may resolve them lazily,
     * so this call can throw.
     */
    public List<AttributeRef> attributes() {
        List<AttributeRef> attributes = attributeSource.get();
        return attributes == null ? List.of() : attributes;
    }

    public boolean hasFlag(TypeFlag flag) {
        return flags.contains(flag);
    }

    public boolean isInterface() { return hasFlag(TypeFlag.INTERFACE); }
    public boolean isAbstract() { return hasFlag(TypeFlag.ABSTRACT); }
    public boolean isEnum() { return hasFlag(TypeFlag.ENUM); }

    /**
     * Plain class: not an interface, enum or value type.
     */
    public boolean isClass() {
        return !isInterface() && !isEnum() && !hasFlag(TypeFlag.VALUE_TYPE);
    }

    /**
     * Namespace-qualified name; nested types are joined to their enclosing type with '+'.
     */
    public String fullName() {
        if (enclosingType != null) {
            return enclosingType.fullName() + "+" + name;
        }
        if (namespace == null || namespace.isEmpty()) {
            return name;
        }
        return namespace + "." + name;
    }

    public List<MemberDescriptor> membersOfKind(MemberKind kind) {
        return members.stream().filter(m -> m.kind() == kind).toList();
    }

    @Override
    public String toString() {
        return fullName();
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public static class Builder {
        private String name;
        private String namespace = "";
        private Set<TypeFlag> flags = EnumSet.noneOf(TypeFlag.class);
        private Supplier<List<AttributeRef>> attributeSource = List::of;
        private final List<MemberDescriptor.Builder> members = new ArrayList<>();
        private final List<Builder> nestedTypes = new ArrayList<>();
        private List<String> unimplementedAbstractMembers = List.of();

        public Builder name(String name) { this.name = name; return this; }
        public Builder namespace(String namespace) { this.namespace = namespace; return this; }
        public Builder flags(TypeFlag... flags) { this.flags = Set.of(flags); return this; }
        public Builder attributes(AttributeRef... attributes) {
            List<AttributeRef> list = List.of(attributes);
            this.attributeSource = () -> list;
            return this;
        }
        public Builder attributeSource(Supplier<List<AttributeRef>> source) { this.attributeSource = source; return this; }
        public Builder member(MemberDescriptor.Builder member) { this.members.add(member); return this; }
        public Builder nested(Builder nested) { this.nestedTypes.add(nested); return this; }
        public Builder unimplementedAbstractMembers(String... names) {
            this.unimplementedAbstractMembers = List.of(names);
            return this;
        }

        public TypeDescriptor build() {
            if (name == null || name.isEmpty()) {
                throw new IllegalStateException("Type name is required");
            }
            return new TypeDescriptor(this, null);
        }
    }
}
