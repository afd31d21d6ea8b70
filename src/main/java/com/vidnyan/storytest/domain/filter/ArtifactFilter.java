package com.vidnyan.storytest.domain.filter;

import com.vidnyan.storytest.domain.model.AttributeRef;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.TypeDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a type or member is compiler/tool scaffolding that no rule should see.
 * Absent input is always skipped.
 */
@Slf4j
public class ArtifactFilter {

    private final Set<ArtifactCategory> checks;
    private final ArtifactCategory.AttributeReader attributes = new SafeAttributeReader();

    public ArtifactFilter() {
        this(EnumSet.allOf(ArtifactCategory.class));
    }

    public ArtifactFilter(Set<ArtifactCategory> checks) {
        this.checks = checks.isEmpty()
                ? EnumSet.noneOf(ArtifactCategory.class)
                : EnumSet.copyOf(checks);
    }

    public boolean shouldSkipType(TypeDescriptor type) {
        if (type == null) {
            return true;
        }
        return matchingCategory(type).isPresent();
    }

    public boolean shouldSkipMember(MemberDescriptor member) {
        if (member == null) {
            return true;
        }
        if (shouldSkipType(member.declaringType())) {
            return true;
        }
        return matchingCategory(member).isPresent();
    }

    /**
     * First check that classifies the type as scaffolding.
     */
    public Optional<ArtifactCategory> matchingCategory(TypeDescriptor type) {
        for (ArtifactCategory check : checks) {
            if (check.matchesType(type, attributes)) {
                log.debug("Skipping type {} ({})", type.fullName(), check);
                return Optional.of(check);
            }
        }
        return Optional.empty();
    }

    public Optional<ArtifactCategory> matchingCategory(MemberDescriptor member) {
        for (ArtifactCategory check : checks) {
            if (check.matchesMember(member, attributes)) {
                log.debug("Skipping member {} ({})", member.qualifiedName(), check);
                return Optional.of(check);
            }
        }
        return Optional.empty();
    }

    /**
     * A malformed or unreadable attribute list reads as empty, i.e. "not generated".
     */
    private static final class SafeAttributeReader implements ArtifactCategory.AttributeReader {

        @Override
        public List<AttributeRef> of(TypeDescriptor type) {
            try {
                return type.attributes();
            } catch (RuntimeException e) {
                log.debug("Attributes of {} unreadable: {}", type.fullName(), e.getMessage());
                return List.of();
            }
        }

        @Override
        public List<AttributeRef> of(MemberDescriptor member) {
            try {
                return member.attributes();
            } catch (RuntimeException e) {
                log.debug("Attributes of {} unreadable: {}", member.qualifiedName(), e.getMessage());
                return List.of();
            }
        }
    }
}
