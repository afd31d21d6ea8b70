package com.vidnyan.storytest.domain.rule;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.TypeDescriptor;

/**
 * A (type, member) pair produced by the walker. Type-level candidates have no member.
 */
public record Candidate(
    TypeDescriptor type,
    MemberDescriptor member
) {

    public static Candidate ofType(TypeDescriptor type) {
        return new Candidate(type, null);
    }

    public static Candidate ofMember(MemberDescriptor member) {
        return new Candidate(member.declaringType(), member);
    }

    public boolean isTypeLevel() {
        return member == null;
    }

    public boolean isMember() {
        return member != null;
    }

    public String symbol() {
        return member == null ? type.fullName() : member.qualifiedName();
    }
}
