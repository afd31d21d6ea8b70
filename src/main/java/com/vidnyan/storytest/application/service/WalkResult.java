package com.vidnyan.storytest.application.service;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.report.WalkStatistics;
import com.vidnyan.storytest.domain.rule.Candidate;

import java.util.List;

/**
 * Output of {@link MetadataWalker#walk}.
 *
 * @param candidates     surviving (type, member) pairs in walk order
 * @param referenceScope every member with a body in the analyzed assemblies, scaffolding included,
 *                       used to resolve call and field references
 * @param notes          diagnostics such as partial loads and invalid exemption markers
 */
public record WalkResult(
    List<Candidate> candidates,
    List<MemberDescriptor> referenceScope,
    List<String> notes,
    WalkStatistics statistics,
    boolean cancelled
) {

    public WalkResult {
        candidates = List.copyOf(candidates);
        referenceScope = List.copyOf(referenceScope);
        notes = List.copyOf(notes);
    }
}
