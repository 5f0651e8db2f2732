package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.UnresolvedReason;

import java.util.List;

/**
 * A call leaving a visited function that could not be followed.
 * {@code reason} is null for plain ambiguity; {@code candidates} lists the ambiguous targets.
 */
public record UnknownReach(
    String fromFunctionId,
    String calleeName,
    int line,
    int depth,
    UnresolvedReason reason,
    List<String> candidates
) {

    public UnknownReach {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
