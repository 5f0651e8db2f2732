package com.vidnyan.cga.domain.model;

import java.util.List;

/**
 * A single call site together with its resolution state.
 * Immutable value object; resolution produces a new instance.
 */
public record CallReference(
    String callerId,
    String calleeId,
    String calleeName,
    String receiver,
    String file,
    int line,
    int column,
    int argumentCount,
    boolean resolved,
    List<String> candidates,
    double confidence,
    ResolutionReason resolutionReason,
    UnresolvedReason unresolvedReason
) {

    public CallReference {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        if (resolved && (calleeId == null || candidates.size() != 1)) {
            throw new IllegalArgumentException("Resolved reference needs exactly one candidate: " + calleeName);
        }
    }

    /**
     * Mark as resolved to a single target.
     */
    public CallReference resolvedTo(String targetId, double score, ResolutionReason reason) {
        return new CallReference(callerId, targetId, calleeName, receiver, file, line, column, argumentCount,
                true, List.of(targetId), score, reason, null);
    }

    /**
     * Mark as ambiguous: several plausible targets, none chosen.
     */
    public CallReference ambiguous(List<String> targets, double score, ResolutionReason reason) {
        return new CallReference(callerId, null, calleeName, receiver, file, line, column, argumentCount,
                false, targets, score, reason, null);
    }

    /**
     * Mark as unresolved, optionally with a reason from the closed set.
     */
    public CallReference unresolved(UnresolvedReason reason, ResolutionReason attempted) {
        return new CallReference(callerId, null, calleeName, receiver, file, line, column, argumentCount,
                false, List.of(), 0.0, attempted, reason);
    }

    /**
     * Whether more than one candidate was recorded without a choice.
     */
    public boolean ambiguousMatch() {
        return !resolved && candidates.size() > 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String callerId;
        private String calleeId;
        private String calleeName;
        private String receiver;
        private String file;
        private int line;
        private int column;
        private int argumentCount;
        private boolean resolved;
        private List<String> candidates = List.of();
        private double confidence;
        private ResolutionReason resolutionReason;
        private UnresolvedReason unresolvedReason;

        public Builder callerId(String id) { this.callerId = id; return this; }
        public Builder calleeId(String id) { this.calleeId = id; return this; }
        public Builder calleeName(String name) { this.calleeName = name; return this; }
        public Builder receiver(String receiver) { this.receiver = receiver; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder column(int column) { this.column = column; return this; }
        public Builder argumentCount(int count) { this.argumentCount = count; return this; }
        public Builder resolved(boolean resolved) { this.resolved = resolved; return this; }
        public Builder candidates(List<String> candidates) { this.candidates = candidates; return this; }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder resolutionReason(ResolutionReason reason) { this.resolutionReason = reason; return this; }
        public Builder unresolvedReason(UnresolvedReason reason) { this.unresolvedReason = reason; return this; }

        public CallReference build() {
            return new CallReference(callerId, calleeId, calleeName, receiver, file, line, column, argumentCount,
                    resolved, candidates, confidence, resolutionReason, unresolvedReason);
        }
    }
}
