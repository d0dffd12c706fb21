package com.raditha.dictation.model;

/**
 * One step of a word-level edit script.
 * An absent side is encoded as {@code -1}.
 *
 * @param type           Operation kind
 * @param referenceIndex Index into the reference words, or -1 for INSERT
 * @param candidateIndex Index into the candidate words, or -1 for DELETE
 */
public record AlignmentOp(OpType type, int referenceIndex, int candidateIndex) {

    public AlignmentOp {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        boolean needsReference = type != OpType.INSERT;
        boolean needsCandidate = type != OpType.DELETE;
        if (needsReference != (referenceIndex >= 0) || needsCandidate != (candidateIndex >= 0)) {
            throw new IllegalArgumentException(
                    String.format("Invalid indices for %s: ref=%d, cand=%d", type, referenceIndex, candidateIndex));
        }
    }

    public static AlignmentOp match(int referenceIndex, int candidateIndex) {
        return new AlignmentOp(OpType.MATCH, referenceIndex, candidateIndex);
    }

    public static AlignmentOp substitute(int referenceIndex, int candidateIndex) {
        return new AlignmentOp(OpType.SUBSTITUTE, referenceIndex, candidateIndex);
    }

    public static AlignmentOp insert(int candidateIndex) {
        return new AlignmentOp(OpType.INSERT, -1, candidateIndex);
    }

    public static AlignmentOp delete(int referenceIndex) {
        return new AlignmentOp(OpType.DELETE, referenceIndex, -1);
    }

    public boolean hasReference() {
        return referenceIndex >= 0;
    }

    public boolean hasCandidate() {
        return candidateIndex >= 0;
    }
}
