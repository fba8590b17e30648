package com.ttp.trust.engine;

/** A candidate path with its raw (decayed, undiscounted) confidence. */
public record ScoredPath(CandidatePath path, double rawConfidence) {
}
