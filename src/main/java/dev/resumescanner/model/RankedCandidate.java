package dev.resumescanner.model;

/**
 * A candidate annotated with its query relevance score.
 */
public record RankedCandidate(CandidateRecord candidate, double score) {
}
