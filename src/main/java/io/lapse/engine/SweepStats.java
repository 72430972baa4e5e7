package io.lapse.engine;

/**
 * Counters of a bulk sweep.
 *
 * @param scanned records examined
 * @param setExpired records newly flagged expired (would-be count in a dry run)
 * @param indeterminate records with absent, empty or "unknown" expiry
 * @param unparsable records whose expiry matched no grammar
 */
public record SweepStats(int scanned, int setExpired, int indeterminate, int unparsable) {}
