package io.lapse.engine;

/**
 * Counters of a targeted update. Dry runs report the intended effect.
 *
 * @param scanned matched records
 * @param setExpired records moving from not-expired to expired
 * @param setExpires records whose expires field is overwritten
 * @param indeterminate matched records whose stored expiry was absent, empty or "unknown"
 * @param unparsable matched records whose stored expiry matched no grammar
 * @param updatedExpiresOnly overwrites of expires alone (stamp-only mode)
 */
public record TargetedStats(
    int scanned,
    int setExpired,
    int setExpires,
    int indeterminate,
    int unparsable,
    int updatedExpiresOnly) {}
