package io.lapse.engine;

import io.lapse.model.ParsedExpiry;
import io.lapse.model.Verdict;

/**
 * The classifier's view of one record.
 *
 * @param parsed the parse outcome of the stored expiry
 * @param verdict the verdict against the reference instant
 * @param display the human-readable expiry: civil time, "Unknown" or "Not Found"
 */
public record Classification(ParsedExpiry parsed, Verdict verdict, String display) {}
