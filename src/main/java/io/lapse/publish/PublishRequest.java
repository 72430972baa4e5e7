package io.lapse.publish;

import java.nio.file.Path;

/**
 * What a successful, persisting run hands to a publisher.
 *
 * @param document the updated document on disk
 * @param message the commit message describing the change
 */
public record PublishRequest(Path document, String message) {}
