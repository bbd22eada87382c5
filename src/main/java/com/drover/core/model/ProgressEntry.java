package com.drover.core.model;

import java.time.Instant;

/**
 * One timestamped line in a background task's progress log.
 *
 * @param timestamp when the entry was appended
 * @param step      optional step label (e.g. a task id)
 * @param message   narrative text
 */
public record ProgressEntry(Instant timestamp, String step, String message) {
}
