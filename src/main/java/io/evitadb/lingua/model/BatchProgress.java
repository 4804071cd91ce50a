package io.evitadb.lingua.model;

import javax.annotation.Nullable;

/**
 * Progress snapshot reported after a batch unit finishes.
 *
 * @param completed number of finished (successful or failed) units
 * @param total     number of units that will be attempted
 * @param current   label of the unit that just finished
 */
public record BatchProgress(int completed, int total, @Nullable String current) {
}
