package dev.animetracker.selector;

import dev.animetracker.model.ReleaseCandidate;

/**
 * The chosen release for one episode.
 *
 * @param ambiguous true when the runner-up tied with the pick on group, resolution and source,
 *                  so only first-seen order or the content id decided
 */
public record Selection(ReleaseCandidate candidate, boolean ambiguous) {
}
