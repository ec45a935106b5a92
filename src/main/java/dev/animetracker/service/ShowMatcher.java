package dev.animetracker.service;

import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.ReleaseCandidate;
import dev.animetracker.parser.TitleNormalizer;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a parsed release belongs to a tracked show.
 * Titles are compared by {@link TitleNormalizer#comparisonKey}, against the show title, its
 * aliases and their search forms. A release carrying a season marker must name the show's season.
 */
@Component
public class ShowMatcher {

    public boolean matches(ReleaseCandidate candidate, TrackedShow show) {
        String guess = TitleNormalizer.comparisonKey(candidate.getShowGuess());
        if (guess.isEmpty() || !titleKeys(show).contains(guess)) {
            return false;
        }
        return candidate.getSeason() == null || candidate.getSeason() == show.getSeason();
    }

    Set<String> titleKeys(TrackedShow show) {
        Set<String> keys = new HashSet<>();
        addKeys(keys, show.getTitle());
        show.getAliases().forEach(alias -> addKeys(keys, alias));
        keys.remove("");
        return keys;
    }

    private void addKeys(Set<String> keys, String title) {
        keys.add(TitleNormalizer.comparisonKey(title));
        keys.add(TitleNormalizer.comparisonKey(TitleNormalizer.normalizeForSearch(title)));
    }
}
