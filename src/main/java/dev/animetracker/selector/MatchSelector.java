package dev.animetracker.selector;

import dev.animetracker.config.TrackerProperties;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.ReleaseCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks one release among the accepted candidates for a (show, episode).
 *
 * <p>Ranking, each step only breaking ties of the previous one:
 * <ol>
 *   <li>the show's preferred release group, when set</li>
 *   <li>higher resolution</li>
 *   <li>feed origin, in the configured source priority order</li>
 *   <li>first-seen position across the show's feeds, in the order the show lists them</li>
 *   <li>lexicographically smallest content id</li>
 * </ol>
 * The same input always gives the same pick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchSelector {

    private final TrackerProperties trackerProperties;

    /**
     * @throws NoCandidateException when {@code candidates} is empty
     */
    public Selection select(List<ReleaseCandidate> candidates, TrackedShow show) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoCandidateException("No accepted release for " + show.getTitle());
        }

        Comparator<ReleaseCandidate> primary = primaryOrder(show);
        Comparator<ReleaseCandidate> full = primary
                .thenComparingInt(ReleaseCandidate::getPosition)
                .thenComparing(ReleaseCandidate::getContentId, Comparator.nullsLast(Comparator.naturalOrder()));

        List<ReleaseCandidate> ranked = candidates.stream().sorted(full).toList();
        ReleaseCandidate best = ranked.get(0);
        boolean ambiguous = ranked.size() > 1 && primary.compare(best, ranked.get(1)) == 0;

        if (ambiguous) {
            log.debug("{} episode {}: '{}' and '{}' tie on group, resolution and source",
                    show.getTitle(), best.getEpisode(), best.getRawTitle(), ranked.get(1).getRawTitle());
        }
        log.debug("{} episode {}: selected '{}' out of {}", show.getTitle(), best.getEpisode(),
                best.getRawTitle(), candidates.size());
        return new Selection(best, ambiguous);
    }

    private Comparator<ReleaseCandidate> primaryOrder(TrackedShow show) {
        String preferred = show.getPreferredGroup();
        Comparator<ReleaseCandidate> byGroup = Comparator.comparingInt(
                c -> preferred != null && !preferred.isBlank() && preferred.equalsIgnoreCase(c.getGroup()) ? 0 : 1);
        return byGroup
                .thenComparing(Comparator.comparingInt(ReleaseCandidate::getResolution).reversed())
                .thenComparingInt(c -> sourceRank(c.getOrigin()));
    }

    int sourceRank(FeedOrigin origin) {
        List<FeedOrigin> priority = trackerProperties.getSourcePriority();
        int index = origin == null ? -1 : priority.indexOf(origin);
        return index < 0 ? priority.size() : index;
    }
}
