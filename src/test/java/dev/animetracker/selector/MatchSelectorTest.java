package dev.animetracker.selector;

import dev.animetracker.config.TrackerProperties;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.ReleaseCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchSelectorTest {

    private TrackerProperties trackerProperties;
    private MatchSelector selector;
    private TrackedShow show;

    @BeforeEach
    void setUp() {
        trackerProperties = new TrackerProperties();
        selector = new MatchSelector(trackerProperties);
        show = TrackedShow.builder().id(1L).title("Kusuriya no Hitorigoto").build();
    }

    private ReleaseCandidate candidate(String group, int resolution, FeedOrigin origin, int position, String contentId) {
        return ReleaseCandidate.builder()
                .rawTitle("[" + group + "] Kusuriya no Hitorigoto - 25 (" + resolution + "p)")
                .group(group)
                .resolution(resolution)
                .episode(25)
                .origin(origin)
                .position(position)
                .contentId(contentId)
                .build();
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Should prefer the higher resolution")
        void shouldPreferResolution() {
            ReleaseCandidate erai = candidate("Erai-raws", 1080, FeedOrigin.RSS, 1, "bbb");
            ReleaseCandidate subsPlease = candidate("SubsPlease", 720, FeedOrigin.RSS, 0, "aaa");

            Selection selection = selector.select(List.of(subsPlease, erai), show);

            assertThat(selection.candidate()).isSameAs(erai);
            assertThat(selection.ambiguous()).isFalse();
        }

        @Test
        @DisplayName("Should put the preferred group above resolution")
        void shouldPreferGroup() {
            show.setPreferredGroup("subsplease");
            ReleaseCandidate erai = candidate("Erai-raws", 1080, FeedOrigin.RSS, 0, "aaa");
            ReleaseCandidate subsPlease = candidate("SubsPlease", 720, FeedOrigin.RSS, 1, "bbb");

            assertThat(selector.select(List.of(erai, subsPlease), show).candidate()).isSameAs(subsPlease);
        }

        @Test
        @DisplayName("Should rank RSS above scraped listings by default")
        void shouldPreferRss() {
            ReleaseCandidate scraped = candidate("Erai-raws", 1080, FeedOrigin.SCRAPE, 0, "aaa");
            ReleaseCandidate rss = candidate("Erai-raws", 1080, FeedOrigin.RSS, 3, "bbb");

            assertThat(selector.select(List.of(scraped, rss), show).candidate()).isSameAs(rss);
        }

        @Test
        @DisplayName("Should follow a configured source priority")
        void shouldFollowConfiguredPriority() {
            trackerProperties.setSourcePriority(List.of(FeedOrigin.SCRAPE, FeedOrigin.RSS));
            ReleaseCandidate scraped = candidate("Erai-raws", 1080, FeedOrigin.SCRAPE, 5, "bbb");
            ReleaseCandidate rss = candidate("Erai-raws", 1080, FeedOrigin.RSS, 0, "aaa");

            assertThat(selector.select(List.of(rss, scraped), show).candidate()).isSameAs(scraped);
            assertThat(selector.sourceRank(null)).isEqualTo(2);
        }

        @Test
        @DisplayName("Should fall back to feed position, then content id")
        void shouldBreakTiesDeterministically() {
            ReleaseCandidate later = candidate("Erai-raws", 1080, FeedOrigin.RSS, 4, "aaa");
            ReleaseCandidate earlier = candidate("Erai-raws", 1080, FeedOrigin.RSS, 2, "zzz");
            ReleaseCandidate samePosition = candidate("Erai-raws", 1080, FeedOrigin.RSS, 2, "mmm");

            Selection selection = selector.select(List.of(later, earlier, samePosition), show);

            assertThat(selection.candidate()).isSameAs(samePosition);
            assertThat(selection.ambiguous()).isTrue();
        }

        @Test
        @DisplayName("Should pick the same release whatever the input order")
        void shouldBeOrderIndependent() {
            List<ReleaseCandidate> candidates = new ArrayList<>(List.of(
                    candidate("ASW", 1080, FeedOrigin.RSS, 1, "c"),
                    candidate("Erai-raws", 1080, FeedOrigin.RSS, 0, "b"),
                    candidate("Judas", 2160, FeedOrigin.SCRAPE, 7, "a"),
                    candidate("SubsPlease", 720, FeedOrigin.RSS, 2, "d")));

            ReleaseCandidate first = selector.select(candidates, show).candidate();
            Collections.reverse(candidates);
            ReleaseCandidate second = selector.select(candidates, show).candidate();

            assertThat(first.getGroup()).isEqualTo("Judas");
            assertThat(second).isSameAs(first);
        }
    }

    @Test
    @DisplayName("Should throw when nothing was accepted")
    void shouldThrowOnEmptyInput() {
        assertThatThrownBy(() -> selector.select(List.of(), show))
                .isInstanceOf(NoCandidateException.class)
                .hasMessageContaining("Kusuriya no Hitorigoto");
    }
}
