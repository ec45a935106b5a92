package dev.animetracker.parser;

import dev.animetracker.model.ParsedRelease;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReleaseTitleParserTest {

    private ReleaseTitleParser parser;

    @BeforeEach
    void setUp() {
        parser = new ReleaseTitleParser();
    }

    @Nested
    @DisplayName("Common release layouts")
    class LayoutTests {

        @Test
        @DisplayName("Should parse SubsPlease style title")
        void shouldParseSubsPleaseTitle() {
            ParsedRelease parsed = parser.parse("[SubsPlease] One Piece - 1060 (1080p) [37A98D45].mkv");

            assertThat(parsed.showTitle()).isEqualTo("One Piece");
            assertThat(parsed.season()).isNull();
            assertThat(parsed.episode()).isEqualTo(1060);
            assertThat(parsed.resolution()).isEqualTo("1080p");
            assertThat(parsed.group()).isEqualTo("SubsPlease");
            assertThat(parsed.hash()).isEqualTo("37A98D45");
            assertThat(parsed.extras()).isEmpty();
            assertThat(parsed.isBatch()).isFalse();
        }

        @Test
        @DisplayName("Should keep subtitle tags as extras")
        void shouldCollectExtras() {
            ParsedRelease parsed = parser.parse(
                    "[Erai-raws] Goblin Slayer II - 03 [1080p][Multiple Subtitle] [ENG][POR-BR]");

            assertThat(parsed.showTitle()).isEqualTo("Goblin Slayer II");
            assertThat(parsed.episode()).isEqualTo(3);
            assertThat(parsed.group()).isEqualTo("Erai-raws");
            assertThat(parsed.hash()).isEmpty();
            assertThat(parsed.extras()).containsExactly("Multiple Subtitle", "ENG", "POR-BR");
        }

        @Test
        @DisplayName("Should strip resolution out of a mixed tag and drop the hash from extras")
        void shouldCleanMixedTag() {
            ParsedRelease parsed = parser.parse(
                    "[Erai-raws] Oshi no Ko 3rd Season - 01 [1080p CR WEBRip HEVC AAC][MultiSub][E5D615AA]");

            assertThat(parsed.showTitle()).isEqualTo("Oshi no Ko");
            assertThat(parsed.season()).isEqualTo(3);
            assertThat(parsed.episode()).isEqualTo(1);
            assertThat(parsed.hash()).isEqualTo("E5D615AA");
            assertThat(parsed.extras()).containsExactly("CR WEBRip HEVC AAC", "MultiSub");
        }

        @Test
        @DisplayName("Should keep numbers that belong to the show name")
        void shouldKeepNumericShowNames() {
            assertThat(parser.parse("[SubsPlease] Mob Psycho 100 - 05 (1080p)").showTitle())
                    .isEqualTo("Mob Psycho 100");
            assertThat(parser.parse("[SubsPlease] 86 - 05 (1080p)").showTitle()).isEqualTo("86");
        }

        @Test
        @DisplayName("Should accept a title without group prefix")
        void shouldParseWithoutGroup() {
            ParsedRelease parsed = parser.parse("Show Name Season 2 - 07 [720p]");

            assertThat(parsed.group()).isEmpty();
            assertThat(parsed.showTitle()).isEqualTo("Show Name");
            assertThat(parsed.season()).isEqualTo(2);
            assertThat(parsed.episode()).isEqualTo(7);
            assertThat(parsed.resolution()).isEqualTo("720p");
        }
    }

    @Nested
    @DisplayName("Episode and season markers")
    class EpisodeTests {

        @Test
        @DisplayName("Should read the short season marker")
        void shouldReadShortSeason() {
            ParsedRelease parsed = parser.parse("[SubsPlease] Sousou no Frieren S2 - 05 (1080p) [8E4A2C1F].mkv");

            assertThat(parsed.showTitle()).isEqualTo("Sousou no Frieren");
            assertThat(parsed.season()).isEqualTo(2);
            assertThat(parsed.episode()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should read SxxEyy markers")
        void shouldReadSeasonEpisode() {
            ParsedRelease parsed = parser.parse("[Group] Show Name S01E05 [1080p]");

            assertThat(parsed.showTitle()).isEqualTo("Show Name");
            assertThat(parsed.season()).isEqualTo(1);
            assertThat(parsed.episode()).isEqualTo(5);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "[Group] Show - 05v2 (1080p)",
                "[Group] Show - 05 END (1080p)",
                "[Group] Show Episode 5 (1080p)",
                "[Group] Show 05 [1080p]"
        })
        @DisplayName("Should read episode 5 from different notations")
        void shouldReadEpisodeNotations(String title) {
            ParsedRelease parsed = parser.parse(title);

            assertThat(parsed.showTitle()).isEqualTo("Show");
            assertThat(parsed.episode()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should report dash ranges as batches")
        void shouldDetectDashBatch() {
            ParsedRelease parsed = parser.parse("[Group] Show - 01-12 (1080p) [Batch]");

            assertThat(parsed.isBatch()).isTrue();
            assertThat(parsed.episode()).isEqualTo(1);
            assertThat(parsed.lastEpisode()).isEqualTo(12);
            assertThat(parsed.showTitle()).isEqualTo("Show");
            assertThat(parsed.extras()).contains("Batch");
        }

        @Test
        @DisplayName("Should report bracketed tilde ranges as batches")
        void shouldDetectBracketedBatch() {
            ParsedRelease parsed = parser.parse("[Group] Show (01 ~ 12) [1080p]");

            assertThat(parsed.isBatch()).isTrue();
            assertThat(parsed.episode()).isEqualTo(1);
            assertThat(parsed.lastEpisode()).isEqualTo(12);
        }
    }

    @Nested
    @DisplayName("Resolution detection")
    class ResolutionTests {

        @Test
        @DisplayName("Should convert dimensions to a resolution tag")
        void shouldReadDimensions() {
            ParsedRelease parsed = parser.parse("[Group] Show - 05 [1920x1080]");

            assertThat(parsed.resolution()).isEqualTo("1080p");
            assertThat(parsed.resolutionValue()).isEqualTo(1080);
        }

        @Test
        @DisplayName("Should map 4K to 2160p")
        void shouldReadFourK() {
            assertThat(parser.parse("[Group] Show - 05 [4K HDR]").resolution()).isEqualTo("2160p");
        }

        @Test
        @DisplayName("Should read an unbracketed resolution after the episode")
        void shouldReadBareTrailingResolution() {
            ParsedRelease parsed = parser.parse("[Erai-raws] Show A - 05 1080p");

            assertThat(parsed.showTitle()).isEqualTo("Show A");
            assertThat(parsed.episode()).isEqualTo(5);
            assertThat(parsed.resolution()).isEqualTo("1080p");
            assertThat(parsed.extras()).isEmpty();
        }

        @Test
        @DisplayName("Should keep unbracketed codec tags as extras")
        void shouldReadBareTrailingCodecTags() {
            ParsedRelease parsed = parser.parse("[ASW] Show A - 05 1080p HEVC");

            assertThat(parsed.group()).isEqualTo("ASW");
            assertThat(parsed.showTitle()).isEqualTo("Show A");
            assertThat(parsed.episode()).isEqualTo(5);
            assertThat(parsed.resolution()).isEqualTo("1080p");
            assertThat(parsed.extras()).containsExactly("HEVC");
        }

        @Test
        @DisplayName("Should read a bare episode number followed by tags")
        void shouldReadTrailingNumberBeforeTags() {
            ParsedRelease parsed = parser.parse("[Group] Mob Psycho 100 07 720p x264 AAC.mkv");

            assertThat(parsed.showTitle()).isEqualTo("Mob Psycho 100");
            assertThat(parsed.episode()).isEqualTo(7);
            assertThat(parsed.resolution()).isEqualTo("720p");
            assertThat(parsed.extras()).containsExactly("x264 AAC");
        }

        @Test
        @DisplayName("Should leave resolution empty when absent")
        void shouldLeaveResolutionEmpty() {
            ParsedRelease parsed = parser.parse("[Group] Show - 05");

            assertThat(parsed.resolution()).isEmpty();
            assertThat(parsed.resolutionValue()).isZero();
        }
    }

    @Nested
    @DisplayName("Unparseable titles")
    class FailureTests {

        @Test
        @DisplayName("Should fail when no episode number is present")
        void shouldFailWithoutEpisode() {
            assertThatThrownBy(() -> parser.parse("[SubsPlease] Some Movie (1080p)"))
                    .isInstanceOf(ReleaseParseException.class)
                    .hasMessageContaining("No episode number");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Should fail on blank titles")
        void shouldFailOnBlank(String title) {
            assertThatThrownBy(() -> parser.parse(title))
                    .isInstanceOf(ReleaseParseException.class);
        }
    }

    @Test
    @DisplayName("Should recover every field of generated canonical titles")
    void shouldRecoverGeneratedTitles() {
        List<String> groups = List.of("SubsPlease", "Erai-raws", "ASW", "Judas");
        List<String> shows = List.of("One Piece", "Kusuriya no Hitorigoto", "Mob Psycho 100", "Dr. Stone", "86");
        int[] resolutions = {480, 720, 1080, 2160};
        Random random = new Random(42);

        for (int i = 0; i < 200; i++) {
            String group = groups.get(random.nextInt(groups.size()));
            String show = shows.get(random.nextInt(shows.size()));
            int episode = 1 + random.nextInt(1500);
            int resolution = resolutions[random.nextInt(resolutions.length)];
            int hash = random.nextInt();
            String title = String.format("[%s] %s - %02d (%dp) [%08X].mkv", group, show, episode, resolution, hash);

            ParsedRelease parsed = parser.parse(title);

            assertThat(parsed.group()).as(title).isEqualTo(group);
            assertThat(parsed.showTitle()).as(title).isEqualTo(show);
            assertThat(parsed.episode()).as(title).isEqualTo(episode);
            assertThat(parsed.resolutionValue()).as(title).isEqualTo(resolution);
            assertThat(parsed.hash()).as(title).isEqualTo(String.format("%08X", hash));
            assertThat(parsed.isBatch()).as(title).isFalse();
        }
    }
}
