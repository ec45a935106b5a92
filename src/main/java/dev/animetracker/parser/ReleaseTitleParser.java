package dev.animetracker.parser;

import dev.animetracker.model.ParsedRelease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based parser for fansub release titles such as
 * {@code [SubsPlease] One Piece - 1060 (1080p) [37A98D45].mkv}.
 *
 * <p>Only the episode number is mandatory. Resolution, group, hash and extras default to empty.
 * Episode ranges ("01-12", "01 ~ 12") are reported as batches, never expanded.
 */
@Slf4j
@Component
public class ReleaseTitleParser {

    private static final Pattern FILE_EXTENSION = Pattern.compile("\\.(?:mkv|mp4|avi|webm)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUP_PREFIX = Pattern.compile("^\\[([^\\]]+)\\]");
    private static final Pattern RESOLUTION = Pattern.compile("(?<![\\dx])(\\d{3,4})p(?![a-z])", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIMENSIONS = Pattern.compile("\\b\\d{3,4}x(\\d{3,4})\\b");
    private static final Pattern FOUR_K = Pattern.compile("\\b4K\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CRC = Pattern.compile("\\[([0-9A-Fa-f]{8})\\]");
    private static final Pattern TAG = Pattern.compile("[\\[(]([^\\])]*)[\\])]");
    private static final Pattern BRACKETED_RANGE = Pattern.compile("[\\[(](\\d{1,4})\\s*[-~]\\s*(\\d{1,4})[\\])]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern TRAILING_TAGS = Pattern.compile(
            "(?:\\s+(?:\\d{3,4}p|\\d{3,4}x\\d{3,4}|4K|[HX]\\.?26[45]|HEVC|AVC|AAC(?:2\\.0)?|FLAC|OPUS|E?AC3"
                    + "|\\d{1,2}-?bit|WEB(?:-?DL|-?Rip)?|BD(?:Rip)?|Blu-?Ray|CR|AMZN|NF|DSNP|Dual-?Audio|Multi-?Subs?))+\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BATCH_RANGE =
            Pattern.compile("(?<!\\d)(\\d{1,4})(?:-|\\s*~\\s*)(\\d{1,4})(?:v\\d+)?\\s*$");
    private static final Pattern SEASON_EPISODE =
            Pattern.compile("\\bS(\\d{1,2})E(\\d{1,4})(?:v\\d+)?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DASH_EPISODE =
            Pattern.compile("\\s[-\u2013]\\s*(\\d{1,4})(?:v\\d+)?(?:\\s*(?:END|FINAL))?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EPISODE_WORD =
            Pattern.compile("\\b(?:EP?|Episode)\\s?(\\d{1,4})(?:v\\d+)?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\s(\\d{1,4})(?:v\\d+)?\\s*$");

    private static final Pattern SEASON_SHORT = Pattern.compile("\\s+S(\\d{1,2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEASON_ORDINAL =
            Pattern.compile("\\s+(\\d{1,2})(?:st|nd|rd|th)\\s+Season$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEASON_WORD = Pattern.compile("\\s+Season\\s+(\\d{1,2})$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s\\-\u2013_:.]+$");

    /**
     * Parse a release title.
     *
     * @throws ReleaseParseException when no episode number can be found
     */
    public ParsedRelease parse(String rawTitle) {
        if (rawTitle == null || rawTitle.isBlank()) {
            throw new ReleaseParseException("Empty release title");
        }

        String title = FILE_EXTENSION.matcher(rawTitle.trim()).replaceAll("");

        String group = "";
        String rest = title;
        Matcher groupMatcher = GROUP_PREFIX.matcher(title);
        if (groupMatcher.find()) {
            group = groupMatcher.group(1).trim();
            rest = title.substring(groupMatcher.end());
        }
        // "(01 ~ 12)" is an episode range, not a tag
        rest = BRACKETED_RANGE.matcher(rest).replaceAll(" $1-$2 ");

        String resolution = detectResolution(rest);
        String hash = detectHash(rest);
        List<String> extras = collectExtras(rest, hash);

        String core = SPACES.matcher(TAG.matcher(rest).replaceAll(" ")).replaceAll(" ").trim();
        // unbracketed tags after the episode: "Show - 05 1080p HEVC"
        Matcher trailingTags = TRAILING_TAGS.matcher(core);
        if (trailingTags.find() && trailingTags.start() > 0) {
            String tags = withoutResolution(trailingTags.group());
            if (!tags.isEmpty()) {
                extras.add(tags);
            }
            core = core.substring(0, trailingTags.start()).trim();
        }
        if (core.isEmpty()) {
            throw new ReleaseParseException("No show name or episode in '" + rawTitle + "'");
        }

        EpisodeMatch match = findEpisode(core);
        if (match == null) {
            throw new ReleaseParseException("No episode number in '" + rawTitle + "'");
        }

        String show = TRAILING_SEPARATORS.matcher(match.showPart()).replaceAll("").trim();
        Integer season = match.season();
        if (season == null) {
            SeasonSplit split = splitSeason(show);
            show = split.show();
            season = split.season();
        }

        ParsedRelease parsed = new ParsedRelease(show, season, match.first(), match.last(),
                resolution, group, hash, List.copyOf(extras));
        log.debug("Parsed '{}' -> {}", rawTitle, parsed);
        return parsed;
    }

    private EpisodeMatch findEpisode(String core) {
        Matcher batch = BATCH_RANGE.matcher(core);
        if (batch.find()) {
            int first = Integer.parseInt(batch.group(1));
            int last = Integer.parseInt(batch.group(2));
            if (last > first) {
                return new EpisodeMatch(core.substring(0, batch.start()), null, first, last);
            }
        }

        Matcher seasonEpisode = SEASON_EPISODE.matcher(core);
        if (seasonEpisode.find()) {
            int episode = Integer.parseInt(seasonEpisode.group(2));
            return new EpisodeMatch(core.substring(0, seasonEpisode.start()),
                    Integer.parseInt(seasonEpisode.group(1)), episode, episode);
        }

        for (Pattern pattern : List.of(DASH_EPISODE, EPISODE_WORD, TRAILING_NUMBER)) {
            Matcher m = pattern.matcher(core);
            if (m.find() && m.start() > 0) {
                int episode = Integer.parseInt(m.group(1));
                return new EpisodeMatch(core.substring(0, m.start()), null, episode, episode);
            }
        }
        return null;
    }

    private SeasonSplit splitSeason(String show) {
        for (Pattern pattern : List.of(SEASON_SHORT, SEASON_ORDINAL, SEASON_WORD)) {
            Matcher m = pattern.matcher(show);
            if (m.find()) {
                return new SeasonSplit(show.substring(0, m.start()).trim(), Integer.parseInt(m.group(1)));
            }
        }
        return new SeasonSplit(show, null);
    }

    private String detectResolution(String text) {
        Matcher m = RESOLUTION.matcher(text);
        if (m.find()) {
            return m.group(1) + "p";
        }
        m = DIMENSIONS.matcher(text);
        if (m.find()) {
            return m.group(1) + "p";
        }
        return FOUR_K.matcher(text).find() ? "2160p" : "";
    }

    private String detectHash(String text) {
        Matcher m = CRC.matcher(text);
        String hash = "";
        while (m.find()) {
            hash = m.group(1).toUpperCase(Locale.ROOT);
        }
        return hash;
    }

    private List<String> collectExtras(String text, String hash) {
        List<String> extras = new ArrayList<>();
        Matcher m = TAG.matcher(text);
        while (m.find()) {
            String tag = withoutResolution(m.group(1));
            if (!tag.isEmpty() && !tag.equalsIgnoreCase(hash)) {
                extras.add(tag);
            }
        }
        return extras;
    }

    private String withoutResolution(String tag) {
        String stripped = DIMENSIONS.matcher(RESOLUTION.matcher(tag).replaceAll("")).replaceAll("");
        return SPACES.matcher(stripped).replaceAll(" ").trim();
    }

    private record EpisodeMatch(String showPart, Integer season, int first, int last) {
    }

    private record SeasonSplit(String show, Integer season) {
    }
}
