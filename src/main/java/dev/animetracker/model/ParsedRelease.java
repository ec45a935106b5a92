package dev.animetracker.model;

import java.util.List;

/**
 * Fields extracted from a release title.
 *
 * @param showTitle   show name guess
 * @param season      season marker when the title carries one, otherwise null
 * @param episode     episode number, or the first episode of a batch
 * @param lastEpisode last episode of a batch, equal to {@code episode} for single releases
 * @param resolution  resolution tag such as "1080p", empty when absent
 * @param group       release group from the bracket prefix, empty when absent
 * @param hash        CRC tag from the title, empty when absent
 * @param extras      remaining bracket tags (codec, subtitle info, ...)
 */
public record ParsedRelease(
        String showTitle,
        Integer season,
        int episode,
        int lastEpisode,
        String resolution,
        String group,
        String hash,
        List<String> extras) {

    public boolean isBatch() {
        return lastEpisode != episode;
    }

    /**
     * Vertical resolution in pixels, 0 when unknown.
     */
    public int resolutionValue() {
        if (resolution == null || resolution.isEmpty()) {
            return 0;
        }
        String digits = resolution.replaceAll("\\D", "");
        return digits.isEmpty() ? 0 : Integer.parseInt(digits);
    }
}
