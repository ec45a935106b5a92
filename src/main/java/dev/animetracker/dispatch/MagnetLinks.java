package dev.animetracker.dispatch;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public final class MagnetLinks {

    private MagnetLinks() {
    }

    /**
     * {@code magnet:?xt=urn:btih:<hash>&dn=<name>}, with the name percent-encoded.
     */
    public static String fromInfoHash(String infoHash, String displayName) {
        String link = "magnet:?xt=urn:btih:" + infoHash;
        if (displayName == null || displayName.isBlank()) {
            return link;
        }
        return link + "&dn=" + URLEncoder.encode(displayName, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
