package org.cmmn.parser.format;

import org.cmmn.parser.exceptions.UnknownFormatException;

import java.util.Locale;

public enum CmmnFormat {
    XML,
    JSON,
    AUTO;

    /**
     * Maps a format hint ("xml", "json" or "auto", any case) to a format.
     * A null hint means auto-detection.
     *
     * @throws UnknownFormatException if the hint is anything else
     */
    public static CmmnFormat fromHint(String hint) {
        if (hint == null) {
            return AUTO;
        }
        return switch (hint.trim().toLowerCase(Locale.ROOT)) {
            case "xml" -> XML;
            case "json" -> JSON;
            case "auto" -> AUTO;
            default -> throw new UnknownFormatException("Unknown format type: " + hint);
        };
    }

    public String hint() {
        return name().toLowerCase(Locale.ROOT);
    }
}
