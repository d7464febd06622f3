package org.cmmn.parser.format;

import org.cmmn.parser.exceptions.UnknownFormatException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Decides whether content is CMMN XML or CMMN JSON.
 * Detection is purely syntactic: it looks at the first non-blank character or at the
 * file extension, never at namespaces or schemas.
 */
public final class FormatDetector {

    private FormatDetector() {
    }

    /**
     * An explicit XML or JSON hint always wins, even if the content says otherwise.
     *
     * @return {@link CmmnFormat#XML} or {@link CmmnFormat#JSON}, never AUTO
     * @throws UnknownFormatException if the hint is unknown or auto-detection cannot decide
     */
    public static CmmnFormat detect(String content, String hint) {
        return detect(content, CmmnFormat.fromHint(hint));
    }

    public static CmmnFormat detect(String content, CmmnFormat hint) {
        if (hint == CmmnFormat.XML || hint == CmmnFormat.JSON) {
            return hint;
        }

        String trimmed = content == null ? "" : content.strip();
        if (trimmed.startsWith("<")) {
            return CmmnFormat.XML;
        }
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return CmmnFormat.JSON;
        }
        throw new UnknownFormatException("Unable to auto-detect format");
    }

    /**
     * Classifies a file by extension: .xml and .cmmn are XML, .json is JSON, anything
     * else is {@link CmmnFormat#AUTO} so the caller falls back to content sniffing.
     */
    public static CmmnFormat detectFromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return CmmnFormat.AUTO;
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".xml") || fileName.endsWith(".cmmn")) {
            return CmmnFormat.XML;
        }
        if (fileName.endsWith(".json")) {
            return CmmnFormat.JSON;
        }
        return CmmnFormat.AUTO;
    }
}
