package org.cmmn.parser.format;

import org.cmmn.parser.exceptions.UnknownFormatException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FormatDetectorTest {

    @Test
    void shouldDetectXmlAfterWhitespace() {
        assertEquals(CmmnFormat.XML, FormatDetector.detect("  \n<definitions/>", "auto"));
    }

    @Test
    void shouldDetectJsonObjectsAndArrays() {
        assertEquals(CmmnFormat.JSON, FormatDetector.detect("{\"id\":\"D1\"}", "auto"));
        assertEquals(CmmnFormat.JSON, FormatDetector.detect("\t[1]", (String) null));
    }

    @Test
    void shouldTrustExplicitHint() {
        assertEquals(CmmnFormat.XML, FormatDetector.detect("{\"id\":\"D1\"}", "xml"));
        assertEquals(CmmnFormat.JSON, FormatDetector.detect("<definitions/>", CmmnFormat.JSON));
    }

    @Test
    void shouldThrowWhenUndetectable() {
        assertThrows(UnknownFormatException.class, () -> FormatDetector.detect("definitions: []", "auto"));
        assertThrows(UnknownFormatException.class, () -> FormatDetector.detect("<x/>", "yaml"));
    }

    @Test
    void shouldDetectFromExtension() {
        assertEquals(CmmnFormat.XML, FormatDetector.detectFromPath(Path.of("models/claim.xml")));
        assertEquals(CmmnFormat.XML, FormatDetector.detectFromPath(Path.of("models/claim.CMMN")));
        assertEquals(CmmnFormat.JSON, FormatDetector.detectFromPath(Path.of("claim.json")));
        assertEquals(CmmnFormat.AUTO, FormatDetector.detectFromPath(Path.of("claim.txt")));
        assertEquals(CmmnFormat.AUTO, FormatDetector.detectFromPath(Path.of("claim")));
    }
}
