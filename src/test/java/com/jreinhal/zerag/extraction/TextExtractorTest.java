package com.jreinhal.zerag.extraction;

import com.jreinhal.zerag.exception.ExtractionException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextExtractorTest {

    @TempDir
    Path tempDir;

    private TextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new TextExtractor();
        extractor.init();
    }

    @Test
    void readsMarkdownVerbatim() throws Exception {
        Path file = tempDir.resolve("notes.md");
        Files.writeString(file, "# Title\n\n销售额 grew", StandardCharsets.UTF_8);

        assertEquals("# Title\n\n销售额 grew", extractor.extractFile(file));
    }

    @Test
    void rejectsUnsupportedExtension() throws Exception {
        Path file = tempDir.resolve("archive.zip");
        Files.write(file, new byte[]{1, 2, 3});

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extractFile(file));
        assertEquals(ExtractionException.Reason.UNSUPPORTED_FORMAT, e.getReason());
    }

    @Test
    void missingFileIsNotFound() {
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extractFile(tempDir.resolve("gone.txt")));
        assertEquals(ExtractionException.Reason.NOT_FOUND, e.getReason());
    }

    @Test
    void parsesHtmlThroughTika() throws Exception {
        byte[] html = "<html><body><p>Quarterly report</p></body></html>".getBytes(StandardCharsets.UTF_8);

        String text = extractor.parse(html, "page.html");

        assertTrue(text.contains("Quarterly report"));
        assertFalse(text.contains("<p>"));
    }

    @Test
    void parsedTextOverLimitIsTruncatedNotDropped() throws Exception {
        ReflectionTestUtils.setField(extractor, "maxChars", 10);
        byte[] html = "<html><body><p>Quarterly report for the northern region</p></body></html>"
                .getBytes(StandardCharsets.UTF_8);

        String text = extractor.parse(html, "page.html");

        assertTrue(text.length() <= 10);
        assertTrue("Quarterly report".startsWith(text.strip()));
        assertFalse(text.isBlank());
    }

    @Test
    void plainTextOverLimitIsTruncated() throws Exception {
        ReflectionTestUtils.setField(extractor, "maxChars", 5);
        Path file = tempDir.resolve("long.txt");
        Files.writeString(file, "abcdefghij", StandardCharsets.UTF_8);

        assertEquals("abcde", extractor.extractFile(file));
    }

    @Test
    void supportCheckIsCaseInsensitive() {
        assertTrue(TextExtractor.isSupported("Report.PDF"));
        assertFalse(TextExtractor.isSupported("image.png"));
        assertFalse(TextExtractor.isSupported("README"));
    }
}
