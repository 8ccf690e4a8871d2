package com.jreinhal.zerag.extraction;

import com.jreinhal.zerag.exception.ExtractionException;
import com.jreinhal.zerag.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.xml.sax.SAXException;

/**
 * Turns one uploaded file or one web page into plain text. Plain-text formats are read
 * directly; everything else goes through Tika's auto-detecting parser.
 */
@Component
public class TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TextExtractor.class);
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("pdf", "docx", "doc", "pptx", "ppt", "txt", "md");
    private static final Set<String> PLAIN_TEXT = Set.of("txt", "md");

    @Value("${zerag.extraction.max-chars:5000000}")
    private int maxChars = 5_000_000;

    @Value("${zerag.extraction.web-timeout-seconds:20}")
    private int webTimeoutSeconds = 20;

    private RestTemplate restTemplate;

    @PostConstruct
    public void init() {
        int timeoutMs = this.webTimeoutSeconds * 1000;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        this.restTemplate = new RestTemplate(factory);
        log.info("Text extractor initialized (maxChars={}, webTimeout={}s)", this.maxChars, this.webTimeoutSeconds);
    }

    public static boolean isSupported(String filename) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(filename));
    }

    public String extractFile(Path path) throws ExtractionException {
        String filename = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        String extension = extensionOf(filename);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new ExtractionException(ExtractionException.Reason.UNSUPPORTED_FORMAT,
                    "Unsupported file format '." + extension + "' for " + filename + "; supported: " + SUPPORTED_EXTENSIONS);
        }
        if (!Files.isRegularFile(path)) {
            throw new ExtractionException(ExtractionException.Reason.NOT_FOUND, "File not found: " + filename);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        }
        catch (IOException e) {
            throw new ExtractionException(ExtractionException.Reason.PARSE_ERROR, "Cannot read " + filename, e);
        }
        String text = PLAIN_TEXT.contains(extension)
                ? this.capped(new String(bytes, StandardCharsets.UTF_8), filename)
                : this.parse(bytes, filename);
        if (log.isDebugEnabled()) {
            log.debug("Extracted {} chars from {}", text.length(), LogSanitizer.sanitize(filename));
        }
        return text;
    }

    public String extractUrl(String url) throws ExtractionException {
        ResponseEntity<byte[]> response;
        try {
            response = this.restTemplate.getForEntity(url, byte[].class);
        }
        catch (RestClientException | IllegalArgumentException e) {
            throw new ExtractionException(ExtractionException.Reason.NOT_FOUND, "Fetch failed for " + url + ": " + e.getMessage(), e);
        }
        byte[] body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null) {
            throw new ExtractionException(ExtractionException.Reason.NOT_FOUND,
                    "Fetch failed for " + url + ": HTTP " + response.getStatusCode().value());
        }
        return this.parse(body, url);
    }

    /**
     * Text beyond {@code maxChars} is dropped; the part before the limit is still returned.
     */
    String parse(byte[] bytes, String resourceName) throws ExtractionException {
        AutoDetectParser parser = new AutoDetectParser();
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, resourceName);
        BodyContentHandler handler = new BodyContentHandler(this.maxChars);
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            parser.parse(in, handler, metadata, new ParseContext());
            return handler.toString();
        }
        catch (SAXException e) {
            if (WriteLimitReachedException.isWriteLimitReached(e)) {
                log.info("Truncated {} at {} chars", LogSanitizer.sanitize(resourceName), this.maxChars);
                return handler.toString();
            }
            throw new ExtractionException(ExtractionException.Reason.PARSE_ERROR,
                    "Parse error for " + resourceName + ": " + e.getMessage(), e);
        }
        catch (IOException | TikaException e) {
            if (WriteLimitReachedException.isWriteLimitReached(e)) {
                log.info("Truncated {} at {} chars", LogSanitizer.sanitize(resourceName), this.maxChars);
                return handler.toString();
            }
            throw new ExtractionException(ExtractionException.Reason.PARSE_ERROR,
                    "Parse error for " + resourceName + ": " + e.getMessage(), e);
        }
    }

    private String capped(String text, String filename) {
        if (text.length() <= this.maxChars) {
            return text;
        }
        log.info("Truncated {} at {} chars", LogSanitizer.sanitize(filename), this.maxChars);
        return text.substring(0, this.maxChars);
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
