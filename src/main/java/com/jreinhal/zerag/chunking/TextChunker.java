package com.jreinhal.zerag.chunking;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits normalized text into retrieval-sized passages.
 *
 * <p>Every strategy returns an ordered list of non-blank passages. A passage only exceeds the
 * target size when a single paragraph or sentence is longer than it, in which case that unit
 * is force-split with the fixed window. Sentence chunks additionally carry a trailing overlap
 * copied from the start of the next chunk.</p>
 *
 * <p>{@link ChunkStrategy#SMART} resolves to a concrete strategy from the paragraph and
 * sentence counts of the input alone, so identical text always chunks identically.</p>
 */
@Component
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    // CJK terminators end a sentence immediately; Latin ones only when followed by whitespace.
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[。！？；])\\s*|(?<=[.!?;])\\s+");
    private static final String CJK_TERMINATORS = "。！？；";

    static final int SMART_MIN_PARAGRAPHS = 3;
    static final int SMART_MIN_SENTENCES = 5;

    @Value("${zerag.chunking.size:512}")
    private int defaultSize = 512;

    @Value("${zerag.chunking.overlap:64}")
    private int defaultOverlap = 64;

    @PostConstruct
    public void init() {
        validate(this.defaultSize, this.defaultOverlap);
        log.info("Text chunker initialized (size={}, overlap={})", this.defaultSize, this.defaultOverlap);
    }

    public List<String> chunk(String text, ChunkStrategy strategy) {
        return this.chunk(text, strategy, this.defaultSize, this.defaultOverlap);
    }

    public List<String> chunk(String text, ChunkStrategy strategy, int size, int overlap) {
        validate(size, overlap);
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        if (normalized.length() <= size) {
            return List.of(normalized);
        }
        ChunkStrategy effective = strategy == ChunkStrategy.SMART ? resolveSmart(normalized) : strategy;
        if (log.isDebugEnabled()) {
            log.debug("Chunking {} chars with strategy {} (requested {})", normalized.length(), effective, strategy);
        }
        return switch (effective) {
            case PARAGRAPH -> this.byParagraph(normalized, size, overlap);
            case SENTENCE -> this.bySentence(normalized, size, overlap);
            default -> this.fixed(normalized, size, overlap);
        };
    }

    /**
     * Concrete strategy that {@link ChunkStrategy#SMART} picks for this text.
     */
    public ChunkStrategy resolveSmart(String text) {
        String normalized = normalize(text);
        if (splitParagraphs(normalized).size() >= SMART_MIN_PARAGRAPHS) {
            return ChunkStrategy.PARAGRAPH;
        }
        if (splitSentences(normalized).size() >= SMART_MIN_SENTENCES) {
            return ChunkStrategy.SENTENCE;
        }
        return ChunkStrategy.FIXED;
    }

    List<String> fixed(String text, int size, int overlap) {
        List<String> chunks = new ArrayList<>();
        int step = size - overlap;
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + size, text.length());
            String window = text.substring(start, end);
            if (!window.isBlank()) {
                chunks.add(window);
            }
            if (end >= text.length()) {
                break;
            }
            start += step;
        }
        return chunks;
    }

    private List<String> byParagraph(String text, int size, int overlap) {
        List<String> chunks = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        for (String paragraph : splitParagraphs(text)) {
            if (paragraph.length() > size) {
                flush(buffer, chunks);
                chunks.addAll(this.fixed(paragraph, size, overlap));
                continue;
            }
            if (buffer.length() > 0 && buffer.length() + 2 + paragraph.length() > size) {
                flush(buffer, chunks);
            }
            if (buffer.length() > 0) {
                buffer.append("\n\n");
            }
            buffer.append(paragraph);
        }
        flush(buffer, chunks);
        return chunks;
    }

    private List<String> bySentence(String text, int size, int overlap) {
        List<String> merged = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        for (String sentence : splitSentences(text)) {
            if (sentence.length() > size) {
                flush(buffer, merged);
                merged.addAll(this.fixed(sentence, size, overlap));
                continue;
            }
            String separator = buffer.length() == 0 || endsWithCjkTerminator(buffer) ? "" : " ";
            if (buffer.length() > 0 && buffer.length() + separator.length() + sentence.length() > size) {
                flush(buffer, merged);
                separator = "";
            }
            buffer.append(separator).append(sentence);
        }
        flush(buffer, merged);
        if (overlap <= 0 || merged.size() < 2) {
            return merged;
        }
        List<String> chunks = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            String current = merged.get(i);
            if (i + 1 < merged.size()) {
                String next = merged.get(i + 1);
                current = current + next.substring(0, Math.min(overlap, next.length()));
            }
            chunks.add(current);
        }
        return chunks;
    }

    static List<String> splitParagraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        for (String part : PARAGRAPH_BREAK.split(text)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        return paragraphs;
    }

    static List<String> splitSentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String part : SENTENCE_BREAK.split(text)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return sentences;
    }

    private static boolean endsWithCjkTerminator(CharSequence buffer) {
        return buffer.length() > 0 && CJK_TERMINATORS.indexOf(buffer.charAt(buffer.length() - 1)) >= 0;
    }

    private static void flush(StringBuilder buffer, List<String> target) {
        if (buffer.length() > 0) {
            String value = buffer.toString().strip();
            if (!value.isEmpty()) {
                target.add(value);
            }
            buffer.setLength(0);
        }
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n').strip();
    }

    private static void validate(int size, int overlap) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (overlap < 0 || overlap >= size) {
            throw new IllegalArgumentException("Chunk overlap must be in [0, size)");
        }
    }
}
