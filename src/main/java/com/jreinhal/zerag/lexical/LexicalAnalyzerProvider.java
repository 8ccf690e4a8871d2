package com.jreinhal.zerag.lexical;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.cjk.CJKAnalyzer;
import org.apache.lucene.analysis.cn.smart.SmartChineseAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * Chooses the tokenizer once at startup. The full mode segments Chinese text into words
 * (SmartChineseAnalyzer); the degraded mode indexes CJK runs as overlapping bigrams and
 * everything else as standard word tokens (CJKAnalyzer). Both handle space-delimited scripts.
 */
@Component
public class LexicalAnalyzerProvider {

    private static final Logger log = LoggerFactory.getLogger(LexicalAnalyzerProvider.class);
    static final String SMART_CN_CLASS = "org.apache.lucene.analysis.cn.smart.SmartChineseAnalyzer";

    public enum Mode {
        WORD_SEGMENTING,
        BIGRAM
    }

    @Value("${zerag.lexical.smartcn-enabled:true}")
    private boolean smartcnEnabled = true;

    private Mode mode;

    @PostConstruct
    public void init() {
        boolean available = ClassUtils.isPresent(SMART_CN_CLASS, LexicalAnalyzerProvider.class.getClassLoader());
        this.mode = available && this.smartcnEnabled ? Mode.WORD_SEGMENTING : Mode.BIGRAM;
        if (this.smartcnEnabled && !available) {
            log.warn("SmartChineseAnalyzer not on classpath; lexical index falls back to CJK bigram tokenization");
        }
        log.info("Lexical analyzer mode: {}", this.mode);
    }

    public Mode mode() {
        if (this.mode == null) {
            this.init();
        }
        return this.mode;
    }

    public Analyzer newAnalyzer() {
        return this.mode() == Mode.WORD_SEGMENTING ? new SmartChineseAnalyzer() : new CJKAnalyzer();
    }

    /**
     * Tokens exactly as the index sees them.
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        try (Analyzer analyzer = this.newAnalyzer();
             TokenStream stream = analyzer.tokenStream(LexicalIndex.FIELD_CONTENT, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                String token = term.toString().strip();
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
            stream.end();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Tokenization failed", e);
        }
        return tokens;
    }
}
