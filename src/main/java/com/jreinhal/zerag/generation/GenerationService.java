package com.jreinhal.zerag.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.zerag.rag.expansion.QueryExpansion;
import com.jreinhal.zerag.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * All calls to the chat model go through here. The structured variants parse the model's
 * output and throw on anything malformed; callers decide how to degrade.
 */
@Service
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);
    public static final String CANNOT_GENERATE = "CANNOT_GENERATE";

    private static final String EXPANSION_PROMPT = """
            You optimize search queries for a question answering system backed by database records \
            and documents.
            User question: "%s"

            Analyze the question and reply with JSON only, no other text:
            {
              "keywords": ["keyword1", "keyword2"],
              "queries": ["rewrite 1", "rewrite 2", "rewrite 3"],
              "hyde_hint": "one sentence: if a matching record existed, it would contain ..."
            }
            keywords: 2-5 core terms for exact full-text matching.
            queries: 3 phrasings with the same meaning.

            Example for the question "who is Jane Doe":
            {
              "keywords": ["Jane Doe"],
              "queries": ["user details for Jane Doe", "the person named Jane Doe", "Jane Doe account role"],
              "hyde_hint": "the users table has a row for Jane Doe with her role, department and contact details"
            }""";

    private static final String HYDE_PROMPT = """
            You write hypothetical records for semantic search.
            User question: "%s"
            Background hint: %s

            Write a short description (50-100 words) of a record that would answer the question, \
            as if it really existed in the data. Output only the description, no explanation.""";

    private static final String STRUCTURED_QUERY_PROMPT = """
            You are a %s database expert.
            Table structure:
            %s

            User question: "%s"

            Write one SQL query that answers the question.
            Rules:
            - Output only the SQL statement, no explanation
            - Use LIMIT %d to cap the result size
            - For fuzzy matches use LIKE '%%keyword%%'
            - If no valid SQL can be written, output: %s

            SQL:""";

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public GenerationService(ChatClient.Builder builder, ObjectMapper objectMapper) {
        this.chatClient = builder.build();
        this.objectMapper = objectMapper;
    }

    public String complete(String systemPrompt, List<Message> messages) {
        String content = this.chatClient.prompt()
                .system(systemPrompt)
                .messages(messages)
                .call()
                .content();
        return content != null ? content : "";
    }

    /**
     * Streams answer fragments. Cancelling the subscription stops the model call.
     */
    public Flux<String> completeStream(String systemPrompt, List<Message> messages) {
        return this.chatClient.prompt()
                .system(systemPrompt)
                .messages(messages)
                .stream()
                .content();
    }

    public QueryExpansion expandQuery(String question) {
        String response = this.generate(EXPANSION_PROMPT.formatted(question));
        JsonNode root;
        try {
            root = this.objectMapper.readTree(stripCodeFence(response, "json"));
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Expansion output is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Expansion output is not a JSON object");
        }
        List<String> keywords = textList(root.get("keywords"));
        List<String> queries = textList(root.get("queries"));
        JsonNode hint = root.get("hyde_hint");
        return new QueryExpansion(
                keywords.isEmpty() ? List.of(question) : keywords,
                queries.isEmpty() ? List.of(question) : queries,
                hint != null && hint.isTextual() && !hint.asText().isBlank() ? hint.asText() : question);
    }

    public String hypotheticalPassage(String question, String hint) {
        return this.generate(HYDE_PROMPT.formatted(question, hint != null ? hint : question)).strip();
    }

    /**
     * Asks for one SQL statement over the given schemas. Empty when the model answers with the
     * {@value #CANNOT_GENERATE} sentinel or nothing at all.
     */
    public Optional<String> generateStructuredQuery(String question, List<TableSchema> schemas, String dialect, int rowLimit) {
        StringBuilder schemaText = new StringBuilder();
        for (TableSchema schema : schemas) {
            if (!schemaText.isEmpty()) {
                schemaText.append('\n');
            }
            schemaText.append("table ").append(schema.table()).append(": columns ").append(String.join(", ", schema.columns()));
        }
        String prompt = STRUCTURED_QUERY_PROMPT.formatted(dialect.toUpperCase(Locale.ROOT), schemaText, question,
                rowLimit, CANNOT_GENERATE);
        String sql = stripCodeFence(this.generate(prompt), "sql");
        if (sql.isEmpty() || CANNOT_GENERATE.equals(sql)) {
            if (log.isDebugEnabled()) {
                log.debug("Model declined to generate SQL for {}", LogSanitizer.querySummary(question));
            }
            return Optional.empty();
        }
        return Optional.of(sql);
    }

    /**
     * One-shot user prompt, stripped reply.
     */
    public String generate(String userText) {
        String content = this.chatClient.prompt().user(userText).call().content();
        return content != null ? content.strip() : "";
    }

    /**
     * Body of the first fenced block, minus its language tag; the whole text if unfenced.
     */
    static String stripCodeFence(String text, String languageTag) {
        if (text == null) {
            return "";
        }
        String body = text.strip();
        int open = body.indexOf("```");
        if (open >= 0) {
            int close = body.indexOf("```", open + 3);
            body = close > open ? body.substring(open + 3, close) : body.substring(open + 3);
            if (body.regionMatches(true, 0, languageTag, 0, languageTag.length())) {
                body = body.substring(languageTag.length());
            }
        }
        return body.strip();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText().strip());
            }
        }
        return values;
    }

    public record TableSchema(String table, List<String> columns) {
    }
}
