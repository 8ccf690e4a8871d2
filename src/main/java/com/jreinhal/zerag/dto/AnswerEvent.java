package com.jreinhal.zerag.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * One event of a streamed answer: {@code retrieval_done}, then any number of {@code token},
 * then {@code done}; or {@code error} at any point, which ends the stream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerEvent(
        String type,
        List<RetrievedChunk> chunks,
        List<Map<String, Object>> trace,
        String token,
        String answer,
        String message) {

    public static final String RETRIEVAL_DONE = "retrieval_done";
    public static final String TOKEN = "token";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static AnswerEvent retrievalDone(List<RetrievedChunk> chunks, List<Map<String, Object>> trace) {
        return new AnswerEvent(RETRIEVAL_DONE, chunks, trace, null, null, null);
    }

    public static AnswerEvent token(String token) {
        return new AnswerEvent(TOKEN, null, null, token, null, null);
    }

    public static AnswerEvent done(String answer) {
        return new AnswerEvent(DONE, null, null, null, answer, null);
    }

    public static AnswerEvent error(String message) {
        return new AnswerEvent(ERROR, null, null, null, null, message);
    }
}
