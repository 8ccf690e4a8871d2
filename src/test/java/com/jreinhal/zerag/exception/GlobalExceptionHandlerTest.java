package com.jreinhal.zerag.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void mapsDomainExceptionsToStatusCodes() {
        assertEquals(HttpStatus.NOT_FOUND, handler.handleNotFound(new DataSourceNotFoundException("x")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT, handler.handleSyncInProgress(new SyncInProgressException("x")).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.handleOverload(new RejectedExecutionException("busy")).getStatusCode());
    }

    @Test
    void badRequestKeepsPlainMessages() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleBadRequest(new IllegalArgumentException("Question must not be empty"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Question must not be empty", response.getBody().get("error"));
        assertNotNull(response.getBody().get("timestamp"));
    }

    @Test
    void badRequestHidesInternalDetails() {
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("cannot read /var/lib/zerag/db"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("java.lang.NullPointerException"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage(null));
    }

    @Test
    void unhandledExceptionsGetGenericBody() {
        ResponseEntity<Map<String, Object>> response = handler.handleUnhandled(new IllegalStateException("secret detail"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().get("error"));
    }
}
