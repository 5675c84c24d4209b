package com.yugabyte.monitor.controller;

import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.model.ChatMessage;
import com.yugabyte.monitor.model.ChatRequest;
import com.yugabyte.monitor.model.ChatResponse;
import com.yugabyte.monitor.model.ConversationSummary;
import com.yugabyte.monitor.service.ConversationService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@Slf4j
public class ChatController {

    private final ConversationService conversationService;
    private final MonitorProperties properties;

    public ChatController(ConversationService conversationService, MonitorProperties properties) {
        this.conversationService = conversationService;
        this.properties = properties;
    }

    /**
     * One conversational turn. A request without session id starts a new session.
     */
    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        long start = System.currentTimeMillis();
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : UUID.randomUUID().toString();

        ChatMessage answer = conversationService.processMessage(sessionId, request.getMessage());

        Object parsed = answer.getMetadata().get("parsed_query");
        String queryType = null;
        String intent = null;
        if (parsed instanceof Map) {
            Map<?, ?> parsedQuery = (Map<?, ?>) parsed;
            queryType = parsedQuery.get("query_type") != null ? parsedQuery.get("query_type").toString() : null;
            intent = parsedQuery.get("intent") != null ? parsedQuery.get("intent").toString() : null;
        }
        return ResponseEntity.ok(ChatResponse.builder()
                .message(answer.getContent())
                .sessionId(sessionId)
                .queryType(queryType)
                .intent(intent)
                .timestamp(answer.getTimestamp())
                .processingTimeMs(System.currentTimeMillis() - start)
                .build());
    }

    @GetMapping("/sessions/{sessionId}/history")
    public ResponseEntity<Map<String, Object>> getHistory(@PathVariable String sessionId,
                                                          @RequestParam(required = false) Integer limit) {
        int size = limit != null && limit > 0 ? limit : properties.getSession().getHistoryLimit();
        List<ChatMessage> history = conversationService.getHistory(sessionId, size);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("history", history);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> clearSession(@PathVariable String sessionId) {
        conversationService.clearSession(sessionId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Session cleared successfully");
        body.put("timestamp", Instant.now());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/sessions/{sessionId}/summary")
    public ResponseEntity<ConversationSummary> getSummary(@PathVariable String sessionId) {
        return ResponseEntity.ok(conversationService.getSummary(sessionId));
    }
}
