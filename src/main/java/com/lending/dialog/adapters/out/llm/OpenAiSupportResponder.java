package com.lending.dialog.adapters.out.llm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.application.exception.GatewayFailureException;
import com.lending.dialog.application.port.out.SupportPort;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.valueobject.Language;

/**
 * Answers free-text support questions using OpenAI Chat Completions.
 * <p>
 * Only created when {@code dialog.support.llm.enabled=true}. A blank reply
 * means "no answer" and leads to escalation; transport or parse errors are
 * gateway failures.
 * </p>
 */
@Component
@ConditionalOnProperty(prefix = "dialog.support.llm", name = "enabled", havingValue = "true")
public class OpenAiSupportResponder implements SupportPort {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSupportResponder.class);

    private static final String SYSTEM_PROMPT = ""
            + "You are a customer support assistant for a personal loan product offered over WhatsApp.\n"
            + "- Answer in at most three short sentences.\n"
            + "- Only answer questions about loans, EMIs, repayments, statements, KYC and the application process.\n"
            + "- Never invent account-specific facts such as balances, due dates or approval status.\n"
            + "- If you cannot answer reliably, reply with exactly: UNKNOWN";

    static final String NO_ANSWER_MARKER = "UNKNOWN";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final DialogProperties.Llm llm;

    public OpenAiSupportResponder(RestTemplateBuilder builder, ObjectMapper mapper, DialogProperties properties) {
        this.restTemplate = builder.build();
        this.mapper = mapper;
        this.llm = properties.getSupport().getLlm();
    }

    @Override
    public Optional<String> answer(String question, Language language) {
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.error("action=llm_not_configured reason=missing_api_key");
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(llm.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", SYSTEM_PROMPT + "\n- Reply in " + language.getDisplayName() + "."));
        messages.add(message("user", question));

        Map<String, Object> body = new HashMap<>();
        body.put("model", llm.getModel());
        body.put("temperature", 0.2);
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(llm.getUrl(),
                    new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String reply = root.path("choices").path(0).path("message").path("content").asText("").trim();
            log.info("action=llm_reply language={} chars={}", language, reply.length());
            if (reply.isEmpty() || reply.equalsIgnoreCase(NO_ANSWER_MARKER)) {
                return Optional.empty();
            }
            return Optional.of(reply);
        } catch (RestClientException | JsonProcessingException ex) {
            log.error("action=llm_call_failed error={}", ex.getMessage());
            throw new GatewayFailureException("support", "LLM call failed: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }
}
