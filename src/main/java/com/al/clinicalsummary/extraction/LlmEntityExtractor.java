package com.al.clinicalsummary.extraction;

import com.al.clinicalsummary.exception.ExtractionException;
import com.al.clinicalsummary.model.EntityKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts one entity kind by asking the LLM for JSON and binding it to the kind's payload type.
 * Unparseable or constraint-violating answers are extraction failures.
 */
@Slf4j
public class LlmEntityExtractor<T> implements EntityExtractor<T> {

    private static final int MAX_LOGGED_RESPONSE = 200;

    private final EntityKind kind;
    private final Class<T> payloadType;
    private final EntityExtractionAssistant assistant;
    private final ExtractionPrompt prompt;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public LlmEntityExtractor(EntityKind kind,
            Class<T> payloadType,
            EntityExtractionAssistant assistant,
            ExtractionPrompt prompt,
            ObjectMapper objectMapper,
            Validator validator) {
        if (!kind.getPayloadType().equals(payloadType)) {
            throw new IllegalArgumentException("Payload type " + payloadType.getSimpleName()
                    + " does not match entity kind " + kind.getWireName());
        }
        this.kind = kind;
        this.payloadType = payloadType;
        this.assistant = assistant;
        this.prompt = prompt;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @Override
    public EntityKind getKind() {
        return kind;
    }

    @Override
    public T extract(String documentText) throws ExtractionException {
        String response;
        try {
            response = assistant.extract(prompt.getSystem(), prompt.getInstructions(),
                    documentText == null ? "" : documentText);
        } catch (RuntimeException e) {
            log.error("LLM call failed for {}: {}", kind.getWireName(), e.getMessage());
            throw new ExtractionException(kind, kind.getWireName() + " extraction failed: " + e.getMessage(), e);
        }

        T payload = parse(response);
        validate(payload);
        return payload;
    }

    T parse(String response) throws ExtractionException {
        String json = extractJson(response);
        if (json.isEmpty()) {
            throw new ExtractionException(kind, kind.getWireName() + " extraction returned an empty response");
        }
        try {
            T payload = objectMapper.readValue(json, payloadType);
            if (payload == null) {
                throw new ExtractionException(kind, kind.getWireName() + " extraction returned null");
            }
            return payload;
        } catch (JsonProcessingException e) {
            log.warn("Unparseable {} response: {}", kind.getWireName(), truncate(json));
            throw new ExtractionException(kind,
                    kind.getWireName() + " extraction returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private void validate(T payload) throws ExtractionException {
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ExtractionException(kind, kind.getWireName() + " payload is invalid: " + details);
        }
    }

    /**
     * Strip markdown fences and any prose around the outermost JSON object.
     */
    static String extractJson(String response) {
        if (response == null) {
            return "";
        }
        String text = response.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int closingFence = text.lastIndexOf("```");
            if (closingFence >= 0) {
                text = text.substring(0, closingFence);
            }
            text = text.trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            text = text.substring(start, end + 1);
        }
        return text;
    }

    private static String truncate(String str) {
        if (str.length() <= MAX_LOGGED_RESPONSE) {
            return str;
        }
        return str.substring(0, MAX_LOGGED_RESPONSE) + "...";
    }
}
