package com.al.clinicalsummary.listener;

import com.al.clinicalsummary.config.RabbitMQConfig;
import com.al.clinicalsummary.dto.ExtractionReport;
import com.al.clinicalsummary.dto.ExtractionRequest;
import com.al.clinicalsummary.exception.DuplicateProcessingException;
import com.al.clinicalsummary.service.SummaryExtractionHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * Consumes queued extraction requests. Per-document extraction and persistence failures are part
 * of the report and are not retried; only unexpected errors go through the retry queues and end
 * in the dead-letter queue after the last attempt.
 */
@Component
public class ClinicalNoteListener {

    public static final String RETRY_HEADER = "x-retry-count";
    static final String SOURCE = "queue";

    private static final Logger log = LoggerFactory.getLogger(ClinicalNoteListener.class);

    private final SummaryExtractionHandler handler;
    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;

    @Value("${app.rabbitmq.exchange}")
    private String exchange;

    @Value("${app.rabbitmq.max-retries:3}")
    private int maxRetries;

    public ClinicalNoteListener(SummaryExtractionHandler handler, RabbitTemplate rabbitTemplate,
            ObjectMapper objectMapper) {
        this.handler = handler;
        this.rabbitTemplate = rabbitTemplate;
        this.objectMapper = objectMapper;
    }

    @RabbitListener(queues = "${app.rabbitmq.queue}")
    public void receiveMessage(String payload,
            @Header(value = RETRY_HEADER, required = false) Integer retryCount) {
        int attempt = retryCount == null ? 0 : retryCount;

        ExtractionRequest request;
        try {
            request = objectMapper.readValue(payload, ExtractionRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unparseable extraction request: {}", e.getOriginalMessage());
            throw new AmqpRejectAndDontRequeueException("Unparseable extraction request", e);
        }
        if (request.getPatientId() == null || request.getPatientId().isBlank() || request.getText() == null) {
            log.error("Discarding extraction request without patient id or text");
            throw new AmqpRejectAndDontRequeueException("Extraction request missing patient id or text");
        }

        try {
            ExtractionReport report = handler.process(request.toDocument(SOURCE));
            log.info("Queued note for hospitalization {} finished with status {}", report.getHospitalizationId(),
                    report.getStatus());
        } catch (DuplicateProcessingException e) {
            log.warn("Dropping queued note: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing queued note (attempt {}): {}", attempt + 1, e.getMessage(), e);
            if (attempt >= maxRetries) {
                throw new AmqpRejectAndDontRequeueException("Processing failed after " + maxRetries + " retries", e);
            }
            int next = attempt + 1;
            rabbitTemplate.convertAndSend(exchange, RabbitMQConfig.RETRY_ROUTING_PREFIX + next, payload, message -> {
                message.getMessageProperties().setHeader(RETRY_HEADER, next);
                return message;
            });
        }
    }
}
