package com.shoplytic.kafka.producer;

import com.shoplytic.kafka.config.KafkaTopics;
import com.shoplytic.kafka.dto.KafkaEvents.AIQueryEvent;
import com.shoplytic.kafka.dto.KafkaEvents.QualityScoreEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes query and quality events, keyed by session. Delivery failures
 * are logged and never reach the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publishQueryEvent(AIQueryEvent event) {
        send(KafkaTopics.AI_EVENTS, event.getSessionId(), event);
    }

    public void publishQualityScores(QualityScoreEvent event) {
        send(KafkaTopics.QUALITY_SCORES, event.getSessionId(), event);
    }

    private void send(String topic, String key, Object event) {
        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to send event to {}: {}", topic, e.getMessage());
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to send event to {}: {}", topic, ex.getMessage());
            } else {
                log.debug("Sent to {} partition {} offset {}",
                        topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });
    }
}
