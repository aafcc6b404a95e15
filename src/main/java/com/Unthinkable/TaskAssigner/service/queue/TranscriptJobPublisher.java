package com.Unthinkable.TaskAssigner.service.queue;

import com.Unthinkable.TaskAssigner.service.MeetingProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TranscriptJobPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final MeetingProcessingService meetingProcessingService;

    // Runs off the request thread; exchange and routing key are the template defaults
    @Async
    public void publishAsync(Integer meetingId) {
        TranscriptJobMessage message = TranscriptJobMessage.of(meetingId);
        try {
            rabbitTemplate.convertAndSend(message);
            log.info("Queued transcript job {}", message);
        } catch (AmqpException e) {
            log.error("Could not enqueue meeting {}: {}", meetingId, e.toString());
            meetingProcessingService.markFailed(meetingId, e);
        }
    }
}
