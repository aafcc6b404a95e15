package com.Unthinkable.TaskAssigner.service.queue;

import com.Unthinkable.TaskAssigner.service.MeetingProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Consumes queued transcript jobs. Only started when asynchronous processing is enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TranscriptJobWorker {

    private final MeetingProcessingService meetingProcessingService;

    @RabbitListener(queues = "${app.rabbitmq.queue}")
    public void onJob(TranscriptJobMessage job) {
        if (job == null || job.getMeetingId() == null) {
            log.warn("Dropping transcript job without a meeting id: {}", job);
            return;
        }
        long waited = System.currentTimeMillis() - job.getEnqueuedAtMillis();
        log.info("Picked up meeting {} after {} ms in queue", job.getMeetingId(), waited);
        try {
            var result = meetingProcessingService.reprocessMeeting(job.getMeetingId());
            log.info("Meeting {} produced {} task(s)", job.getMeetingId(), result.summary().totalTasks());
        } catch (Exception e) {
            // already marked FAILED by the service; a redelivery would fail the same way
            log.error("Meeting {} failed: {}", job.getMeetingId(), e.toString(), e);
        }
    }
}
