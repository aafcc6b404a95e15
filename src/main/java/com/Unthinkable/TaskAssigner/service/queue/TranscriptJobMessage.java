package com.Unthinkable.TaskAssigner.service.queue;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Queue payload. The transcript itself is already stored, so only the meeting travels.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptJobMessage {
    private Integer meetingId;
    private long enqueuedAtMillis;

    public static TranscriptJobMessage of(Integer meetingId) {
        return new TranscriptJobMessage(meetingId, System.currentTimeMillis());
    }
}
