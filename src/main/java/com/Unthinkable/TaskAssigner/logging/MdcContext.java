package com.Unthinkable.TaskAssigner.logging;

import org.slf4j.MDC;

/**
 * MDC keys used while a meeting is being processed.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMeeting(Integer meetingId) {
        MDC.put("meetingId", String.valueOf(meetingId));
    }

    public static void clear() {
        MDC.remove("meetingId");
    }
}
