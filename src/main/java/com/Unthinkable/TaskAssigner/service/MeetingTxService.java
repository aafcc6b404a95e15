package com.Unthinkable.TaskAssigner.service;

import com.Unthinkable.TaskAssigner.engine.model.DecisionRecord;
import com.Unthinkable.TaskAssigner.engine.model.FinalTask;
import com.Unthinkable.TaskAssigner.engine.model.PipelineResult;
import com.Unthinkable.TaskAssigner.engine.model.Segment;
import com.Unthinkable.TaskAssigner.model.ExtractedTask;
import com.Unthinkable.TaskAssigner.model.Meeting;
import com.Unthinkable.TaskAssigner.model.TaskAssignment;
import com.Unthinkable.TaskAssigner.model.Transcript;
import com.Unthinkable.TaskAssigner.repository.ExtractedTaskRepository;
import com.Unthinkable.TaskAssigner.repository.MeetingRepository;
import com.Unthinkable.TaskAssigner.repository.TaskAssignmentRepository;
import com.Unthinkable.TaskAssigner.repository.TeamMemberRepository;
import com.Unthinkable.TaskAssigner.repository.TranscriptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Short transactions around a processing run. Nothing here calls external services, so no
 * database connection is held while audio is transcribed or a model is consulted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingTxService {

    public static final String MANUAL_METHOD = "MANUAL";

    private final MeetingRepository meetingRepository;
    private final TranscriptRepository transcriptRepository;
    private final ExtractedTaskRepository extractedTaskRepository;
    private final TaskAssignmentRepository taskAssignmentRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final RosterService rosterService;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Meeting createProcessingMeeting(String title, LocalDate referenceDate) {
        Meeting meeting = new Meeting();
        meeting.setTitle(title == null || title.isBlank() ? "Meeting" : title.trim());
        meeting.setReferenceDate(referenceDate);
        meeting.setStatus(Meeting.MeetingStatus.PROCESSING);
        return meetingRepository.save(meeting);
    }

    @Transactional
    public void saveTranscript(Integer meetingId, String text, Transcript.Source source) {
        Transcript transcript = transcriptRepository.findByMeetingId(meetingId).orElseGet(Transcript::new);
        transcript.setMeetingId(meetingId);
        transcript.setTranscriptText(text);
        transcript.setSource(source);
        transcriptRepository.save(transcript);
    }

    @Transactional
    public void setAudioPath(Integer meetingId, String path) {
        Meeting meeting = meetingRepository.findById(meetingId).orElseThrow();
        meeting.setAudioFilePath(path);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(Integer meetingId, String reason) {
        Meeting m = meetingRepository.findById(meetingId).orElse(null);
        if (m != null) {
            m.setStatus(Meeting.MeetingStatus.FAILED);
            m.setFailureReason(reason == null ? null : reason.substring(0, Math.min(reason.length(), 1024)));
            m.setProcessedAt(LocalDateTime.now());
            meetingRepository.save(m);
        }
    }

    /**
     * Drops the tasks of the previous run and takes back the workload it added, so the next run
     * starts from the roster as it was before this meeting.
     */
    @Transactional
    public Meeting resetForReprocess(Integer meetingId) {
        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() -> new NoSuchElementException("Meeting not found: " + meetingId));
        Map<String, Integer> previous = readDeltas(meeting.getAppliedWorkloadDeltas());
        if (!previous.isEmpty()) {
            Map<String, Integer> reverted = new LinkedHashMap<>();
            previous.forEach((id, d) -> reverted.put(id, -d));
            rosterService.applyWorkloadDeltas(reverted);
            log.info("Reverted workload of previous run: {}", reverted);
        }
        deleteTasks(meetingId);
        meeting.setAppliedWorkloadDeltas(null);
        meeting.setTasksCount(null);
        meeting.setSummaryText(null);
        meeting.setFailureReason(null);
        meeting.setStatus(Meeting.MeetingStatus.PROCESSING);
        return meetingRepository.save(meeting);
    }

    /**
     * Persists tasks, their assignments and audit records, and the run's workload increments
     * in a single transaction.
     */
    @Transactional
    public void saveResults(Integer meetingId, List<Segment> segments, PipelineResult result) {
        Meeting meeting = meetingRepository.findById(meetingId).orElseThrow();
        transcriptRepository.findByMeetingId(meetingId).ifPresent(t -> t.setSegmentCount(segments.size()));
        Map<Integer, Segment> bySegment = segments.stream()
                .collect(Collectors.toMap(Segment::index, Function.identity()));

        for (int i = 0; i < result.tasks().size(); i++) {
            FinalTask task = result.tasks().get(i);
            DecisionRecord decision = result.decisions().get(i);
            Segment source = bySegment.get(task.assigned().candidate().sourceSegmentIndex());

            ExtractedTask row = new ExtractedTask();
            row.setMeetingId(meetingId);
            row.setPosition(task.position());
            row.setSourceSegmentIndex(task.assigned().candidate().sourceSegmentIndex());
            row.setRawText(source == null ? task.description() : source.text());
            row.setDescription(task.description());
            row.setPriority(task.priority());
            row.setDeadline(task.deadline());
            row.setDependencies(new ArrayList<>(task.dependencies()));
            row.setContextNotes(task.assigned().candidate().context());
            row.setDetectedBy(task.assigned().candidate().detectedBy().name());
            ExtractedTask saved = extractedTaskRepository.save(row);

            TaskAssignment assignment = new TaskAssignment();
            assignment.setTaskId(saved.getTaskId());
            assignment.setMemberId(task.assigned().assigneeId());
            assignment.setMemberName(task.assigneeName());
            assignment.setReason(task.reasoning());
            assignment.setMethod(task.assigned().decision().method().name());
            assignment.setAdvisorySuggestion(task.assigned().candidate().advisory().isEmpty()
                    ? null
                    : toJson(task.assigned().candidate().advisory()));
            assignment.setFinalDecision(toJson(decision));
            taskAssignmentRepository.save(assignment);
        }

        rosterService.applyWorkloadDeltas(result.workloadDeltas());

        meeting.setTasksCount(result.tasks().size());
        meeting.setSummaryText(result.summary().render());
        meeting.setProcessingMillis(result.summary().processingTime().toMillis());
        meeting.setAppliedWorkloadDeltas(toJson(result.workloadDeltas()));
        meeting.setStatus(Meeting.MeetingStatus.COMPLETED);
        meeting.setProcessedAt(LocalDateTime.now());
        meetingRepository.save(meeting);
    }

    /** Records a manual override as the newest assignment of a task. Workloads are left alone. */
    @Transactional
    public TaskAssignment recordManualAssignment(Integer taskId, String memberId, String memberName, String reason) {
        TaskAssignment assignment = new TaskAssignment();
        assignment.setTaskId(taskId);
        assignment.setMemberId(memberId);
        assignment.setMemberName(memberName);
        assignment.setReason(reason);
        assignment.setMethod(MANUAL_METHOD);
        return taskAssignmentRepository.save(assignment);
    }

    @Transactional
    public void resetAll() {
        taskAssignmentRepository.deleteAllInBatch();
        extractedTaskRepository.deleteAllInBatch();
        transcriptRepository.deleteAllInBatch();
        meetingRepository.deleteAllInBatch();
        teamMemberRepository.deleteAllInBatch();
        log.warn("All meetings, tasks and team members deleted");
    }

    private void deleteTasks(Integer meetingId) {
        List<Integer> taskIds = extractedTaskRepository.findByMeetingIdOrderByPositionAsc(meetingId).stream()
                .map(ExtractedTask::getTaskId)
                .toList();
        if (!taskIds.isEmpty()) {
            taskAssignmentRepository.deleteByTaskIdIn(taskIds);
            extractedTaskRepository.deleteByMeetingId(meetingId);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private Map<String, Integer> readDeltas(String json) {
        if (json == null || json.isBlank()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Integer>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt workload deltas on meeting: " + json, e);
        }
    }
}
