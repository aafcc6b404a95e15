package com.Unthinkable.TaskAssigner;

import com.Unthinkable.TaskAssigner.controller.dto.TeamDtos;
import com.Unthinkable.TaskAssigner.engine.EmptyRosterException;
import com.Unthinkable.TaskAssigner.engine.model.Priority;
import com.Unthinkable.TaskAssigner.model.ExtractedTask;
import com.Unthinkable.TaskAssigner.model.Meeting;
import com.Unthinkable.TaskAssigner.model.TeamMember;
import com.Unthinkable.TaskAssigner.model.Transcript;
import com.Unthinkable.TaskAssigner.repository.*;
import com.Unthinkable.TaskAssigner.service.MeetingProcessingService;
import com.Unthinkable.TaskAssigner.service.MeetingTxService;
import com.Unthinkable.TaskAssigner.service.RosterService;
import com.Unthinkable.TaskAssigner.service.TaskAssignmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "app.llm.provider=none",
        "app.asr.provider=none",
        "app.processing.async=false",
        "app.storage.base-dir=target/test-uploads"
})
class MeetingProcessingServiceTest {

    static final String TRANSCRIPT = String.join("\n",
            "Good morning team.",
            "Alice, please update the UI by Friday.",
            "Bob has to fix the API urgently.",
            "After the API is done, write tests.",
            "We should clean up the test documentation, whenever possible.",
            "Thanks everyone.");

    static final LocalDate REF = LocalDate.of(2024, 1, 10);

    @Autowired
    MeetingProcessingService service;
    @Autowired
    MeetingTxService meetingTxService;
    @Autowired
    RosterService rosterService;
    @Autowired
    TaskAssignmentService taskAssignmentService;
    @Autowired
    MeetingRepository meetingRepository;
    @Autowired
    TranscriptRepository transcriptRepository;
    @Autowired
    TeamMemberRepository teamMemberRepository;

    @BeforeEach
    void resetData() {
        meetingTxService.resetAll();
    }

    static List<TeamDtos.MemberRequest> team() {
        return List.of(
                new TeamDtos.MemberRequest("a1", "Alice", "Frontend Developer", List.of("ui", "frontend"), 0.0),
                new TeamDtos.MemberRequest("b1", "Bob", "Backend Developer", List.of("api", "backend"), 0.0),
                new TeamDtos.MemberRequest("c1", "Carol", "QA Engineer", List.of("testing"), null));
    }

    private Map<String, Double> workloads() {
        return teamMemberRepository.findAll().stream()
                .collect(Collectors.toMap(TeamMember::getName, TeamMember::getWorkload));
    }

    @Test
    void processTranscript_persistsTasksAssignmentsAndWorkload() {
        rosterService.replaceAll(team());

        var result = service.processTranscript("Sprint sync", TRANSCRIPT, REF);

        Meeting meeting = meetingRepository.findById(result.meetingId()).orElseThrow();
        assertEquals(Meeting.MeetingStatus.COMPLETED, meeting.getStatus());
        assertEquals(4, meeting.getTasksCount());
        assertTrue(meeting.getSummaryText().contains("Total Tasks Identified: 4"));
        Transcript transcript = transcriptRepository.findByMeetingId(meeting.getMeetingId()).orElseThrow();
        assertEquals(Transcript.Source.TEXT, transcript.getSource());
        assertEquals(6, transcript.getSegmentCount());

        List<ExtractedTask> tasks = taskAssignmentService.tasksOf(meeting.getMeetingId());
        assertEquals(List.of(Priority.HIGH, Priority.CRITICAL, Priority.MEDIUM, Priority.LOW),
                tasks.stream().map(ExtractedTask::getPriority).toList());
        assertEquals(LocalDate.of(2024, 1, 12), tasks.get(0).getDeadline());
        assertEquals(List.of(1), tasks.get(2).getDependencies());

        var first = taskAssignmentService.currentAssignment(tasks.get(0).getTaskId()).orElseThrow();
        assertEquals("Alice", first.getMemberName());
        assertEquals("EXPLICIT_MENTION", first.getMethod());
        assertNotNull(first.getFinalDecision());

        assertEquals(Map.of("Alice", 1.0, "Bob", 2.0, "Carol", 1.0), workloads());
    }

    @Test
    void reprocess_replacesTasksWithoutDoubleCountingWorkload() throws Exception {
        rosterService.replaceAll(team());
        var result = service.processTranscript("Sprint sync", TRANSCRIPT, REF);

        service.reprocessMeeting(result.meetingId());

        assertEquals(4, taskAssignmentService.tasksOf(result.meetingId()).size());
        assertEquals(Map.of("Alice", 1.0, "Bob", 2.0, "Carol", 1.0), workloads());
    }

    @Test
    void reprocess_afterRosterReplacementKeepsWorkloadsNonNegative() throws Exception {
        rosterService.replaceAll(team());
        var result = service.processTranscript("Sprint sync", TRANSCRIPT, REF);
        rosterService.replaceAll(team());

        service.reprocessMeeting(result.meetingId());

        assertEquals(Map.of("Alice", 1.0, "Bob", 2.0, "Carol", 1.0), workloads());
        var next = service.processTranscript("Follow-up", "Fix the login.", REF);
        assertEquals(Meeting.MeetingStatus.COMPLETED, next.status());
    }

    @Test
    void emptyRoster_failsBeforeCreatingMeeting() {
        assertThrows(EmptyRosterException.class, () -> service.processTranscript("x", TRANSCRIPT, REF));
        assertTrue(meetingRepository.findAll().isEmpty());
    }

    @Test
    void blankTranscript_isRejected() {
        rosterService.replaceAll(team());
        assertThrows(IllegalArgumentException.class, () -> service.processTranscript("x", "  ", REF));
    }

    @Test
    void upload_failureMarksMeetingFailedAndRemovesFile() throws Exception {
        rosterService.replaceAll(team());
        MockMultipartFile file = new MockMultipartFile("file", "meeting.wav", "audio/wav", new byte[]{0, 1, 2, 3});

        // speech-to-text is disabled in this context
        assertThrows(IllegalStateException.class, () -> service.processUpload("Recorded", file, REF));

        Meeting meeting = meetingRepository.findAll().get(0);
        assertEquals(Meeting.MeetingStatus.FAILED, meeting.getStatus());
        assertNotNull(meeting.getFailureReason());
        try (Stream<Path> files = Files.list(Path.of("target/test-uploads"))) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void upload_rejectsUnsupportedFormats() {
        rosterService.replaceAll(team());
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());

        assertThrows(IllegalArgumentException.class, () -> service.processUpload("Notes", file, REF));
        assertTrue(meetingRepository.findAll().isEmpty());
    }

    @Test
    void mock_runsTheDemoMeeting() throws Exception {
        rosterService.replaceAll(team());

        var result = service.processMock();

        assertEquals(Meeting.MeetingStatus.COMPLETED, result.status());
        assertTrue(result.summary().totalTasks() > 0);
    }

    @Test
    void reassign_keepsHistoryAndLeavesWorkloadAlone() {
        rosterService.replaceAll(team());
        var result = service.processTranscript("Sprint sync", TRANSCRIPT, REF);
        ExtractedTask task = taskAssignmentService.tasksOf(result.meetingId()).get(0);

        taskAssignmentService.reassign(task.getTaskId(), "c1", "Alice is on leave");

        var current = taskAssignmentService.currentAssignment(task.getTaskId()).orElseThrow();
        assertEquals("Carol", current.getMemberName());
        assertEquals("Manually reassigned: Alice is on leave", current.getReason());
        assertEquals(2, taskAssignmentService.history(task.getTaskId()).size());
        assertEquals(Map.of("Alice", 1.0, "Bob", 2.0, "Carol", 1.0), workloads());

        assertThrows(NoSuchElementException.class, () -> taskAssignmentService.reassign(task.getTaskId(), "nobody", null));
    }

    @Test
    void roster_rejectsDuplicateNames() {
        rosterService.replaceAll(team());
        var dup = new TeamDtos.MemberRequest(null, "alice", "Designer", List.of(), 0.0);
        assertThrows(IllegalArgumentException.class, () -> rosterService.add(dup));
    }
}
