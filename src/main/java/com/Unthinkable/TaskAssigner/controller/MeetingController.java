package com.Unthinkable.TaskAssigner.controller;

import com.Unthinkable.TaskAssigner.controller.dto.MeetingDtos;
import com.Unthinkable.TaskAssigner.controller.dto.TaskDtos;
import com.Unthinkable.TaskAssigner.model.Meeting;
import com.Unthinkable.TaskAssigner.repository.MeetingRepository;
import com.Unthinkable.TaskAssigner.repository.TranscriptRepository;
import com.Unthinkable.TaskAssigner.service.MeetingProcessingService;
import com.Unthinkable.TaskAssigner.service.TaskAssignmentService;
import com.Unthinkable.TaskAssigner.service.queue.TranscriptJobPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/meetings")
@RequiredArgsConstructor
public class MeetingController {

    private final MeetingRepository meetingRepository;
    private final TranscriptRepository transcriptRepository;
    private final MeetingProcessingService meetingProcessingService;
    private final TaskAssignmentService taskAssignmentService;
    private final TranscriptJobPublisher transcriptJobPublisher;

    @Value("${app.processing.async:false}")
    private boolean asyncProcessing;

    @PostMapping(path = "/transcript", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MeetingDtos.ProcessResponse> submitTranscript(@RequestBody MeetingDtos.TranscriptRequest request) {
        if (asyncProcessing) {
            var result = meetingProcessingService.createTranscriptJob(
                    request.getTitle(), request.getTranscript(), request.getReferenceDate());
            transcriptJobPublisher.publishAsync(result.meetingId());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(result));
        }
        var result = meetingProcessingService.processTranscript(
                request.getTitle(), request.getTranscript(), request.getReferenceDate());
        return ResponseEntity.ok(toResponse(result));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MeetingDtos.ProcessResponse> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "referenceDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDate
    ) throws Exception {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        var result = meetingProcessingService.processUpload(title, file, referenceDate);
        return ResponseEntity.ok(toResponse(result));
    }

    @PostMapping("/mock")
    public ResponseEntity<MeetingDtos.ProcessResponse> mock() throws Exception {
        return ResponseEntity.ok(toResponse(meetingProcessingService.processMock()));
    }

    @GetMapping
    public ResponseEntity<List<MeetingDtos.ListItem>> list() {
        List<MeetingDtos.ListItem> items = meetingRepository.findAllByOrderByCreatedAtDesc()
                .stream()
                .map(m -> new MeetingDtos.ListItem(m.getMeetingId(), m.getTitle(), m.getStatus(), m.getTasksCount(), m.getCreatedAt()))
                .toList();
        return ResponseEntity.ok(items);
    }

    @GetMapping("/{id}")
    public ResponseEntity<MeetingDtos.Detail> detail(@PathVariable("id") Integer id) {
        Meeting meeting = meetingRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Meeting not found: " + id));
        return ResponseEntity.ok(toDetail(meeting));
    }

    @GetMapping("/{id}/tasks")
    public ResponseEntity<List<TaskDtos.TaskView>> tasks(@PathVariable("id") Integer id) {
        if (!meetingRepository.existsById(id)) {
            throw new NoSuchElementException("Meeting not found: " + id);
        }
        return ResponseEntity.ok(taskViews(id));
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<MeetingDtos.Detail> reprocess(@PathVariable("id") Integer id) throws Exception {
        if (!meetingRepository.existsById(id)) {
            throw new NoSuchElementException("Meeting not found: " + id);
        }
        if (asyncProcessing) {
            transcriptJobPublisher.publishAsync(id);
        } else {
            meetingProcessingService.reprocessMeeting(id);
        }
        var meeting = meetingRepository.findById(id).orElseThrow();
        return ResponseEntity.ok(toDetail(meeting));
    }

    private MeetingDtos.Detail toDetail(Meeting meeting) {
        var transcript = transcriptRepository.findByMeetingId(meeting.getMeetingId()).orElse(null);
        return new MeetingDtos.Detail(
                meeting.getMeetingId(),
                meeting.getTitle(),
                meeting.getStatus(),
                meeting.getReferenceDate(),
                meeting.getCreatedAt(),
                meeting.getProcessedAt(),
                transcript != null ? transcript.getTranscriptText() : null,
                meeting.getSummaryText(),
                meeting.getFailureReason(),
                taskViews(meeting.getMeetingId())
        );
    }

    private List<TaskDtos.TaskView> taskViews(Integer meetingId) {
        return taskAssignmentService.tasksOf(meetingId).stream()
                .map(t -> TaskDtos.TaskView.of(t, taskAssignmentService.currentAssignment(t.getTaskId()).orElse(null)))
                .toList();
    }

    private static MeetingDtos.ProcessResponse toResponse(MeetingProcessingService.ProcessResult result) {
        var summary = result.summary();
        return new MeetingDtos.ProcessResponse(
                result.meetingId(),
                result.status(),
                summary != null ? summary.totalTasks() : null,
                summary != null ? summary.render() : null);
    }
}
