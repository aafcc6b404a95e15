package com.Unthinkable.TaskAssigner.service;

import com.Unthinkable.TaskAssigner.engine.EmptyRosterException;
import com.Unthinkable.TaskAssigner.engine.TaskPipelineOrchestrator;
import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.engine.model.PipelineInput;
import com.Unthinkable.TaskAssigner.engine.model.PipelineResult;
import com.Unthinkable.TaskAssigner.engine.model.RunSummary;
import com.Unthinkable.TaskAssigner.engine.model.Segment;
import com.Unthinkable.TaskAssigner.logging.MdcContext;
import com.Unthinkable.TaskAssigner.model.Meeting;
import com.Unthinkable.TaskAssigner.model.Transcript.Source;
import com.Unthinkable.TaskAssigner.repository.TranscriptRepository;
import com.Unthinkable.TaskAssigner.service.asr.AsrService;
import com.Unthinkable.TaskAssigner.service.llm.SegmentAdvisor;
import com.Unthinkable.TaskAssigner.service.nlp.TranscriptSegmenter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingProcessingService {

    private final StorageService storageService;
    private final AsrService asrService;
    private final SegmentAdvisor segmentAdvisor;
    private final TranscriptSegmenter transcriptSegmenter;
    private final TaskPipelineOrchestrator orchestrator;
    private final RosterService rosterService;
    private final TranscriptRepository transcriptRepository;
    private final MeetingTxService meetingTxService;
    private final Clock clock;

    @Value("classpath:demo/meeting-transcript.txt")
    private Resource demoTranscript;

    // Not transactional: a failed run must still leave the meeting row behind as FAILED
    public ProcessResult processTranscript(String title, String transcriptText, LocalDate referenceDate) {
        requireTranscript(transcriptText);
        requireRoster();
        Meeting meeting = meetingTxService.createProcessingMeeting(title, referenceDateOrToday(referenceDate));
        MdcContext.setMeeting(meeting.getMeetingId());
        try {
            meetingTxService.saveTranscript(meeting.getMeetingId(), transcriptText, Source.TEXT);
            return run(meeting, transcriptText);
        } catch (RuntimeException ex) {
            markFailed(meeting.getMeetingId(), ex);
            throw ex;
        } finally {
            MdcContext.clear();
        }
    }

    /** Stores the transcript and leaves the run to the queue worker. */
    public ProcessResult createTranscriptJob(String title, String transcriptText, LocalDate referenceDate) {
        requireTranscript(transcriptText);
        requireRoster();
        Meeting meeting = meetingTxService.createProcessingMeeting(title, referenceDateOrToday(referenceDate));
        meetingTxService.saveTranscript(meeting.getMeetingId(), transcriptText, Source.TEXT);
        return new ProcessResult(meeting.getMeetingId(), Meeting.MeetingStatus.PROCESSING, null);
    }

    /**
     * Stores the audio, transcribes it and runs the pipeline. The stored file is removed again
     * when any step fails.
     */
    public ProcessResult processUpload(String title, MultipartFile audioFile, LocalDate referenceDate) throws Exception {
        requireRoster();
        Path saved = storageService.saveAudio(audioFile);
        Meeting meeting;
        try {
            meeting = meetingTxService.createProcessingMeeting(title, referenceDateOrToday(referenceDate));
        } catch (RuntimeException ex) {
            storageService.deleteQuietly(saved);
            throw ex;
        }
        MdcContext.setMeeting(meeting.getMeetingId());
        try {
            meetingTxService.setAudioPath(meeting.getMeetingId(), saved.toString());
            String transcriptText = asrService.transcribe(saved);
            requireTranscript(transcriptText);
            meetingTxService.saveTranscript(meeting.getMeetingId(), transcriptText, Source.AUDIO);
            return run(meeting, transcriptText);
        } catch (Exception ex) {
            storageService.deleteQuietly(saved);
            markFailed(meeting.getMeetingId(), ex);
            throw ex;
        } finally {
            MdcContext.clear();
        }
    }

    /** Runs the bundled sample meeting against the current roster. */
    public ProcessResult processMock() throws IOException {
        String text;
        try (InputStream in = demoTranscript.getInputStream()) {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        requireRoster();
        Meeting meeting = meetingTxService.createProcessingMeeting("Demo meeting", LocalDate.now(clock));
        MdcContext.setMeeting(meeting.getMeetingId());
        try {
            meetingTxService.saveTranscript(meeting.getMeetingId(), text, Source.MOCK);
            return run(meeting, text);
        } catch (RuntimeException ex) {
            markFailed(meeting.getMeetingId(), ex);
            throw ex;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs a meeting again from its stored transcript, transcribing the stored audio first when
     * no transcript exists yet. Workload added by the previous run is taken back beforehand.
     */
    public ProcessResult reprocessMeeting(Integer meetingId) throws Exception {
        MdcContext.setMeeting(meetingId);
        try {
            Meeting meeting = meetingTxService.resetForReprocess(meetingId);
            try {
                String transcriptText = transcriptRepository.findByMeetingId(meetingId)
                        .map(t -> t.getTranscriptText())
                        .orElse(null);
                if (transcriptText == null) {
                    if (meeting.getAudioFilePath() == null || meeting.getAudioFilePath().isBlank()) {
                        throw new IllegalStateException("No transcript or audio stored for meeting " + meetingId);
                    }
                    transcriptText = asrService.transcribe(Path.of(meeting.getAudioFilePath()));
                    requireTranscript(transcriptText);
                    meetingTxService.saveTranscript(meetingId, transcriptText, Source.AUDIO);
                }
                return run(meeting, transcriptText);
            } catch (Exception ex) {
                markFailed(meetingId, ex);
                throw ex;
            }
        } finally {
            MdcContext.clear();
        }
    }

    public void markFailed(Integer meetingId, Exception cause) {
        log.error("Meeting {} failed: {}", meetingId, cause.toString());
        try {
            meetingTxService.markFailed(meetingId, cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark meeting {} as failed", meetingId, e);
        }
    }

    private ProcessResult run(Meeting meeting, String transcriptText) {
        List<Segment> segments = transcriptSegmenter.segment(transcriptText);
        Map<Integer, AdvisorySuggestion> advisory = segmentAdvisor.advise(segments, meeting.getReferenceDate());
        List<Person> roster = rosterService.snapshot();
        PipelineResult result = orchestrator.run(new PipelineInput(segments, meeting.getReferenceDate(), roster, advisory));
        meetingTxService.saveResults(meeting.getMeetingId(), segments, result);
        log.info("Meeting {} completed with {} task(s)", meeting.getMeetingId(), result.tasks().size());
        return new ProcessResult(meeting.getMeetingId(), Meeting.MeetingStatus.COMPLETED, result.summary());
    }

    private void requireRoster() {
        if (rosterService.snapshot().isEmpty()) {
            throw new EmptyRosterException();
        }
    }

    private static void requireTranscript(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Transcript is empty");
        }
    }

    private LocalDate referenceDateOrToday(LocalDate referenceDate) {
        return referenceDate != null ? referenceDate : LocalDate.now(clock);
    }

    /** {@code summary} is null while a queued job has not run yet. */
    public record ProcessResult(Integer meetingId, Meeting.MeetingStatus status, RunSummary summary) {}
}
