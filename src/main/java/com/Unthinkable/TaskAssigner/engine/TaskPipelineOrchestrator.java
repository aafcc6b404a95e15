package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.Unthinkable.TaskAssigner.engine.model.AssignedTask;
import com.Unthinkable.TaskAssigner.engine.model.CandidateTask;
import com.Unthinkable.TaskAssigner.engine.model.CandidateTask.DetectionSource;
import com.Unthinkable.TaskAssigner.engine.model.DecisionRecord;
import com.Unthinkable.TaskAssigner.engine.model.FinalTask;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.engine.model.PipelineInput;
import com.Unthinkable.TaskAssigner.engine.model.PipelineResult;
import com.Unthinkable.TaskAssigner.engine.model.Priority;
import com.Unthinkable.TaskAssigner.engine.model.RunSummary;
import com.Unthinkable.TaskAssigner.engine.model.Segment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs detection, classification, deadline extraction, assignment and dependency linking over
 * an ordered list of segments.
 *
 * <p>Segments are processed strictly one after another: each assignment bumps the assignee's
 * workload in the run's {@link WorkloadLedger} before the next segment is scored. Separate
 * runs share nothing and may execute concurrently.
 */
@Slf4j
@Service
public class TaskPipelineOrchestrator {

    private static final String ELLIPSIS = "...";

    private final EngineSettings settings;
    private final CandidateDetector candidateDetector;
    private final PriorityClassifier priorityClassifier;
    private final DeadlineExtractor deadlineExtractor;
    private final MentionResolver mentionResolver;
    private final AssignmentSelector assignmentSelector;
    private final DependencyLinker dependencyLinker;

    public TaskPipelineOrchestrator(EngineSettings settings,
                                    CandidateDetector candidateDetector,
                                    PriorityClassifier priorityClassifier,
                                    DeadlineExtractor deadlineExtractor,
                                    MentionResolver mentionResolver,
                                    AssignmentSelector assignmentSelector,
                                    DependencyLinker dependencyLinker) {
        this.settings = settings;
        this.candidateDetector = candidateDetector;
        this.priorityClassifier = priorityClassifier;
        this.deadlineExtractor = deadlineExtractor;
        this.mentionResolver = mentionResolver;
        this.assignmentSelector = assignmentSelector;
        this.dependencyLinker = dependencyLinker;
    }

    /**
     * @throws EmptyRosterException when the roster has nobody to assign to
     */
    public PipelineResult run(PipelineInput input) {
        if (input.roster().isEmpty()) {
            throw new EmptyRosterException();
        }
        long started = System.nanoTime();
        List<Segment> segments = input.segments();
        requireUniqueIndexes(segments);

        WorkloadLedger ledger = new WorkloadLedger(input.roster(), settings.workloadMode());
        List<AssignedTask> assigned = new ArrayList<>();
        List<Extraction> extractions = new ArrayList<>();

        for (int pos = 0; pos < segments.size(); pos++) {
            Segment segment = segments.get(pos);
            AdvisorySuggestion advisory = input.advisoryFor(segment.index());
            Optional<DetectionSource> detected = candidateDetector.detect(segment.text(), advisory);
            if (detected.isEmpty()) {
                continue;
            }
            Extraction extraction = extract(segments, pos, advisory, detected.get(), input.referenceDate(), ledger);
            extractions.add(extraction);
            assigned.add(assignmentSelector.assign(extraction.candidate(), ledger));
        }

        List<FinalTask> tasks = dependencyLinker.link(assigned);
        List<DecisionRecord> decisions = new ArrayList<>(tasks.size());
        for (FinalTask task : tasks) {
            Extraction ex = extractions.get(task.position());
            String cue = task.dependencies().isEmpty()
                    ? null
                    : dependencyLinker.findCue(task.description()).orElse(null);
            decisions.add(new DecisionRecord(task.position(), ex.candidate().sourceSegmentIndex(),
                    ex.candidate().detectedBy(), ex.prioritySource(), ex.deadlinePhrase(),
                    task.assigned().decision(), cue, !ex.candidate().advisory().isEmpty()));
        }

        RunSummary summary = RunSummary.of(tasks, Duration.ofNanos(System.nanoTime() - started));
        if (tasks.isEmpty()) {
            log.info("No task candidates in {} segment(s)", segments.size());
        } else {
            log.info("Extracted {} task(s) from {} segment(s); assignments {}", tasks.size(), segments.size(),
                    summary.countsByAssignee());
        }
        return new PipelineResult(tasks, decisions, ledger.current(), ledger.deltas(), summary);
    }

    private Extraction extract(List<Segment> segments, int pos, AdvisorySuggestion advisory,
                               DetectionSource detectedBy, LocalDate referenceDate, WorkloadLedger ledger) {
        Segment segment = segments.get(pos);
        String text = segment.text();

        String description = truncate(advisory.summary().isEmpty() ? text : advisory.summary(),
                settings.descriptionMaxLength());

        boolean hintUsable = priorityClassifier.isAdvisoryHintUsable(advisory.priorityHint());
        Priority priority = priorityClassifier.classify(text, advisory.priorityHint());

        LocalDate deadline = null;
        String deadlinePhrase = null;
        if (!advisory.datePhrases().isEmpty()) {
            String phrase = advisory.datePhrases().get(0);
            deadline = deadlineExtractor.resolve(phrase, referenceDate).orElse(null);
            deadlinePhrase = deadline == null ? null : phrase;
        }
        if (deadline == null) {
            Optional<LocalDate> fromText = deadlineExtractor.extract(text, referenceDate);
            if (fromText.isPresent()) {
                deadline = fromText.get();
                deadlinePhrase = deadlineExtractor.findPhrase(text).orElse(null);
            }
        }

        CandidateTask candidate = new CandidateTask(segment.index(), description, priority, deadline,
                contextWindow(segments, pos), mentionedNames(segment, advisory, ledger), detectedBy, advisory);
        return new Extraction(candidate, hintUsable ? "advisory" : "heuristic", deadlinePhrase);
    }

    // Advisory names first, then the segmentation service's PERSON spans; when none of those is
    // on the roster, fall back to roster names appearing in the text.
    private List<String> mentionedNames(Segment segment, AdvisorySuggestion advisory, WorkloadLedger ledger) {
        Set<String> names = new LinkedHashSet<>(advisory.persons());
        names.addAll(segment.personNames());
        List<Person> roster = ledger.current();
        if (mentionResolver.resolve(new ArrayList<>(names), roster).isEmpty()) {
            mentionResolver.resolveInText(segment.text(), roster)
                    .ifPresent(match -> names.add(match.matchedName()));
        }
        return new ArrayList<>(names);
    }

    private String contextWindow(List<Segment> segments, int pos) {
        int window = settings.contextWindow();
        int from = Math.max(0, pos - window);
        int to = Math.min(segments.size(), pos + window + 1);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(segments.get(i).text());
        }
        String context = sb.toString();
        return context.length() > settings.contextMaxLength()
                ? context.substring(0, settings.contextMaxLength())
                : context;
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static void requireUniqueIndexes(List<Segment> segments) {
        Set<Integer> seen = new HashSet<>();
        for (Segment s : segments) {
            if (!seen.add(s.index())) {
                throw new IllegalArgumentException("Duplicate segment index " + s.index());
            }
        }
    }

    private record Extraction(CandidateTask candidate, String prioritySource, String deadlinePhrase) {}
}
