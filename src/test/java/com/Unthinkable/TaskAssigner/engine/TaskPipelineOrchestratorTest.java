package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.EngineSettings.ScoringMode;
import com.Unthinkable.TaskAssigner.engine.EngineSettings.WorkloadMode;
import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.Unthinkable.TaskAssigner.engine.model.AssignmentDecision.Method;
import com.Unthinkable.TaskAssigner.engine.model.CandidateTask.DetectionSource;
import com.Unthinkable.TaskAssigner.engine.model.DecisionRecord;
import com.Unthinkable.TaskAssigner.engine.model.FinalTask;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.engine.model.PipelineInput;
import com.Unthinkable.TaskAssigner.engine.model.PipelineResult;
import com.Unthinkable.TaskAssigner.engine.model.Priority;
import com.Unthinkable.TaskAssigner.engine.model.RunSummary;
import com.Unthinkable.TaskAssigner.engine.model.Segment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.REF;
import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.orchestrator;
import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.roster;
import static org.junit.jupiter.api.Assertions.*;

class TaskPipelineOrchestratorTest {

    private static final List<Segment> MEETING = List.of(
            new Segment(0, "Good morning team."),
            new Segment(1, "Alice, please update the UI by Friday."),
            new Segment(2, "Bob has to fix the API urgently."),
            new Segment(3, "After the API is done, write tests."),
            new Segment(4, "We should clean up the test documentation, whenever possible."),
            new Segment(5, "Thanks everyone."));

    private final TaskPipelineOrchestrator orchestrator = orchestrator(EngineSettings.defaults());

    @Test
    @DisplayName("Full meeting: detection, priorities, deadlines, assignment and dependencies")
    void fullMeeting() {
        PipelineResult result = orchestrator.run(PipelineInput.heuristicOnly(MEETING, REF, roster()));
        List<FinalTask> tasks = result.tasks();

        assertEquals(4, tasks.size());
        assertEquals(List.of(1, 2, 3, 4), tasks.stream().map(t -> t.assigned().candidate().sourceSegmentIndex()).toList());

        FinalTask ui = tasks.get(0);
        assertEquals("Alice", ui.assigneeName());
        assertEquals(Priority.HIGH, ui.priority());
        assertEquals(LocalDate.of(2024, 1, 12), ui.deadline());
        assertEquals("Explicitly mentioned in discussion: 'Alice'", ui.reasoning());

        FinalTask api = tasks.get(1);
        assertEquals("Bob", api.assigneeName());
        assertEquals(Priority.CRITICAL, api.priority());
        assertNull(api.deadline());

        FinalTask testsTask = tasks.get(2);
        assertEquals(Priority.MEDIUM, testsTask.priority());
        assertEquals(Set.of(1), testsTask.dependencies());
        assertEquals("Bob", testsTask.assigneeName());
        assertEquals(Method.SKILL_SCORING, testsTask.assigned().decision().method());

        FinalTask docs = tasks.get(3);
        assertEquals(Priority.LOW, docs.priority());
        assertEquals("Carol", docs.assigneeName());
        // "whenever" carries the "when" cue
        assertEquals(Set.of(2), docs.dependencies());
    }

    @Test
    void workloadDeltasMatchAssignmentCounts() {
        PipelineResult result = orchestrator.run(PipelineInput.heuristicOnly(MEETING, REF, roster()));

        assertEquals(Map.of("a1", 1, "b1", 2, "c1", 1), result.workloadDeltas());
        assertEquals(List.of(1.0, 2.0, 1.0), result.finalRoster().stream().map(Person::workload).toList());
        // the caller's roster is untouched
        assertTrue(roster().stream().allMatch(p -> p.workload() == 0));
    }

    @Test
    void summaryCountsPrioritiesAndAssignees() {
        RunSummary summary = orchestrator.run(PipelineInput.heuristicOnly(MEETING, REF, roster())).summary();

        assertEquals(4, summary.totalTasks());
        assertEquals(Map.of(Priority.CRITICAL, 1, Priority.HIGH, 1, Priority.MEDIUM, 1, Priority.LOW, 1), summary.countsByPriority());
        assertEquals(List.of("Alice", "Bob", "Carol"), List.copyOf(summary.countsByAssignee().keySet()));
        String rendered = summary.render();
        assertTrue(rendered.startsWith("Processing Time: "), rendered);
        assertTrue(rendered.contains("Total Tasks Identified: 4"), rendered);
        assertTrue(rendered.contains("  - Bob: 2 task(s)"), rendered);
    }

    @Test
    void decisionRecordsExplainEachTask() {
        PipelineResult result = orchestrator.run(PipelineInput.heuristicOnly(MEETING, REF, roster()));
        List<DecisionRecord> decisions = result.decisions();

        assertEquals(result.tasks().size(), decisions.size());
        assertEquals("by Friday", decisions.get(0).deadlinePhrase());
        assertEquals("heuristic", decisions.get(0).prioritySource());
        assertEquals("after", decisions.get(2).dependencyCue());
        assertNull(decisions.get(1).dependencyCue());
        assertFalse(decisions.get(0).advisoryConsulted());
    }

    @Test
    void noCandidatesGivesEmptyRun() {
        List<Segment> chat = List.of(new Segment(0, "Hello."), new Segment(1, "Nice weather."));
        PipelineResult result = orchestrator.run(PipelineInput.heuristicOnly(chat, REF, roster()));

        assertTrue(result.tasks().isEmpty());
        assertTrue(result.workloadDeltas().isEmpty());
        assertEquals(RunSummary.NO_TASKS_MESSAGE, result.summary().message());
    }

    @Test
    void emptyRosterIsRejected() {
        EmptyRosterException ex = assertThrows(EmptyRosterException.class,
                () -> orchestrator.run(PipelineInput.heuristicOnly(MEETING, REF, List.of())));
        assertEquals("No team members found. Please add team members first.", ex.getMessage());
    }

    @Test
    void duplicateSegmentIndexesAreRejected() {
        List<Segment> broken = List.of(new Segment(0, "Fix it."), new Segment(0, "Fix it again."));
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.run(PipelineInput.heuristicOnly(broken, REF, roster())));
    }

    @Test
    @DisplayName("Advisory suggestion supplies description, priority, deadline and names")
    void advisoryHintsAreUsed() {
        List<Segment> segments = List.of(new Segment(0, "The mobile layout is broken on small screens."));
        AdvisorySuggestion hint = new AdvisorySuggestion(
                "Fix the mobile layout for small screens",
                List.of("Carol"), List.of("tomorrow"), "Critical", List.of(), "");

        PipelineResult result = orchestrator.run(new PipelineInput(segments, REF, roster(), Map.of(0, hint)));
        FinalTask task = result.tasks().get(0);

        assertEquals(DetectionSource.ADVISORY, task.assigned().candidate().detectedBy());
        assertEquals("Fix the mobile layout for small screens", task.description());
        assertEquals(Priority.CRITICAL, task.priority());
        assertEquals(REF.plusDays(1), task.deadline());
        assertEquals("Carol", task.assigneeName());
        assertEquals("advisory", result.decisions().get(0).prioritySource());
        assertTrue(result.decisions().get(0).advisoryConsulted());
    }

    @Test
    void unparseableAdvisoryDateFallsBackToText() {
        List<Segment> segments = List.of(new Segment(0, "Please send the invoice by Monday."));
        AdvisorySuggestion hint = new AdvisorySuggestion("", List.of(), List.of("at some point"), "", List.of(), "");

        FinalTask task = orchestrator.run(new PipelineInput(segments, REF, roster(), Map.of(0, hint))).tasks().get(0);
        assertEquals(LocalDate.of(2024, 1, 15), task.deadline());
    }

    @Test
    void longDescriptionsAreTruncated() {
        String longText = "Please " + "refactor the legacy module ".repeat(20);
        FinalTask task = orchestrator.run(PipelineInput.heuristicOnly(
                List.of(new Segment(0, longText)), REF, roster())).tasks().get(0);

        assertEquals(300, task.description().length());
        assertTrue(task.description().endsWith("..."));
        assertEquals("ab...", TaskPipelineOrchestrator.truncate("abcdefgh", 5));
        assertEquals("abc", TaskPipelineOrchestrator.truncate("abc", 5));
    }

    @Test
    void contextWindowSpansNeighbours() {
        FinalTask docs = orchestrator.run(PipelineInput.heuristicOnly(MEETING, REF, roster())).tasks().get(3);
        String context = docs.assigned().candidate().context();

        assertTrue(context.startsWith("Bob has to fix the API urgently."), context);
        assertTrue(context.endsWith("Thanks everyone."), context);
    }

    @Test
    void discreteModeUsesWorkloadFallback() {
        TaskPipelineOrchestrator discrete = orchestrator(EngineSettings.defaults().withScoringMode(ScoringMode.CATEGORY_DISCRETE));
        List<Segment> segments = List.of(
                new Segment(0, "Please book the offsite venue."),
                new Segment(1, "Please book the team dinner."));
        PipelineResult result = discrete.run(PipelineInput.heuristicOnly(segments, REF, roster()));

        // the first booking raises Alice's load, so the second goes to the next lightest member
        assertEquals("Alice", result.tasks().get(0).assigneeName());
        assertEquals("Bob", result.tasks().get(1).assigneeName());
        assertEquals(Method.LOWEST_WORKLOAD, result.tasks().get(1).assigned().decision().method());
    }

    @Test
    void normalizedLoadModeLeavesWorkloadsUnchanged() {
        TaskPipelineOrchestrator normalized = orchestrator(EngineSettings.defaults().withWorkloadMode(WorkloadMode.NORMALIZED_LOAD));
        List<Person> team = List.of(
                new Person("p1", "Pat", "Dev", List.of("api"), 0.9),
                new Person("p2", "Sam", "Dev", List.of("api"), 0.2));

        PipelineResult result = normalized.run(PipelineInput.heuristicOnly(
                List.of(new Segment(0, "Please fix the api."), new Segment(1, "Please extend the api.")), REF, team));

        // Sam is less loaded and stays so, since load factors are not bumped per task
        assertEquals(List.of("Sam", "Sam"), result.tasks().stream().map(FinalTask::assigneeName).toList());
        assertTrue(result.workloadDeltas().isEmpty());
        assertEquals(List.of(0.9, 0.2), result.finalRoster().stream().map(Person::workload).toList());
    }

    @Test
    void addresseeInTextWinsWhenDetectedNamesAreNotOnRoster() {
        Segment line = new Segment(0, "Bob, update the Jira board for the frontend.", List.of("Jira"));

        FinalTask task = orchestrator.run(PipelineInput.heuristicOnly(List.of(line), REF, roster())).tasks().get(0);

        assertEquals("Bob", task.assigneeName());
        assertEquals(Method.EXPLICIT_MENTION, task.assigned().decision().method());
        assertEquals("Explicitly mentioned in discussion: 'Bob'", task.reasoning());
    }
}
