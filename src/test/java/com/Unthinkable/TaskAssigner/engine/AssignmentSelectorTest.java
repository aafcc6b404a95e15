package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.EngineSettings.ScoringMode;
import com.Unthinkable.TaskAssigner.engine.EngineSettings.WorkloadMode;
import com.Unthinkable.TaskAssigner.engine.model.AssignedTask;
import com.Unthinkable.TaskAssigner.engine.model.AssignmentDecision.Method;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.engine.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.CLOCK;
import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.candidate;
import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.roster;
import static org.junit.jupiter.api.Assertions.*;

class AssignmentSelectorTest {

    private static AssignmentSelector selector(EngineSettings settings) {
        MentionResolver mentions = new MentionResolver(settings);
        return new AssignmentSelector(settings, mentions, new SkillScorer(settings, new DeadlineExtractor(CLOCK)));
    }

    private final AssignmentSelector weighted = selector(EngineSettings.defaults());
    private final AssignmentSelector discrete = selector(EngineSettings.defaults().withScoringMode(ScoringMode.CATEGORY_DISCRETE));

    @Test
    void explicitMentionBeatsSkills() {
        AssignedTask t = weighted.select(candidate("Fix the API", Priority.HIGH, null, List.of("Carol")), roster());

        assertEquals("c1", t.assigneeId());
        assertEquals("Explicitly mentioned in discussion: 'Carol'", t.reasoning());
        assertEquals(Method.EXPLICIT_MENTION, t.decision().method());
        assertNull(t.decision().score());
    }

    @Test
    void unresolvableMentionFallsBackToScoring() {
        AssignedTask t = weighted.select(candidate("Fix the API", Priority.MEDIUM, null, List.of("Mallory")), roster());

        assertEquals("b1", t.assigneeId());
        assertEquals(Method.SKILL_SCORING, t.decision().method());
        assertTrue(t.reasoning().startsWith("Best skill match: api (score: "), t.reasoning());
        assertEquals(3, t.decision().memberScores().size());
    }

    @Test
    void exactTieGoesToFirstInRosterOrder() {
        List<Person> twins = List.of(
                new Person("p1", "Pat", "Dev", List.of("go"), 0),
                new Person("p2", "Sam", "Dev", List.of("go"), 0));
        AssignedTask t = weighted.select(candidate("Nothing relevant here", Priority.MEDIUM, null, List.of()), twins);

        assertEquals("p1", t.assigneeId());
        assertEquals("Best skill match: none (score: 0.15)", t.reasoning());
    }

    @Test
    void lowerWorkloadWinsWhenSkillsAreEqual() {
        List<Person> team = List.of(
                new Person("p1", "Pat", "Dev", List.of("api"), 5),
                new Person("p2", "Sam", "Dev", List.of("api"), 1));
        assertEquals("p2", weighted.select(candidate("Build the api", Priority.MEDIUM, null, List.of()), team).assigneeId());
    }

    @Test
    void discreteModeScoresByCategory() {
        List<Person> team = List.of(
                new Person("f", "Fran", "Dev", List.of("frontend"), 0),
                new Person("b", "Ben", "Dev", List.of("backend"), 0));
        AssignedTask t = discrete.select(candidate("The database server keeps crashing", Priority.HIGH, null, List.of()), team);

        assertEquals("b", t.assigneeId());
        assertEquals("Best skill match: backend (score: 2.00)", t.reasoning());
    }

    @Test
    void discreteModeFallsBackToLowestWorkload() {
        List<Person> team = List.of(
                new Person("f", "Fran", "Dev", List.of("frontend"), 3),
                new Person("b", "Ben", "Dev", List.of("backend"), 1),
                new Person("q", "Quinn", "QA", List.of("testing"), 1));
        AssignedTask t = discrete.select(candidate("Book the offsite venue", Priority.LOW, null, List.of()), team);

        assertEquals("b", t.assigneeId());
        assertEquals(Method.LOWEST_WORKLOAD, t.decision().method());
        assertEquals("Assigned based on lowest current workload (workload: 1)", t.reasoning());
    }

    @Test
    void emptyRosterLeavesTaskUnassigned() {
        AssignedTask t = weighted.select(candidate("Fix the API", Priority.MEDIUM, null, List.of()), List.of());
        assertFalse(t.isAssigned());
        assertEquals(Method.UNASSIGNED, t.decision().method());
    }

    @Test
    void assignBumpsLedgerSoNextTaskSeesIt() {
        List<Person> team = List.of(
                new Person("p1", "Pat", "Dev", List.of("api"), 0),
                new Person("p2", "Sam", "Dev", List.of("api"), 0));
        WorkloadLedger ledger = new WorkloadLedger(team, WorkloadMode.INTEGER_COUNT);

        assertEquals("p1", weighted.assign(candidate("api work", Priority.MEDIUM, null, List.of()), ledger).assigneeId());
        assertEquals("p2", weighted.assign(candidate("more api work", Priority.MEDIUM, null, List.of()), ledger).assigneeId());
        assertEquals(1.0, ledger.workloadOf("p1"));
        assertEquals(1.0, ledger.workloadOf("p2"));
    }
}
