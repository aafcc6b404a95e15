package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.EngineSettings.ScoringMode;
import com.Unthinkable.TaskAssigner.engine.model.AssignedTask;
import com.Unthinkable.TaskAssigner.engine.model.AssignmentDecision;
import com.Unthinkable.TaskAssigner.engine.model.AssignmentDecision.Method;
import com.Unthinkable.TaskAssigner.engine.model.CandidateTask;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.engine.model.ScoreBreakdown;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks one assignee per task. The first applicable rule wins:
 * <ol>
 *   <li>a mentioned name that resolves to a roster member;</li>
 *   <li>the strictly highest {@link SkillScorer} score, first-seen on exact ties;</li>
 *   <li>in category mode, when the best score is not positive, the member with the lowest
 *   current workload.</li>
 * </ol>
 */
@Slf4j
@Component
public class AssignmentSelector {

    private final EngineSettings settings;
    private final MentionResolver mentionResolver;
    private final SkillScorer skillScorer;

    public AssignmentSelector(EngineSettings settings, MentionResolver mentionResolver, SkillScorer skillScorer) {
        this.settings = settings;
        this.mentionResolver = mentionResolver;
        this.skillScorer = skillScorer;
    }

    /**
     * Decides without touching any workload.
     */
    public AssignedTask select(CandidateTask candidate, List<Person> roster) {
        if (roster == null || roster.isEmpty()) {
            return new AssignedTask(candidate, null, null, "No team members available", AssignmentDecision.unassigned());
        }

        Optional<MentionResolver.Match> mention = mentionResolver.resolve(candidate.mentionedNames(), roster);
        if (mention.isPresent()) {
            Person p = mention.get().person();
            String name = mention.get().matchedName();
            return new AssignedTask(candidate, p.id(), p.name(),
                    "Explicitly mentioned in discussion: '" + name + "'", AssignmentDecision.mention(name));
        }

        Map<String, Double> memberScores = new LinkedHashMap<>();
        Person best = null;
        ScoreBreakdown bestScore = null;
        for (Person p : roster) {
            ScoreBreakdown s = skillScorer.score(p, candidate.description(), candidate.priority(), candidate.deadline());
            memberScores.put(p.id(), s.total());
            if (bestScore == null || s.total() > bestScore.total()) {
                best = p;
                bestScore = s;
            }
        }

        if (settings.scoringMode() == ScoringMode.CATEGORY_DISCRETE && bestScore.total() <= 0) {
            Person lightest = lowestWorkload(roster);
            String reasoning = String.format(Locale.ROOT, "Assigned based on lowest current workload (workload: %s)",
                    formatWorkload(lightest.workload()));
            AssignmentDecision decision = new AssignmentDecision(Method.LOWEST_WORKLOAD,
                    memberScores.get(lightest.id()), List.of(), null, memberScores);
            return new AssignedTask(candidate, lightest.id(), lightest.name(), reasoning, decision);
        }

        String matched = bestScore.matchedTerms().isEmpty() ? "none" : String.join(", ", bestScore.matchedTerms());
        String reasoning = String.format(Locale.ROOT, "Best skill match: %s (score: %.2f)", matched, bestScore.total());
        AssignmentDecision decision = new AssignmentDecision(Method.SKILL_SCORING, bestScore.total(),
                bestScore.matchedTerms(), null, memberScores);
        return new AssignedTask(candidate, best.id(), best.name(), reasoning, decision);
    }

    /**
     * Decides against the ledger's current workloads and records the assignment, so the next
     * task in the same run sees the updated load.
     */
    public AssignedTask assign(CandidateTask candidate, WorkloadLedger ledger) {
        AssignedTask assigned = select(candidate, ledger.current());
        if (assigned.isAssigned()) {
            ledger.recordAssignment(assigned.assigneeId());
            log.debug("Segment {} -> {} ({})", candidate.sourceSegmentIndex(), assigned.assigneeName(),
                    assigned.decision().method());
        }
        return assigned;
    }

    private static Person lowestWorkload(List<Person> roster) {
        Person lightest = roster.get(0);
        for (Person p : roster) {
            if (p.workload() < lightest.workload()) {
                lightest = p;
            }
        }
        return lightest;
    }

    private static String formatWorkload(double workload) {
        return workload == Math.rint(workload)
                ? String.valueOf((long) workload)
                : String.format(Locale.ROOT, "%.2f", workload);
    }
}
