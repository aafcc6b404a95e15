package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.model.AssignedTask;
import com.Unthinkable.TaskAssigner.engine.model.FinalTask;
import com.Unthinkable.TaskAssigner.engine.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.candidate;
import static org.junit.jupiter.api.Assertions.*;

class DependencyLinkerTest {

    private final DependencyLinker linker = new DependencyLinker();

    private static AssignedTask task(String description) {
        return new AssignedTask(candidate(description, Priority.MEDIUM, null, List.of()), null, null, "", null);
    }

    @Test
    void cueLinksToImmediatePredecessorOnly() {
        List<FinalTask> linked = linker.link(List.of(
                task("Design the schema"),
                task("Build the API"),
                task("Once that is merged, deploy it")));

        assertEquals(Set.of(), linked.get(0).dependencies());
        assertEquals(Set.of(), linked.get(1).dependencies());
        assertEquals(Set.of(1), linked.get(2).dependencies());
    }

    @Test
    void firstTaskNeverHasDependencies() {
        List<FinalTask> linked = linker.link(List.of(task("After lunch, review the PR")));
        assertTrue(linked.get(0).dependencies().isEmpty());
    }

    @Test
    void cuesMatchInsideLongerWords() {
        List<FinalTask> linked = linker.link(List.of(task("Write docs"), task("Refresh the afterglow theme"),
                task("Book the room beforehand"), task("Ship it")));
        assertEquals(Set.of(0), linked.get(1).dependencies());
        assertEquals(Set.of(1), linked.get(2).dependencies());
        assertTrue(linked.get(3).dependencies().isEmpty());
        assertEquals(Optional.of("when"), linker.findCue("Whenever you can"));
    }

    @Test
    void findCueReportsLowercasedWord() {
        assertEquals(Optional.of("depends on"), linker.findCue("Rollout Depends On the migration"));
        assertEquals(Optional.empty(), linker.findCue("Ship it"));
        assertEquals(Optional.empty(), linker.findCue(null));
    }

    @Test
    void positionsFollowInputOrder() {
        List<FinalTask> linked = linker.link(List.of(task("a"), task("b"), task("c")));
        assertEquals(List.of(0, 1, 2), linked.stream().map(FinalTask::position).toList());
    }
}
