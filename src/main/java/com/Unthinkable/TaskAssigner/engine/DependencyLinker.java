package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.model.AssignedTask;
import com.Unthinkable.TaskAssigner.engine.model.FinalTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links a task to the task immediately before it when its description contains a dependency
 * cue. Only position {@code i-1} is ever linked; no attempt is made to find the actual referent.
 * Cues match anywhere in the text, so "whenever" carries "when".
 */
@Component
public class DependencyLinker {

    private static final Pattern DEPENDENCY_CUES = Pattern.compile(
            "(after|once|when|depends on|requires|needs|first|before)", Pattern.CASE_INSENSITIVE);

    public List<FinalTask> link(List<AssignedTask> tasksInOrder) {
        List<FinalTask> linked = new ArrayList<>(tasksInOrder.size());
        for (int i = 0; i < tasksInOrder.size(); i++) {
            AssignedTask task = tasksInOrder.get(i);
            SortedSet<Integer> deps = new TreeSet<>();
            if (i > 0 && findCue(task.candidate().description()).isPresent()) {
                deps.add(i - 1);
            }
            linked.add(new FinalTask(i, task, deps));
        }
        return linked;
    }

    public Optional<String> findCue(String description) {
        if (description == null) {
            return Optional.empty();
        }
        Matcher m = DEPENDENCY_CUES.matcher(description);
        return m.find() ? Optional.of(m.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
    }
}
