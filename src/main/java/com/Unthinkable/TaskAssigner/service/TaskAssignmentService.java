package com.Unthinkable.TaskAssigner.service;

import com.Unthinkable.TaskAssigner.model.ExtractedTask;
import com.Unthinkable.TaskAssigner.model.TaskAssignment;
import com.Unthinkable.TaskAssigner.model.TeamMember;
import com.Unthinkable.TaskAssigner.repository.ExtractedTaskRepository;
import com.Unthinkable.TaskAssigner.repository.TaskAssignmentRepository;
import com.Unthinkable.TaskAssigner.repository.TeamMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskAssignmentService {

    private final ExtractedTaskRepository extractedTaskRepository;
    private final TaskAssignmentRepository taskAssignmentRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final MeetingTxService meetingTxService;

    public List<ExtractedTask> tasksOf(Integer meetingId) {
        return extractedTaskRepository.findByMeetingIdOrderByPositionAsc(meetingId);
    }

    public Optional<TaskAssignment> currentAssignment(Integer taskId) {
        return taskAssignmentRepository.findFirstByTaskIdOrderByAssignmentIdDesc(taskId);
    }

    public List<TaskAssignment> history(Integer taskId) {
        return taskAssignmentRepository.findByTaskIdOrderByAssignmentIdAsc(taskId);
    }

    /**
     * Overrides the engine's choice. Earlier assignments stay as history.
     *
     * @throws NoSuchElementException when the task or member does not exist
     */
    public TaskAssignment reassign(Integer taskId, String memberId, String reason) {
        extractedTaskRepository.findById(taskId)
                .orElseThrow(() -> new NoSuchElementException("Task not found: " + taskId));
        TeamMember member = teamMemberRepository.findById(memberId)
                .orElseThrow(() -> new NoSuchElementException("Team member not found: " + memberId));
        String why = reason == null || reason.isBlank() ? "Manually reassigned" : "Manually reassigned: " + reason.trim();
        TaskAssignment saved = meetingTxService.recordManualAssignment(taskId, member.getMemberId(), member.getName(), why);
        log.info("Task {} reassigned to {}", taskId, member.getName());
        return saved;
    }
}
