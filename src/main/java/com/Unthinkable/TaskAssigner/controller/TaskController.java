package com.Unthinkable.TaskAssigner.controller;

import com.Unthinkable.TaskAssigner.controller.dto.TaskDtos;
import com.Unthinkable.TaskAssigner.service.TaskAssignmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskAssignmentService taskAssignmentService;

    @PostMapping("/{id}/reassign")
    public ResponseEntity<TaskDtos.AssignmentView> reassign(@PathVariable("id") Integer id,
                                                            @RequestBody TaskDtos.ReassignRequest request) {
        if (request.getMemberId() == null || request.getMemberId().isBlank()) {
            throw new IllegalArgumentException("memberId is required");
        }
        var saved = taskAssignmentService.reassign(id, request.getMemberId(), request.getReason());
        return ResponseEntity.ok(TaskDtos.AssignmentView.of(saved));
    }

    @GetMapping("/{id}/assignments")
    public ResponseEntity<List<TaskDtos.AssignmentView>> history(@PathVariable("id") Integer id) {
        return ResponseEntity.ok(taskAssignmentService.history(id).stream()
                .map(TaskDtos.AssignmentView::of)
                .toList());
    }
}
