package com.Unthinkable.TaskAssigner.repository;

import com.Unthinkable.TaskAssigner.model.TaskAssignment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TaskAssignmentRepository extends JpaRepository<TaskAssignment, Integer> {
    Optional<TaskAssignment> findFirstByTaskIdOrderByAssignmentIdDesc(Integer taskId);

    List<TaskAssignment> findByTaskIdOrderByAssignmentIdAsc(Integer taskId);

    void deleteByTaskIdIn(Collection<Integer> taskIds);
}
