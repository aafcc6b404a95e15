package com.Unthinkable.TaskAssigner.repository;

import com.Unthinkable.TaskAssigner.model.ExtractedTask;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExtractedTaskRepository extends JpaRepository<ExtractedTask, Integer> {
    List<ExtractedTask> findByMeetingIdOrderByPositionAsc(Integer meetingId);

    void deleteByMeetingId(Integer meetingId);
}
