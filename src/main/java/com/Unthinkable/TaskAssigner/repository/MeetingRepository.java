package com.Unthinkable.TaskAssigner.repository;

import com.Unthinkable.TaskAssigner.model.Meeting;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MeetingRepository extends JpaRepository<Meeting, Integer> {
    List<Meeting> findAllByOrderByCreatedAtDesc();
}
