package com.Unthinkable.TaskAssigner.repository;

import com.Unthinkable.TaskAssigner.model.TeamMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TeamMemberRepository extends JpaRepository<TeamMember, String> {
    List<TeamMember> findAllByOrderByRosterPositionAsc();

    Optional<TeamMember> findByNameIgnoreCase(String name);

    @Query("select coalesce(max(m.rosterPosition), -1) from TeamMember m")
    int findMaxRosterPosition();

    // additive so concurrent runs never overwrite each other's increments; never below zero
    @Modifying
    @Query("update TeamMember m set m.workload = case when m.workload + :delta < 0 then 0.0 "
            + "else m.workload + :delta end where m.memberId = :id")
    int incrementWorkload(@Param("id") String memberId, @Param("delta") double delta);
}
