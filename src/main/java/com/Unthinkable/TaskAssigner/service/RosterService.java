package com.Unthinkable.TaskAssigner.service;

import com.Unthinkable.TaskAssigner.controller.dto.TeamDtos;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.model.TeamMember;
import com.Unthinkable.TaskAssigner.repository.TeamMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RosterService {

    private final TeamMemberRepository teamMemberRepository;

    public List<TeamMember> list() {
        return teamMemberRepository.findAllByOrderByRosterPositionAsc();
    }

    /** Read-only copy of the roster in roster order, taken at the start of a run. */
    public List<Person> snapshot() {
        return list().stream()
                .map(m -> new Person(m.getMemberId(), m.getName(), m.getRole(), m.getSkills(), m.getWorkload()))
                .toList();
    }

    @Transactional
    public TeamMember add(TeamDtos.MemberRequest request) {
        validate(request);
        if (request.getId() != null && teamMemberRepository.existsById(request.getId())) {
            throw new IllegalArgumentException("Team member id already exists: " + request.getId());
        }
        if (teamMemberRepository.findByNameIgnoreCase(request.getName().trim()).isPresent()) {
            throw new IllegalArgumentException("Team member already exists: " + request.getName());
        }
        TeamMember member = toEntity(request, teamMemberRepository.findMaxRosterPosition() + 1);
        TeamMember saved = teamMemberRepository.save(member);
        log.info("Added team member {} ({})", saved.getName(), saved.getMemberId());
        return saved;
    }

    /** Replaces the whole roster; list order becomes roster order. */
    @Transactional
    public List<TeamMember> replaceAll(List<TeamDtos.MemberRequest> requests) {
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (TeamDtos.MemberRequest r : requests) {
            validate(r);
            if (r.getId() != null && !ids.add(r.getId())) {
                throw new IllegalArgumentException("Duplicate team member id: " + r.getId());
            }
            if (!names.add(r.getName().trim().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate team member name: " + r.getName());
            }
        }
        teamMemberRepository.deleteAllInBatch();
        List<TeamMember> saved = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            saved.add(teamMemberRepository.save(toEntity(requests.get(i), i)));
        }
        log.info("Roster replaced with {} member(s)", saved.size());
        return saved;
    }

    /**
     * Adds each run's increments in one transaction. Unknown ids are logged and skipped since the
     * member may have been removed while the run was in flight.
     */
    @Transactional
    public void applyWorkloadDeltas(Map<String, Integer> deltas) {
        deltas.forEach((id, delta) -> {
            if (delta == 0) return;
            int updated = teamMemberRepository.incrementWorkload(id, delta);
            if (updated == 0) {
                log.warn("Workload update skipped; team member {} no longer exists", id);
            }
        });
    }

    private static void validate(TeamDtos.MemberRequest r) {
        if (r == null || r.getName() == null || r.getName().isBlank()) {
            throw new IllegalArgumentException("Team member name is required");
        }
        if (r.getRole() == null || r.getRole().isBlank()) {
            throw new IllegalArgumentException("Team member role is required");
        }
        if (r.getWorkload() != null && r.getWorkload() < 0) {
            throw new IllegalArgumentException("Workload must be non-negative");
        }
        if (r.getId() != null && r.getId().isBlank()) {
            r.setId(null);
        }
    }

    private static TeamMember toEntity(TeamDtos.MemberRequest r, int position) {
        TeamMember m = new TeamMember();
        m.setMemberId(r.getId() != null ? r.getId() : UUID.randomUUID().toString());
        m.setName(r.getName().trim());
        m.setRole(r.getRole().trim());
        // same normalization the engine applies
        Person normalized = new Person("tmp", r.getName(), r.getRole(), r.getSkills(), 0);
        m.setSkills(new ArrayList<>(normalized.skills()));
        m.setWorkload(r.getWorkload() == null ? 0 : r.getWorkload());
        m.setRosterPosition(position);
        return m;
    }
}
