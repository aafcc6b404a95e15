package com.Unthinkable.TaskAssigner.controller;

import com.Unthinkable.TaskAssigner.controller.dto.TeamDtos;
import com.Unthinkable.TaskAssigner.service.RosterService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/team-members")
@RequiredArgsConstructor
public class TeamMemberController {

    private final RosterService rosterService;

    @GetMapping
    public List<TeamDtos.MemberView> list() {
        return rosterService.list().stream().map(TeamDtos.MemberView::of).toList();
    }

    @PostMapping
    public ResponseEntity<TeamDtos.MemberView> add(@RequestBody TeamDtos.MemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TeamDtos.MemberView.of(rosterService.add(request)));
    }

    @PutMapping
    public List<TeamDtos.MemberView> replace(@RequestBody List<TeamDtos.MemberRequest> requests) {
        return rosterService.replaceAll(requests).stream().map(TeamDtos.MemberView::of).toList();
    }
}
