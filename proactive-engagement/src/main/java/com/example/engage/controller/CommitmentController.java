package com.example.engage.controller;

import com.example.engage.domain.Commitment;
import com.example.engage.dto.CreateCommitmentRequest;
import com.example.engage.dto.SubmitCommitmentRequest;
import com.example.engage.dto.UpdateDueDateRequest;
import com.example.engage.dto.VerifyCommitmentRequest;
import com.example.engage.service.CommitmentService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/commitments")
@RequiredArgsConstructor
public class CommitmentController {

    private final CommitmentService commitmentService;

    @PostMapping
    public ResponseEntity<Commitment> create(@Valid @RequestBody CreateCommitmentRequest request) {
        Commitment commitment = commitmentService.create(
                request.getUserId(),
                request.getChatId(),
                request.getCharacterId(),
                request.getDescription(),
                request.getType(),
                request.getDueAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(commitment);
    }

    @GetMapping("/active")
    public ResponseEntity<List<Commitment>> active(
            @RequestParam String userId, @RequestParam(required = false) String chatId) {
        return ResponseEntity.ok(commitmentService.findActive(userId, chatId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<Commitment>> history(
            @RequestParam String userId,
            @RequestParam(required = false) String chatId,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(commitmentService.findHistory(userId, chatId, limit));
    }

    @GetMapping("/{commitmentId}")
    public ResponseEntity<Commitment> get(@PathVariable String commitmentId, @RequestParam String userId) {
        return ResponseEntity.ok(commitmentService.findById(commitmentId, userId));
    }

    @PostMapping("/{commitmentId}/submit")
    public ResponseEntity<Commitment> submit(
            @PathVariable String commitmentId, @Valid @RequestBody SubmitCommitmentRequest request) {
        return ResponseEntity.ok(
                commitmentService.submit(commitmentId, request.getUserId(), request.getSubmissionText()));
    }

    @PostMapping("/{commitmentId}/verify")
    public ResponseEntity<Commitment> verify(
            @PathVariable String commitmentId, @Valid @RequestBody VerifyCommitmentRequest request) {
        return ResponseEntity.ok(commitmentService.verify(
                commitmentId, request.getUserId(), request.getDecision(), request.getReasoning()));
    }

    @PatchMapping("/{commitmentId}/due-date")
    public ResponseEntity<Commitment> updateDueDate(
            @PathVariable String commitmentId, @Valid @RequestBody UpdateDueDateRequest request) {
        return ResponseEntity.ok(commitmentService.updateDueAt(commitmentId, request.getUserId(), request.getDueAt()));
    }

    @DeleteMapping("/{commitmentId}")
    public ResponseEntity<Commitment> cancel(@PathVariable String commitmentId, @RequestParam String userId) {
        return ResponseEntity.ok(commitmentService.cancel(commitmentId, userId));
    }
}
