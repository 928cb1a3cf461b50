package com.example.engage.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import com.example.engage.domain.VerificationOutcome;
import com.example.engage.service.CommitmentService;
import com.example.engage.service.exception.ConflictException;
import com.example.engage.service.exception.NotFoundException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class CommitmentControllerTest {

    @Mock
    private CommitmentService commitmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CommitmentController(commitmentService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void createReturns201() throws Exception {
        Instant due = Instant.parse("2030-03-01T12:00:00Z");
        when(commitmentService.create("u1", "chat-1", null, "Run 5k", "fitness", due))
                .thenReturn(Commitment.builder()
                        .id("c-1")
                        .userId("u1")
                        .status(CommitmentStatus.ACTIVE)
                        .dueAt(due)
                        .build());

        mockMvc.perform(post("/api/commitments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"u1","chatId":"chat-1","description":"Run 5k",
                                 "type":"fitness","dueAt":"2030-03-01T12:00:00Z"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("c-1"))
                .andExpect(jsonPath("$.status").value("active"));
    }

    @Test
    void createWithoutDescriptionIs400() throws Exception {
        mockMvc.perform(post("/api/commitments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"chatId\":\"chat-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.description").exists());
        verifyNoInteractions(commitmentService);
    }

    @Test
    void activeListsCommitmentsWithoutChatFilter() throws Exception {
        when(commitmentService.findActive(eq("u1"), isNull())).thenReturn(List.of(
                Commitment.builder().id("c-1").status(CommitmentStatus.NEEDS_REVISION).build()));

        mockMvc.perform(get("/api/commitments/active").param("userId", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("needs_revision"));
    }

    @Test
    void submitInWrongStateIs409() throws Exception {
        when(commitmentService.submit("c-1", "u1", "done"))
                .thenThrow(new ConflictException("Commitment c-1 is completed"));

        mockMvc.perform(post("/api/commitments/c-1/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"submissionText\":\"done\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void verifyParsesLowercaseDecision() throws Exception {
        when(commitmentService.verify(eq("c-1"), eq("u1"), eq(VerificationOutcome.NEEDS_REVISION), any()))
                .thenReturn(Commitment.builder()
                        .id("c-1")
                        .status(CommitmentStatus.NEEDS_REVISION)
                        .revisionCount(1)
                        .build());

        mockMvc.perform(post("/api/commitments/c-1/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"decision\":\"needs_revision\",\"reasoning\":\"more detail\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revisionCount").value(1));
        verify(commitmentService).verify("c-1", "u1", VerificationOutcome.NEEDS_REVISION, "more detail");
    }

    @Test
    void verifyWithUnknownDecisionIs400() throws Exception {
        mockMvc.perform(post("/api/commitments/c-1/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"decision\":\"maybe\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(commitmentService);
    }

    @Test
    void unknownCommitmentIs404() throws Exception {
        when(commitmentService.findById("missing", "u1")).thenThrow(new NotFoundException("Commitment not found"));

        mockMvc.perform(get("/api/commitments/missing").param("userId", "u1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }
}
