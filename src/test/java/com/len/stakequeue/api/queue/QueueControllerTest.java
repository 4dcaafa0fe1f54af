package com.len.stakequeue.api.queue;

import com.len.stakequeue.application.queue.QueueService;
import com.len.stakequeue.common.exception.BusinessException;
import com.len.stakequeue.common.exception.ErrorCode;
import com.len.stakequeue.domain.queue.StakeEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueueController.class)
class QueueControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    QueueService queueService;

    private static final StakeEntry ENTRY = new StakeEntry(7L, "alice", 2, 10, 38, 1_000L);

    @Test
    @DisplayName("enter: 성공하면 201 + 위치")
    void enter_success() throws Exception {
        given(queueService.enter("alice", 2L, 10L, 7L))
                .willReturn(new QueueService.QueueEntryResult(ENTRY, 0));

        String body = """
                {
                  "walletId": "alice",
                  "weight": 2,
                  "priorityValue": 10,
                  "externalId": 7
                }
                """;

        mockMvc.perform(post("/api/queue/enter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.position").value(0))
                .andExpect(jsonPath("$.entry.stakedCoins").value(38));
    }

    @Test
    @DisplayName("enter: externalId 없으면 400, 서비스 호출 안 함")
    void enter_missingField_should400() throws Exception {
        String body = """
                {
                  "walletId": "alice",
                  "weight": 2,
                  "priorityValue": 10
                }
                """;

        mockMvc.perform(post("/api/queue/enter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        verify(queueService, never()).enter(anyString(), anyLong(), anyLong(), anyLong());
    }

    @Test
    @DisplayName("enter: 잔액 부족은 409 INSUFFICIENT_BALANCE")
    void enter_insufficient_should409() throws Exception {
        given(queueService.enter("alice", 2L, 10L, 7L))
                .willThrow(new BusinessException(ErrorCode.INSUFFICIENT_BALANCE));

        String body = """
                {"walletId": "alice", "weight": 2, "priorityValue": 10, "externalId": 7}
                """;

        mockMvc.perform(post("/api/queue/enter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.category").value("BALANCE"));
    }

    @Test
    @DisplayName("changeStake: path 의 externalId 로 호출")
    void changeStake_success() throws Exception {
        given(queueService.changeStake("alice", 3L, 12L, 7L))
                .willReturn(new QueueService.QueueEntryResult(ENTRY, 2));

        mockMvc.perform(put("/api/queue/7/stake")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"walletId": "alice", "weight": 3, "priorityValue": 12}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.externalId").value(7))
                .andExpect(jsonPath("$.position").value(2));
    }

    @Test
    @DisplayName("remove: 대기열에 없으면 404 NOT_IN_QUEUE")
    void remove_notInQueue_should404() throws Exception {
        given(queueService.remove("alice", 99L))
                .willThrow(new BusinessException(ErrorCode.NOT_IN_QUEUE));

        mockMvc.perform(delete("/api/queue/99").param("walletId", "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_IN_QUEUE"));
    }

    @Test
    @DisplayName("dequeue: controller 아니면 403 NOT_AUTHORIZED")
    void dequeue_notAuthorized_should403() throws Exception {
        given(queueService.dequeue("alice"))
                .willThrow(new BusinessException(ErrorCode.NOT_AUTHORIZED));

        mockMvc.perform(post("/api/queue/dequeue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"walletId": "alice"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.category").value("AUTHORIZATION"));
    }

    @Test
    @DisplayName("dequeue: 소비된 항목 반환")
    void dequeue_success() throws Exception {
        given(queueService.dequeue("controller")).willReturn(ENTRY);

        mockMvc.perform(post("/api/queue/dequeue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"walletId": "controller"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.externalId").value(7))
                .andExpect(jsonPath("$.owner").value("alice"));
    }

    @Test
    @DisplayName("position / contents 조회")
    void readEndpoints() throws Exception {
        given(queueService.getPosition(7L)).willReturn(0);
        given(queueService.getContents()).willReturn(List.of(ENTRY));

        mockMvc.perform(get("/api/queue/7/position"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position").value(0));

        mockMvc.perform(get("/api/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].externalId").value(7))
                .andExpect(jsonPath("$[0].priorityValue").value(10));
    }

    @Test
    @DisplayName("예상 못 한 예외는 500 INTERNAL_ERROR")
    void unexpected_should500() throws Exception {
        given(queueService.getContents()).willThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/queue"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }
}
