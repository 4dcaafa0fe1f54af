package com.len.stakequeue.api.queue;

import com.len.stakequeue.api.queue.dto.ChangeStakeRequest;
import com.len.stakequeue.api.queue.dto.DequeueRequest;
import com.len.stakequeue.api.queue.dto.EnterQueueRequest;
import com.len.stakequeue.api.queue.dto.QueuePositionResponse;
import com.len.stakequeue.api.queue.dto.StakeEntryResponse;
import com.len.stakequeue.application.queue.QueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final QueueService queueService;

    // 대기열 진입 (예치금 소각)
    @PostMapping("/enter")
    @ResponseStatus(HttpStatus.CREATED)
    public QueuePositionResponse enter(@Valid @RequestBody EnterQueueRequest request) {
        var result = queueService.enter(
                request.walletId(),
                request.weight(),
                request.priorityValue(),
                request.externalId()
        );
        return new QueuePositionResponse(request.externalId(), result.position(), StakeEntryResponse.from(result.entry()));
    }

    // 예치금 재설정
    @PutMapping("/{externalId}/stake")
    public QueuePositionResponse changeStake(
            @PathVariable long externalId,
            @Valid @RequestBody ChangeStakeRequest request
    ) {
        var result = queueService.changeStake(
                request.walletId(),
                request.weight(),
                request.priorityValue(),
                externalId
        );
        return new QueuePositionResponse(externalId, result.position(), StakeEntryResponse.from(result.entry()));
    }

    // 취소 (owner 에게 환불)
    @DeleteMapping("/{externalId}")
    public StakeEntryResponse remove(@PathVariable long externalId, @RequestParam String walletId) {
        return StakeEntryResponse.from(queueService.remove(walletId, externalId));
    }

    // head 소비 (controller 전용, 환불 없음)
    @PostMapping("/dequeue")
    public StakeEntryResponse dequeue(@Valid @RequestBody DequeueRequest request) {
        return StakeEntryResponse.from(queueService.dequeue(request.walletId()));
    }

    @GetMapping("/{externalId}/position")
    public QueuePositionResponse position(@PathVariable long externalId) {
        return new QueuePositionResponse(externalId, queueService.getPosition(externalId), null);
    }

    @GetMapping("/{externalId}")
    public StakeEntryResponse stake(@PathVariable long externalId) {
        return StakeEntryResponse.from(queueService.getStake(externalId));
    }

    @GetMapping
    public List<StakeEntryResponse> contents() {
        return queueService.getContents().stream()
                .map(StakeEntryResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public QueueService.QueueStats stats() {
        return queueService.getStats();
    }
}
