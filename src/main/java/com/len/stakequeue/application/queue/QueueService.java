package com.len.stakequeue.application.queue;

import com.len.stakequeue.application.common.RegistryExecutor;
import com.len.stakequeue.common.exception.BusinessException;
import com.len.stakequeue.common.exception.ErrorCode;
import com.len.stakequeue.domain.access.AccessGate;
import com.len.stakequeue.domain.event.EnteredQueue;
import com.len.stakequeue.domain.event.EventNotifier;
import com.len.stakequeue.domain.event.ItemDequeued;
import com.len.stakequeue.domain.event.QueueUpdated;
import com.len.stakequeue.domain.event.RegistryEvent;
import com.len.stakequeue.domain.event.StakeChanged;
import com.len.stakequeue.domain.event.StakeRemoved;
import com.len.stakequeue.domain.ledger.AccountLedger;
import com.len.stakequeue.domain.ledger.LedgerSupply;
import com.len.stakequeue.domain.pricing.PricingFunction;
import com.len.stakequeue.domain.queue.StakeEntry;
import com.len.stakequeue.domain.queue.StakeQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 예치금 기반 우선순위 대기열.
 *
 * <p>각 연산은 RegistryExecutor 안에서 실행된다. 순서는 항상
 * 검증(예외 가능) → 원장 반영 → 대기열 이동(예외 없음) → 알림.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueService {

    private final RegistryExecutor executor;
    private final AccountLedger ledger;
    private final StakeQueue queue;
    private final PricingFunction pricing;
    private final AccessGate accessGate;
    private final EventNotifier notifier;

    public QueueEntryResult enter(String walletId, long weight, long priorityValue, long externalId) {
        return executor.execute("enterQueue", nowMs -> {
            if (!accessGate.isRegistered(walletId)) {
                throw new BusinessException(ErrorCode.UNREGISTERED);
            }
            if (queue.contains(externalId)) {
                throw new BusinessException(ErrorCode.ALREADY_QUEUED);
            }
            long cost = pricing.cost(weight, priorityValue);

            ledger.burn(walletId, cost, nowMs);
            StakeEntry entry = new StakeEntry(externalId, walletId, weight, priorityValue, cost, nowMs);
            int position = queue.insert(entry);

            notifier.publishAll(List.of(
                    new EnteredQueue(externalId, walletId, cost, position, nowMs),
                    new QueueUpdated(externalId, position, queue.size(), nowMs)
            ));
            log.info("[Queue] entered externalId={}, walletId={}, staked={}, position={}",
                    externalId, walletId, cost, position);
            return new QueueEntryResult(entry, position);
        });
    }

    /**
     * 새 가격과의 차액만 소각하거나 돌려준다. timestamp 도 갱신되므로
     * 같은 키로 다시 호출하면 동순위 항목들 뒤로 밀린다.
     */
    public QueueEntryResult changeStake(String walletId, long newWeight, long newPriorityValue, long externalId) {
        return executor.execute("changeStakeBalance", nowMs -> {
            StakeEntry current = queue.find(externalId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.NOT_IN_QUEUE));
            if (!current.owner().equals(walletId)) {
                throw new BusinessException(ErrorCode.NOT_AUTHORIZED, "stake owner만 변경할 수 있습니다.");
            }
            long newCost = pricing.cost(newWeight, newPriorityValue);
            long oldCost = current.stakedCoins();

            if (newCost > oldCost) {
                ledger.burn(walletId, newCost - oldCost, nowMs);
            } else if (newCost < oldCost) {
                ledger.mint(walletId, oldCost - newCost, nowMs);
            } else {
                ledger.checkpoint(walletId, nowMs);
            }

            StakeQueue.Move move = queue.reposition(current.reprice(newWeight, newPriorityValue, newCost, nowMs));

            List<RegistryEvent> events = new ArrayList<>();
            events.add(new StakeChanged(externalId, walletId, oldCost, newCost, move.toPosition(), nowMs));
            if (move.moved()) {
                events.add(new QueueUpdated(externalId, move.toPosition(), queue.size(), nowMs));
            }
            notifier.publishAll(events);

            log.info("[Queue] stake changed externalId={}, staked={}->{}, position={}->{}",
                    externalId, oldCost, newCost, move.fromPosition(), move.toPosition());
            return new QueueEntryResult(move.current(), move.toPosition());
        });
    }

    public StakeEntry remove(String walletId, long externalId) {
        return executor.execute("removeStakeFromQueue", nowMs -> {
            StakeEntry entry = queue.find(externalId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.NOT_IN_QUEUE));
            if (!entry.owner().equals(walletId)) {
                throw new BusinessException(ErrorCode.NOT_AUTHORIZED, "stake owner만 취소할 수 있습니다.");
            }

            ledger.mint(entry.owner(), entry.stakedCoins(), nowMs);
            queue.remove(externalId);

            notifier.publish(new StakeRemoved(externalId, entry.owner(), entry.stakedCoins(), nowMs));
            log.info("[Queue] removed externalId={}, refunded={}", externalId, entry.stakedCoins());
            return entry;
        });
    }

    /**
     * controller 만 head 를 소비할 수 있다. 예치금은 환불하지 않는다.
     */
    public StakeEntry dequeue(String caller) {
        return executor.execute("dequeueItem", nowMs -> {
            if (!accessGate.isController(caller)) {
                throw new BusinessException(ErrorCode.NOT_AUTHORIZED);
            }
            if (queue.isEmpty()) {
                throw new BusinessException(ErrorCode.QUEUE_EMPTY);
            }

            StakeEntry consumed = queue.pollHead();

            notifier.publish(new ItemDequeued(consumed.externalId(), consumed.owner(), consumed.stakedCoins(), caller, nowMs));
            log.info("[Queue] dequeued externalId={}, walletId={}, destroyed={}",
                    consumed.externalId(), consumed.owner(), consumed.stakedCoins());
            return consumed;
        });
    }

    public int getPosition(long externalId) {
        return executor.execute("getQueuePosition", nowMs -> queue.positionOf(externalId)
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_IN_QUEUE)));
    }

    public StakeEntry getStake(long externalId) {
        return executor.execute("getStake", nowMs -> queue.find(externalId)
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_IN_QUEUE)));
    }

    public List<StakeEntry> getContents() {
        return executor.execute("getQueueContents", nowMs -> queue.snapshot());
    }

    public QueueStats getStats() {
        return executor.execute("queueStats", nowMs -> new QueueStats(
                queue.size(),
                queue.lockedCoins(),
                queue.destroyedCoins(),
                ledger.supply()
        ));
    }

    public record QueueEntryResult(StakeEntry entry, int position) {}

    public record QueueStats(int size, long lockedCoins, long destroyedCoins, LedgerSupply supply) {}
}
