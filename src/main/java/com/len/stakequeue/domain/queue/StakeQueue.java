package com.len.stakequeue.domain.queue;

import com.len.stakequeue.common.exception.CheckedMath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * {@link StakeOrdering} 으로 항상 정렬된 슬롯 배열 + externalId → 위치 인덱스.
 *
 * <p>위치 0 이 다음 처리 대상. 모든 변경은 영향 받는 구간만 한 칸씩 밀고 당기며
 * 밀린 항목의 인덱스를 같이 갱신한다. 존재 여부는 인덱스 맵의 키로만 판단한다
 * (0 은 유효한 위치라서 값으로 판단하면 안 됨).
 *
 * <p>검증(존재 여부, 잔액)은 호출 쪽에서 끝낸 뒤 호출해야 한다. 여기의 변경 연산은
 * 전제조건 위반 시 IllegalStateException 만 던진다.
 */
public class StakeQueue {

    private final StakeOrdering ordering = StakeOrdering.INSTANCE;
    private final List<StakeEntry> slots = new ArrayList<>();
    private final Map<Long, Integer> positions = new HashMap<>();

    private long lockedCoins;
    private long destroyedCoins;

    public boolean contains(long externalId) {
        return positions.containsKey(externalId);
    }

    public OptionalInt positionOf(long externalId) {
        Integer position = positions.get(externalId);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    public Optional<StakeEntry> find(long externalId) {
        Integer position = positions.get(externalId);
        return position == null ? Optional.empty() : Optional.of(slots.get(position));
    }

    public Optional<StakeEntry> head() {
        return slots.isEmpty() ? Optional.empty() : Optional.of(slots.get(0));
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public long lockedCoins() {
        return lockedCoins;
    }

    /**
     * pollHead 로 소비되어 환불 없이 사라진 예치금 합계
     */
    public long destroyedCoins() {
        return destroyedCoins;
    }

    public List<StakeEntry> snapshot() {
        return List.copyOf(slots);
    }

    /**
     * @return 삽입된 위치
     */
    public int insert(StakeEntry entry) {
        if (contains(entry.externalId())) {
            throw new IllegalStateException("already live: " + entry.externalId());
        }
        long locked = CheckedMath.add(lockedCoins, entry.stakedCoins());
        int target = insertionPoint(entry);

        // tail 을 한 칸씩 뒤로
        slots.add(null);
        for (int i = slots.size() - 1; i > target; i--) {
            place(i, slots.get(i - 1));
        }
        place(target, entry);
        lockedCoins = locked;
        return target;
    }

    /**
     * 같은 externalId 의 항목을 새 키로 바꾸고 올바른 위치로 옮긴다.
     */
    public Move reposition(StakeEntry updated) {
        Integer current = positions.get(updated.externalId());
        if (current == null) {
            throw new IllegalStateException("not live: " + updated.externalId());
        }
        int from = current;
        StakeEntry previous = slots.get(from);
        long locked = CheckedMath.add(lockedCoins - previous.stakedCoins(), updated.stakedCoins());
        int to = targetExcluding(updated, from);

        if (to < from) {
            // 앞으로 이동: [to, from) 구간을 뒤로 한 칸
            for (int i = from; i > to; i--) {
                place(i, slots.get(i - 1));
            }
        } else if (to > from) {
            // 뒤로 이동: (from, to] 구간을 앞으로 한 칸
            for (int i = from; i < to; i++) {
                place(i, slots.get(i + 1));
            }
        }
        place(to, updated);
        lockedCoins = locked;
        return new Move(previous, updated, from, to);
    }

    public StakeEntry remove(long externalId) {
        Integer position = positions.get(externalId);
        if (position == null) {
            throw new IllegalStateException("not live: " + externalId);
        }
        return removeAt(position);
    }

    public StakeEntry pollHead() {
        if (slots.isEmpty()) {
            throw new IllegalStateException("queue is empty");
        }
        long destroyed = CheckedMath.add(destroyedCoins, slots.get(0).stakedCoins());
        StakeEntry consumed = removeAt(0);
        destroyedCoins = destroyed;
        return consumed;
    }

    private StakeEntry removeAt(int position) {
        StakeEntry removed = slots.get(position);
        int last = slots.size() - 1;
        for (int i = position; i < last; i++) {
            place(i, slots.get(i + 1));
        }
        slots.remove(last);
        positions.remove(removed.externalId());
        lockedCoins -= removed.stakedCoins();
        return removed;
    }

    /**
     * entry 보다 앞에 있어야 하는 항목 수. 키가 완전히 같으면 기존 항목이 앞.
     */
    private int insertionPoint(StakeEntry entry) {
        int low = 0;
        int high = slots.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (ordering.ranksAhead(entry, slots.get(mid))) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private int targetExcluding(StakeEntry updated, int skip) {
        int target = 0;
        for (int i = 0; i < slots.size(); i++) {
            if (i == skip) continue;
            if (ordering.ranksAhead(updated, slots.get(i))) break;
            target++;
        }
        return target;
    }

    private void place(int index, StakeEntry entry) {
        slots.set(index, entry);
        positions.put(entry.externalId(), index);
    }

    public record Move(StakeEntry previous, StakeEntry current, int fromPosition, int toPosition) {

        public boolean moved() {
            return fromPosition != toPosition;
        }
    }
}
