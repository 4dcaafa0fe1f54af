package com.len.stakequeue.domain.queue;

import java.util.Comparator;

/**
 * 음수면 a 가 b 보다 앞(먼저 처리).
 * priorityValue 내림차순 → weight 오름차순 → timestamp 오름차순.
 */
public final class StakeOrdering implements Comparator<StakeEntry> {

    public static final StakeOrdering INSTANCE = new StakeOrdering();

    private StakeOrdering() {}

    @Override
    public int compare(StakeEntry a, StakeEntry b) {
        int byPriority = Long.compare(b.priorityValue(), a.priorityValue());
        if (byPriority != 0) return byPriority;

        int byWeight = Long.compare(a.weight(), b.weight());
        if (byWeight != 0) return byWeight;

        return Long.compare(a.timestampMs(), b.timestampMs());
    }

    public boolean ranksAhead(StakeEntry a, StakeEntry b) {
        return compare(a, b) < 0;
    }
}
