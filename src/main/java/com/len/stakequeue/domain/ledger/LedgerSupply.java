package com.len.stakequeue.domain.ledger;

/**
 * 원장 전체 발행/소각 합계.
 * 항상 Σ(정산 잔액) == totalAccrued - totalBurned + totalMinted.
 */
public record LedgerSupply(
        long totalAccrued,
        long totalBurned,
        long totalMinted,
        long totalSettled
) {

    public long circulating() {
        return totalAccrued - totalBurned + totalMinted;
    }
}
