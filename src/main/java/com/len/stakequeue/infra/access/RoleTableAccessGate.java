package com.len.stakequeue.infra.access;

import com.len.stakequeue.domain.access.AccessGate;
import com.len.stakequeue.domain.ledger.AccountLedger;

import java.util.Objects;

/**
 * owner 는 설정으로 고정, controller 는 owner 가 교체할 수 있다.
 * 등록 여부는 원장에 위임한다.
 */
public class RoleTableAccessGate implements AccessGate {

    private final AccountLedger ledger;
    private final String owner;
    private String controller;

    public RoleTableAccessGate(AccountLedger ledger, String owner, String controller) {
        this.ledger = Objects.requireNonNull(ledger);
        this.owner = Objects.requireNonNull(owner);
        this.controller = Objects.requireNonNull(controller);
    }

    @Override
    public boolean isRegistered(String walletId) {
        return walletId != null && ledger.isRegistered(walletId);
    }

    @Override
    public boolean isController(String walletId) {
        return controller.equals(walletId);
    }

    @Override
    public boolean isOwner(String walletId) {
        return owner.equals(walletId);
    }

    public String owner() {
        return owner;
    }

    public String controller() {
        return controller;
    }

    /**
     * 권한 검사는 호출 쪽(AccessService)에서 한다.
     */
    public String replaceController(String newController) {
        String previous = controller;
        controller = Objects.requireNonNull(newController);
        return previous;
    }
}
