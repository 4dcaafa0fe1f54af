package com.len.stakequeue.application.access;

import com.len.stakequeue.application.common.RegistryExecutor;
import com.len.stakequeue.common.exception.BusinessException;
import com.len.stakequeue.common.exception.ErrorCode;
import com.len.stakequeue.domain.event.ControllerChanged;
import com.len.stakequeue.domain.event.EventNotifier;
import com.len.stakequeue.infra.access.RoleTableAccessGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccessService {

    private final RegistryExecutor executor;
    private final RoleTableAccessGate roleTable;
    private final EventNotifier notifier;

    public Roles setController(String caller, String newController) {
        return executor.execute("setController", nowMs -> {
            if (!roleTable.isOwner(caller)) {
                throw new BusinessException(ErrorCode.NOT_OWNER);
            }
            if (newController == null || newController.isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_REQUEST);
            }
            String previous = roleTable.replaceController(newController);
            notifier.publish(new ControllerChanged(previous, newController, nowMs));
            log.info("[Access] controller changed {} -> {}", previous, newController);
            return new Roles(roleTable.owner(), roleTable.controller());
        });
    }

    public Roles roles() {
        return executor.execute("roles", nowMs -> new Roles(roleTable.owner(), roleTable.controller()));
    }

    public record Roles(String owner, String controller) {}
}
