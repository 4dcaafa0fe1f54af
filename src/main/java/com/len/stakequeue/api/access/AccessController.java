package com.len.stakequeue.api.access;

import com.len.stakequeue.api.access.dto.SetControllerRequest;
import com.len.stakequeue.application.access.AccessService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/access")
public class AccessController {

    private final AccessService accessService;

    @GetMapping
    public AccessService.Roles roles() {
        return accessService.roles();
    }

    // owner 만 가능
    @PutMapping("/controller")
    public AccessService.Roles setController(@Valid @RequestBody SetControllerRequest request) {
        return accessService.setController(request.caller(), request.newController());
    }
}
