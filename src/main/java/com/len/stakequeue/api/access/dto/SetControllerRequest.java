package com.len.stakequeue.api.access.dto;

import jakarta.validation.constraints.NotBlank;

public record SetControllerRequest(
        @NotBlank String caller,
        @NotBlank String newController
) {}
