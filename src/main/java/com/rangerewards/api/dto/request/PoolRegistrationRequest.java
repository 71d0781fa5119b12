package com.rangerewards.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolRegistrationRequest {

    @NotBlank
    private String poolId;

    @NotNull
    @Positive
    private Integer tickSpacing;

    @NotNull
    private Integer activeTick;
}
