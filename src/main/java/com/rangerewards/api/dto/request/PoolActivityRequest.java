package com.rangerewards.api.dto.request;

import com.rangerewards.pool.PoolEventType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Swap or liquidity notification from the pool manager, with the tick it left the pool at. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolActivityRequest {

    @NotNull
    private PoolEventType eventType;

    @NotNull
    private Integer activeTick;
}
