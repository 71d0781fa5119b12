package com.rangerewards.api.dto.request;

import com.rangerewards.domain.PositionKey;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Position callback from the position manager adapter. {@code liquidity} is the subscribed
 * amount for a subscribe and the signed delta for a modify; unsubscribe and burn ignore it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRequest {

    @NotBlank
    private String owner;

    @NotBlank
    private String poolId;

    @NotNull
    private Integer tickLower;

    @NotNull
    private Integer tickUpper;

    private String salt;

    private BigInteger liquidity;

    public PositionKey toKey() {
        return PositionKey.of(owner, poolId, tickLower, tickUpper, salt);
    }
}
