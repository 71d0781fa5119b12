package com.rangerewards.api.dto.response;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncentiveStreamResponse {

    private String token;
    private BigInteger ratePerSecond;
    private long finishTimestamp;
    private BigInteger remainingAmount;
}
