package com.rangerewards.api.dto.response;

import java.math.BigInteger;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Daily pipeline state of a pool, as of the request time. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EpochInfoResponse {

    private String poolId;
    private long day;
    private long windowStart;
    private long windowEnd;
    private BigInteger streamRate;
    private BigInteger nextStreamRate;
    private BigInteger queuedStreamRate;

    /** Amounts not yet promoted into the rate pipeline, keyed by activation day. */
    private Map<Long, BigInteger> scheduledBucket;
}
