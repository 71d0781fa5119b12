package com.rangerewards.api.dto.response;

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
public class PositionResponse {

    private String id;
    private String owner;
    private String poolId;
    private int tickLower;
    private int tickUpper;
    private String salt;
}
