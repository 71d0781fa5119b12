package com.rangerewards.mapper;

import com.rangerewards.api.dto.response.EpochInfoResponse;
import com.rangerewards.api.dto.response.IncentiveStreamResponse;
import com.rangerewards.api.dto.response.PositionResponse;
import com.rangerewards.domain.PositionKey;
import com.rangerewards.epoch.EpochInfo;
import com.rangerewards.incentive.IncentiveStream;
import java.util.Collection;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from distributor state to response DTOs.
 */
@Mapper
public interface RewardDtoMapper {

    @Mapping(target = "poolId", source = "poolId")
    @Mapping(target = "day", expression = "java(info.currentDay())")
    EpochInfoResponse toResponse(String poolId, EpochInfo info);

    IncentiveStreamResponse toResponse(IncentiveStream stream);

    List<IncentiveStreamResponse> toStreamResponseList(Collection<IncentiveStream> streams);

    PositionResponse toResponse(PositionKey key);
}
