package com.syncline.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Data;

@Data
public class AssetDeltaSyncDto {

    @NotNull
    private Instant updatedAfter;

    @NotEmpty
    private List<UUID> userIds;
}
