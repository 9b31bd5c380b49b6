package com.syncline.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;
import lombok.Data;

@Data
public class AssetFullSyncDto {

    private UUID lastId;

    @NotNull
    private Instant updatedUntil;

    @NotNull
    @Min(1)
    private Integer limit;

    private UUID userId;
}
