package com.syncline.api.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;

@Data
public class SyncAckSetDto {

    @NotEmpty
    private List<String> acks;
}
