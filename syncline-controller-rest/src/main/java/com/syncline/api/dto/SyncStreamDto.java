package com.syncline.api.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;

@Data
public class SyncStreamDto {

    /** Request group names, e.g. {@code AssetsV1}. Delivery follows catalogue order, not list order. */
    @NotEmpty
    private List<String> types;

    /** Clear every checkpoint of the session before streaming. */
    private Boolean reset;
}
