package com.syncline.api.dto;

import java.util.List;
import lombok.Data;

@Data
public class SyncAckDeleteDto {

    /** Request groups or wire types to clear; empty clears everything. */
    private List<String> types;
}
