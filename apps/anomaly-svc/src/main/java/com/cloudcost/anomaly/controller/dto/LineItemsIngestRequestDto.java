package com.cloudcost.anomaly.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record LineItemsIngestRequestDto(@NotEmpty List<@Valid LineItemRequestDto> items, Boolean replaceExisting) {
    public boolean replaceExistingFlag() {
        return Boolean.TRUE.equals(replaceExisting);
    }
}
