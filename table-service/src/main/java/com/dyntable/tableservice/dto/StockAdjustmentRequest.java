package com.dyntable.tableservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentRequest {

    @NotBlank
    private String tableId;

    @NotBlank
    private String itemId;

    @NotNull(message = "Delta is required")
    private Long delta;

    @Size(max = 500)
    private String reason;
}
