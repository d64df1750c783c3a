package com.dyntable.tableservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapColumnsRequest {

    @NotBlank
    private String columnA;

    @NotBlank
    private String columnB;
}
