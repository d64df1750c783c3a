package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityResponse {

    private String tableId;

    private String itemId;

    private boolean available;

    private BigDecimal currentQuantity;

    private long requested;

    private BigDecimal unitPrice;

    /**
     * 不可购买的原因；可购买时为 null
     */
    private String reason;
}
