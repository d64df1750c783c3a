package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.AlertType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryAlert {

    private String tableId;

    private String tableName;

    private String itemId;

    private String itemName;

    private BigDecimal currentQuantity;

    private int threshold;

    private AlertType alertType;
}
