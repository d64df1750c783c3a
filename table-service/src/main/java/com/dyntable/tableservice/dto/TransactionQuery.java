package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionQuery {

    private String tableId;

    private String itemId;

    private TransactionType type;

    private String createdBy;

    private LocalDateTime from;

    private LocalDateTime to;

    @Builder.Default
    private int page = 0;

    @Builder.Default
    private int size = 50;
}
