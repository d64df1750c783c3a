package com.dyntable.tableservice.entity;

import com.dyntable.tableservice.enums.TransactionType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 只追加的库存流水记录
 *
 * - 没有 setter：写入后不再修改
 * - tableName 在写入时复制，表删除后历史仍可读
 * - 行中没有数值型数量时 quantityChange 为 null
 */
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Immutable
@Entity
@Table(name = "inventory_transactions", indexes = {
    @Index(name = "idx_tx_table_item", columnList = "tableId,itemId"),
    @Index(name = "idx_tx_reference", columnList = "referenceId"),
    @Index(name = "idx_tx_created_at", columnList = "createdAt")
})
public class InventoryTransaction {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String tableId;

    @Column(length = 200)
    private String tableName;

    @Column(nullable = false, length = 64)
    private String itemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionType transactionType;

    private Long quantityChange;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> previousData;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> newData;

    @Column(length = 64)
    private String referenceId;

    @Column(length = 500)
    private String note;

    @Column(length = 64)
    private String createdBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
