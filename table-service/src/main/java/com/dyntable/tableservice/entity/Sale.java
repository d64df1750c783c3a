package com.dyntable.tableservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 从公开销售表完成的一次购买记录
 * 金额字段使用 BigDecimal
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "sales", indexes = {
    @Index(name = "idx_sale_table", columnList = "tableId"),
    @Index(name = "idx_sale_item", columnList = "itemId"),
    @Index(name = "idx_sale_created_at", columnList = "createdAt")
})
public class Sale {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String tableId;

    @Column(length = 200)
    private String tableName;

    @Column(nullable = false, length = 64)
    private String itemId;

    // 售出时的行数据快照
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> itemSnapshot;

    @Column(nullable = false)
    private Integer quantitySold;

    @Column(precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(length = 64)
    private String customerId;

    @Column(length = 200)
    private String customerEmail;

    @Column(length = 1000)
    private String notes;

    @Column(length = 64)
    private String createdBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
