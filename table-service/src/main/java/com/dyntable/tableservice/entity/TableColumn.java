package com.dyntable.tableservice.entity;

import com.dyntable.tableservice.service.schema.ColumnNames;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 列定义。{@code name} 是行数据中使用的内部驼峰键，
 * {@code type} 是内置类型或带模块前缀的类型 id
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "table_columns",
    uniqueConstraints = @UniqueConstraint(name = "uk_column_table_name", columnNames = {"tableId", "name"}),
    indexes = @Index(name = "idx_column_table", columnList = "tableId"))
public class TableColumn {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String tableId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 100)
    private String type;

    private boolean required;

    @Builder.Default
    private boolean allowDuplicates = true;

    @Column(length = 1000)
    private String defaultValue;

    private int position;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public String getDisplayName() {
        return ColumnNames.toDisplayName(name);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
