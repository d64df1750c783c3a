package com.dyntable.tableservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 已发现模块的持久化激活状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "installed_modules")
public class InstalledModule {

    @Id
    @Column(length = 64)
    private String moduleId;

    @Column(length = 32)
    private String version;

    private boolean active;

    private LocalDateTime activatedAt;

    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
