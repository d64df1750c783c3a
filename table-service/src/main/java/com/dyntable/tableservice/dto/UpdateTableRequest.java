package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TableVisibility;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 部分更新；为 null 的字段保持不变
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTableRequest {

    @Size(max = 200)
    private String name;

    @Size(max = 1000)
    private String description;

    private TableVisibility visibility;

    private TablePurpose purpose;
}
