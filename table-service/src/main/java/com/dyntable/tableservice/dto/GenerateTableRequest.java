package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TableVisibility;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateTableRequest {

    @NotBlank(message = "Generator ID is required")
    private String generatorId;

    @NotBlank(message = "Table name is required")
    private String tableName;

    @Min(0)
    private Integer rowCount;

    private TableVisibility visibility;

    /**
     * 固定随机种子，用于生成可复现的示例数据
     */
    private Long seed;
}
