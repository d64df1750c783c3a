package com.dyntable.tableservice.dto;

import com.dyntable.module.spi.ColumnTemplate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableGeneratorInfo {

    private String id;

    private String moduleId;

    private String displayName;

    private String description;

    private String targetPurpose;

    private int defaultRowCount;

    private List<ColumnTemplate> columns;
}
