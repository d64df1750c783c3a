package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeChangePreview {

    private String columnName;

    private String currentType;

    private String newType;

    private int totalRows;

    private int compatibleRows;

    private int incompatibleRows;

    private List<TypeChangeIssue> sampleIssues;
}
