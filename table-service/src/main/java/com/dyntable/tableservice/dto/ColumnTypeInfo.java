package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnTypeInfo {

    private String typeId;

    private String displayName;

    private String category;

    private String moduleId;

    private boolean builtIn;

    private boolean hasGenerator;
}
