package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TableVisibility;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloneTableRequest {

    @NotBlank(message = "Table name is required")
    private String name;

    private TableVisibility visibility;

    private boolean includeRows;
}
