package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TableVisibility;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTableRequest {

    @NotBlank(message = "Table name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 1000)
    private String description;

    private TableVisibility visibility;

    private TablePurpose purpose;
}
