package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.StatusCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MassActionItemResult {

    private String rowId;

    private boolean success;

    private StatusCategory status;

    private String message;

    private List<FieldError> errors;
}
