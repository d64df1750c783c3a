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
public class ImportRowError {

    /**
     * 在提交行中的序号，从 1 开始
     */
    private int rowNumber;

    private String message;

    private List<FieldError> errors;
}
