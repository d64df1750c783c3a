package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.MassActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MassActionResult {

    private MassActionType action;

    private int requested;

    private int succeeded;

    private int failed;

    private List<MassActionItemResult> results;
}
