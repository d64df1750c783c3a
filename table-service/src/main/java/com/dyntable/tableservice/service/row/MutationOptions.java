package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.enums.TransactionType;
import lombok.Builder;
import lombok.Value;

/**
 * 会写入库存流水的行写入附加上下文
 */
@Value
@Builder
public class MutationOptions {

    private static final MutationOptions NONE = MutationOptions.builder().build();

    /**
     * 将流水关联到外部记录，例如销售 id
     */
    String referenceId;

    /**
     * 覆盖根据操作推导出的流水类型
     */
    TransactionType ledgerType;

    String note;

    public static MutationOptions none() {
        return NONE;
    }

    public static MutationOptions referencing(String referenceId) {
        return MutationOptions.builder().referenceId(referenceId).build();
    }

    public static MutationOptions adjustment(String reason) {
        return MutationOptions.builder().ledgerType(TransactionType.ADJUST).note(reason).build();
    }
}
