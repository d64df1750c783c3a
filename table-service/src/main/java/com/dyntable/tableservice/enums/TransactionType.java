package com.dyntable.tableservice.enums;

/**
 * 库存流水类型
 *
 * ADD: 销售表中新建商品
 * REMOVE: 从销售表删除商品
 * UPDATE: 商品被修改（包括购买导致的数量扣减）
 * ADJUST: 手工库存调整
 */
public enum TransactionType {
    ADD,
    REMOVE,
    UPDATE,
    ADJUST
}
