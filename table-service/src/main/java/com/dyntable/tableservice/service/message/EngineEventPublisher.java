package com.dyntable.tableservice.service.message;

import com.dyntable.tableservice.entity.InventoryTransaction;

/**
 * 引擎对外事件。实现类失败时抛出异常，
 * 由调用方决定发布失败是否致命
 */
public interface EngineEventPublisher {

    void publishTransactionRecorded(InventoryTransaction transaction);

    /**
     * 通知其他子系统移除对已删除表的引用
     */
    void publishTableDeleted(String tableId, String tableName);
}
