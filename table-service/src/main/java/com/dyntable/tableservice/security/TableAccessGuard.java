package com.dyntable.tableservice.security;

import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.repository.TableDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 加载表并同时校验操作者的访问权限
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableAccessGuard {

    private final TableDataStore store;
    private final TableAccessPolicy accessPolicy;

    public UserTable requireReadable(String tableId, Actor actor) {
        UserTable table = load(tableId);
        if (!accessPolicy.hasReadAccess(table, actor)) {
            log.warn("Read access denied: table={}, actor={}", tableId, actor == null ? null : actor.getId());
            throw new TableAccessDeniedException();
        }
        return table;
    }

    public UserTable requireWritable(String tableId, Actor actor) {
        UserTable table = load(tableId);
        if (!accessPolicy.hasWriteAccess(table, actor)) {
            log.warn("Write access denied: table={}, actor={}", tableId, actor == null ? null : actor.getId());
            throw new TableAccessDeniedException();
        }
        return table;
    }

    public boolean canRead(UserTable table, Actor actor) {
        return accessPolicy.hasReadAccess(table, actor);
    }

    private UserTable load(String tableId) {
        return store.findTable(tableId).orElseThrow(() -> new ResourceNotFoundException("Table", tableId));
    }
}
