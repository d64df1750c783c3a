package com.dyntable.tableservice.security;

import com.dyntable.tableservice.entity.UserTable;
import org.springframework.stereotype.Component;

/**
 * 所有者和管理员可读写；公开表和共享表所有人可读
 */
@Component
public class OwnershipTableAccessPolicy implements TableAccessPolicy {

    @Override
    public boolean hasReadAccess(UserTable table, Actor actor) {
        return hasWriteAccess(table, actor) || table.getVisibility().isPubliclyReadable();
    }

    @Override
    public boolean hasWriteAccess(UserTable table, Actor actor) {
        if (actor == null) {
            return false;
        }
        return actor.isSystem() || actor.isAdmin() || table.getOwnerId().equals(actor.getId());
    }
}
