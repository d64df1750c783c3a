package com.dyntable.tableservice.security;

import com.dyntable.tableservice.entity.UserTable;

public interface TableAccessPolicy {

    boolean hasReadAccess(UserTable table, Actor actor);

    boolean hasWriteAccess(UserTable table, Actor actor);
}
