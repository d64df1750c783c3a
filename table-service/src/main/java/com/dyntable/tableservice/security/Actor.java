package com.dyntable.tableservice.security;

import lombok.Value;

/**
 * 操作的执行者。系统操作者用于内部后续写入，
 * 例如购买后扣减库存
 */
@Value
public class Actor {

    public static final String SYSTEM_ID = "system";

    String id;
    boolean admin;
    boolean system;

    public static Actor user(String id) {
        return new Actor(id, false, false);
    }

    public static Actor admin(String id) {
        return new Actor(id, true, false);
    }

    public static Actor system() {
        return new Actor(SYSTEM_ID, true, true);
    }
}
