package com.dyntable.tableservice.service.module;

import com.dyntable.module.spi.ModuleCapabilities;

import java.util.List;
import java.util.Optional;

/**
 * 能力注册表所使用的激活模块集合来源
 */
public interface ModuleLifecycle {

    List<String> listActiveModules();

    Optional<ModuleCapabilities> getModuleCapabilities(String moduleId);
}
