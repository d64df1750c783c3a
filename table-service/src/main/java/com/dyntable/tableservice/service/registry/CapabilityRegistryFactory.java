package com.dyntable.tableservice.service.registry;

import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.tableservice.service.module.ModuleLifecycle;
import com.dyntable.tableservice.service.registry.builtin.BuiltInCapabilities;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 由内置能力和当前激活的模块构建注册表快照。
 * 调用方每次操作取一份快照并向下传递，
 * 操作过程中不再读取共享的模块状态
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapabilityRegistryFactory {

    private final ModuleLifecycle moduleLifecycle;

    public CapabilityRegistry snapshot() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder();
        BuiltInCapabilities.registerAll(builder);

        for (String moduleId : moduleLifecycle.listActiveModules()) {
            Optional<ModuleCapabilities> capabilities = moduleLifecycle.getModuleCapabilities(moduleId);
            if (capabilities.isEmpty()) {
                log.warn("Active module {} exposes no capabilities, skipping", moduleId);
                continue;
            }
            try {
                builder.module(moduleId, capabilities.get());
            } catch (IllegalArgumentException e) {
                log.warn("Module {} could not be registered: {}", moduleId, e.getMessage());
            }
        }
        return builder.build();
    }
}
