package com.dyntable.tableservice.service.module;

import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.module.spi.StoreModule;
import com.dyntable.module.spi.TypeIds;
import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.ModuleInfo;
import com.dyntable.tableservice.entity.InstalledModule;
import com.dyntable.tableservice.exception.InternalEngineException;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.repository.InstalledModuleRepository;
import com.dyntable.tableservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 已安装模块的激活状态
 *
 * 模块从类路径发现；是否激活保存在
 * {@code installed_modules} 中。没有保存状态的模块遵循
 * {@code table-engine.modules.activate-on-discovery}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModuleService implements ModuleLifecycle {

    private final ModuleCatalog catalog;
    private final InstalledModuleRepository installedModuleRepository;
    private final EngineProperties properties;

    @Override
    public List<String> listActiveModules() {
        return catalog.all().stream()
                .map(StoreModule::id)
                .filter(this::isActive)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ModuleCapabilities> getModuleCapabilities(String moduleId) {
        return catalog.find(moduleId).map(StoreModule::capabilities);
    }

    public List<ModuleInfo> listModules() {
        return catalog.all().stream().map(this::describe).collect(Collectors.toList());
    }

    @Transactional
    public ModuleInfo activate(String moduleId, Actor actor) {
        return changeState(moduleId, true, actor);
    }

    /**
     * 已有列保留该模块的类型 id；在模块重新激活前，
     * 这些列的新值会被拒绝
     */
    @Transactional
    public ModuleInfo deactivate(String moduleId, Actor actor) {
        return changeState(moduleId, false, actor);
    }

    private ModuleInfo changeState(String moduleId, boolean active, Actor actor) {
        if (actor == null || !actor.isAdmin()) {
            throw new TableAccessDeniedException("Only administrators can manage modules");
        }
        StoreModule module = catalog.find(moduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Module", moduleId));
        if (isActive(moduleId) == active) {
            return describe(module);
        }

        try {
            if (active) {
                module.onActivate();
            } else {
                module.onDeactivate();
            }
        } catch (RuntimeException e) {
            log.error("Module {} failed during {}", moduleId, active ? "activation" : "deactivation", e);
            throw new InternalEngineException("Module " + moduleId + " failed to change state", e);
        }

        InstalledModule state = installedModuleRepository.findById(moduleId)
                .orElseGet(() -> InstalledModule.builder().moduleId(moduleId).build());
        state.setVersion(module.version());
        state.setActive(active);
        if (active) {
            state.setActivatedAt(LocalDateTime.now());
        }
        installedModuleRepository.save(state);
        log.info("Module {} {} by {}", moduleId, active ? "activated" : "deactivated", actor.getId());
        return describe(module);
    }

    private boolean isActive(String moduleId) {
        return installedModuleRepository.findById(moduleId)
                .map(InstalledModule::isActive)
                .orElse(properties.getModules().isActivateOnDiscovery());
    }

    private ModuleInfo describe(StoreModule module) {
        ModuleCapabilities capabilities = module.capabilities();
        return ModuleInfo.builder()
                .id(module.id())
                .displayName(module.displayName())
                .version(module.version())
                .description(module.description())
                .active(isActive(module.id()))
                .columnTypes(capabilities.getColumnTypes().stream()
                        .map(type -> TypeIds.qualify(module.id(), type.typeId()))
                        .collect(Collectors.toList()))
                .generators(capabilities.getGenerators().keySet().stream()
                        .map(id -> TypeIds.qualify(module.id(), id))
                        .collect(Collectors.toList()))
                .tableGenerators(capabilities.getTableGenerators().stream()
                        .map(definition -> TypeIds.qualify(module.id(), definition.getId()))
                        .collect(Collectors.toList()))
                .build();
    }
}
