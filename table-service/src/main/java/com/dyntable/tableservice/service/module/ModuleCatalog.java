package com.dyntable.tableservice.service.module;

import com.dyntable.module.spi.StoreModule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * 类路径上安装的模块，无论是否激活
 */
@Slf4j
public class ModuleCatalog {

    private final Map<String, StoreModule> modules;

    public ModuleCatalog(Collection<StoreModule> modules) {
        Map<String, StoreModule> byId = new LinkedHashMap<>();
        for (StoreModule module : modules) {
            if (byId.putIfAbsent(module.id(), module) != null) {
                log.warn("Ignoring second module registered as {}: {}", module.id(), module.getClass().getName());
            }
        }
        this.modules = Collections.unmodifiableMap(byId);
    }

    /**
     * 加载 {@code META-INF/services} 下声明的所有 {@link StoreModule}
     * 加载失败的模块会被跳过
     */
    public static ModuleCatalog discover(ClassLoader classLoader) {
        List<StoreModule> found = new ArrayList<>();
        ServiceLoader.load(StoreModule.class, classLoader).stream().forEach(provider -> {
            try {
                StoreModule module = provider.get();
                found.add(module);
                log.info("Discovered module {} {} ({})", module.id(), module.version(), provider.type().getName());
            } catch (ServiceConfigurationError e) {
                log.error("Failed to load module {}", provider.type().getName(), e);
            }
        });
        return new ModuleCatalog(found);
    }

    public Optional<StoreModule> find(String moduleId) {
        return Optional.ofNullable(modules.get(moduleId));
    }

    public Collection<StoreModule> all() {
        return modules.values();
    }
}
