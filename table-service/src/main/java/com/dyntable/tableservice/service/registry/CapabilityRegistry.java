package com.dyntable.tableservice.service.registry;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.module.spi.TableGeneratorDefinition;
import com.dyntable.module.spi.TypeIds;
import com.dyntable.module.spi.ValueGenerator;
import com.dyntable.tableservice.exception.ColumnTypeNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 列类型、值生成器和表生成器的不可变查找表
 *
 * 注册表是一份快照：包含内置能力以及构建时
 * 已激活模块的能力。模块贡献的能力以
 * {@code moduleId:tag} 为键；内置能力使用不带前缀的标签
 */
public final class CapabilityRegistry {

    private final Map<String, RegisteredColumnType> columnTypes;
    private final Map<String, ValueGenerator> generators;
    private final Map<String, RegisteredTableGenerator> tableGenerators;
    private final Set<String> activeModules;

    private CapabilityRegistry(Builder builder) {
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columnTypes));
        this.generators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.generators));
        this.tableGenerators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tableGenerators));
        this.activeModules = Collections.unmodifiableSet(new LinkedHashSet<>(builder.activeModules));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ColumnTypeHandler> find(String typeId) {
        return findRegistration(typeId).map(RegisteredColumnType::getHandler);
    }

    public Optional<RegisteredColumnType> findRegistration(String typeId) {
        if (typeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columnTypes.get(typeId));
    }

    /**
     * @throws ColumnTypeNotFoundException id 未知或所属模块未激活时
     */
    public ColumnTypeHandler resolve(String typeId) {
        return find(typeId).orElseThrow(() -> new ColumnTypeNotFoundException(typeId));
    }

    public boolean isResolvable(String typeId) {
        return findRegistration(typeId).isPresent();
    }

    /**
     * 按 id 查找值生成器；列类型 id 也会解析到该类型自带的生成器
     */
    public Optional<ValueGenerator> findGenerator(String generatorId) {
        if (generatorId == null) {
            return Optional.empty();
        }
        ValueGenerator generator = generators.get(generatorId);
        if (generator != null) {
            return Optional.of(generator);
        }
        return find(generatorId).flatMap(ColumnTypeHandler::generator);
    }

    public Optional<RegisteredTableGenerator> findTableGenerator(String generatorId) {
        return Optional.ofNullable(generatorId).map(tableGenerators::get);
    }

    public Collection<RegisteredColumnType> columnTypes() {
        return columnTypes.values();
    }

    public Set<String> generatorIds() {
        return generators.keySet();
    }

    public Collection<RegisteredTableGenerator> tableGenerators() {
        return tableGenerators.values();
    }

    public Set<String> activeModules() {
        return activeModules;
    }

    public static final class Builder {

        private final Map<String, RegisteredColumnType> columnTypes = new LinkedHashMap<>();
        private final Map<String, ValueGenerator> generators = new LinkedHashMap<>();
        private final Map<String, RegisteredTableGenerator> tableGenerators = new LinkedHashMap<>();
        private final Set<String> activeModules = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder builtInType(ColumnTypeHandler handler) {
            String typeId = handler.typeId();
            if (TypeIds.isNamespaced(typeId)) {
                throw new IllegalArgumentException("Built-in type ids cannot be namespaced: " + typeId);
            }
            putUnique(columnTypes, typeId, new RegisteredColumnType(typeId, null, handler), "column type");
            return this;
        }

        public Builder builtInGenerator(String generatorId, ValueGenerator generator) {
            putUnique(generators, generatorId, generator, "value generator");
            return this;
        }

        public Builder builtInTableGenerator(TableGeneratorDefinition definition) {
            putUnique(tableGenerators, definition.getId(),
                    new RegisteredTableGenerator(definition.getId(), null, definition), "table generator");
            return this;
        }

        /**
         * 在模块命名空间下注册其贡献的全部能力。
         * 要么全部注册，要么都不注册
         */
        public Builder module(String moduleId, ModuleCapabilities capabilities) {
            if (moduleId == null || moduleId.isBlank() || moduleId.indexOf(TypeIds.SEPARATOR) >= 0) {
                throw new IllegalArgumentException("Invalid module id: " + moduleId);
            }
            Map<String, RegisteredColumnType> types = new LinkedHashMap<>();
            for (ColumnTypeHandler handler : capabilities.getColumnTypes()) {
                String typeId = TypeIds.qualify(moduleId, handler.typeId());
                putUnique(types, typeId, new RegisteredColumnType(typeId, moduleId, handler), "column type");
            }
            Map<String, ValueGenerator> moduleGenerators = new LinkedHashMap<>();
            capabilities.getGenerators().forEach((id, generator) ->
                    putUnique(moduleGenerators, TypeIds.qualify(moduleId, id), generator, "value generator"));
            Map<String, RegisteredTableGenerator> templates = new LinkedHashMap<>();
            for (TableGeneratorDefinition definition : capabilities.getTableGenerators()) {
                String generatorId = TypeIds.qualify(moduleId, definition.getId());
                putUnique(templates, generatorId,
                        new RegisteredTableGenerator(generatorId, moduleId, definition), "table generator");
            }

            List<String> clashes = new ArrayList<>();
            types.keySet().stream().filter(columnTypes::containsKey).forEach(clashes::add);
            moduleGenerators.keySet().stream().filter(generators::containsKey).forEach(clashes::add);
            templates.keySet().stream().filter(tableGenerators::containsKey).forEach(clashes::add);
            if (!clashes.isEmpty()) {
                throw new IllegalArgumentException("Module " + moduleId + " redefines " + clashes);
            }

            columnTypes.putAll(types);
            generators.putAll(moduleGenerators);
            tableGenerators.putAll(templates);
            activeModules.add(moduleId);
            return this;
        }

        public CapabilityRegistry build() {
            return new CapabilityRegistry(this);
        }

        private static <T> void putUnique(Map<String, T> target, String key, T value, String kind) {
            if (target.putIfAbsent(key, value) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + ": " + key);
            }
        }
    }
}
