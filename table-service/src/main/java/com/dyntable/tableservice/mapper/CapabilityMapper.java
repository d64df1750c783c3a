package com.dyntable.tableservice.mapper;

import com.dyntable.tableservice.dto.ColumnTypeInfo;
import com.dyntable.tableservice.dto.TableGeneratorInfo;
import com.dyntable.tableservice.service.registry.RegisteredColumnType;
import com.dyntable.tableservice.service.registry.RegisteredTableGenerator;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * 将注册表条目映射为 schema 接口返回的列表项
 */
@Mapper(componentModel = "spring")
public interface CapabilityMapper {

    @Mapping(target = "displayName", expression = "java(type.getHandler().displayName())")
    @Mapping(target = "category", expression = "java(type.getHandler().category())")
    @Mapping(target = "hasGenerator", expression = "java(type.getHandler().generator().isPresent())")
    ColumnTypeInfo toColumnTypeInfo(RegisteredColumnType type);

    @Mapping(target = "id", source = "generatorId")
    @Mapping(target = "displayName", source = "definition.displayName")
    @Mapping(target = "description", source = "definition.description")
    @Mapping(target = "targetPurpose", source = "definition.targetPurpose")
    @Mapping(target = "defaultRowCount", source = "definition.defaultRowCount")
    @Mapping(target = "columns", source = "definition.columns")
    TableGeneratorInfo toTableGeneratorInfo(RegisteredTableGenerator generator);
}
