package com.dyntable.tableservice.service.registry;

import com.dyntable.tableservice.dto.ColumnTypeInfo;
import com.dyntable.tableservice.dto.TableGeneratorInfo;
import com.dyntable.tableservice.mapper.CapabilityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 注册表当前提供内容的只读列表
 */
@Service
@RequiredArgsConstructor
public class CapabilityCatalogService {

    private final CapabilityRegistryFactory registryFactory;
    private final CapabilityMapper capabilityMapper;

    public List<ColumnTypeInfo> listColumnTypes() {
        return registryFactory.snapshot().columnTypes().stream()
                .map(capabilityMapper::toColumnTypeInfo)
                .collect(Collectors.toList());
    }

    public List<TableGeneratorInfo> listTableGenerators() {
        return registryFactory.snapshot().tableGenerators().stream()
                .map(capabilityMapper::toTableGeneratorInfo)
                .collect(Collectors.toList());
    }
}
