package com.dyntable.tableservice.service.generator;

import com.dyntable.module.spi.ColumnTemplate;
import com.dyntable.module.spi.GenerationContext;
import com.dyntable.module.spi.TableGeneratorDefinition;
import com.dyntable.module.spi.ValueGenerator;
import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.CreateTableRequest;
import com.dyntable.tableservice.dto.GenerateTableRequest;
import com.dyntable.tableservice.dto.GeneratedTableResult;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.ColumnRole;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableEngineException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;
import com.dyntable.tableservice.service.registry.CapabilityRegistryFactory;
import com.dyntable.tableservice.service.registry.RegisteredTableGenerator;
import com.dyntable.tableservice.service.row.RowMutationService;
import com.dyntable.tableservice.service.schema.TableSchemaService;
import com.dyntable.tableservice.service.schema.TableService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * 根据已注册的模板建表并填充生成的数据行
 * 行的创建与普通写入一样经过行处理流程
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableGeneratorService {

    private static final int MAX_REPORTED_ERRORS = 20;

    private final CapabilityRegistryFactory registryFactory;
    private final TableService tableService;
    private final TableSchemaService schemaService;
    private final RowMutationService rowMutationService;
    private final TableDataStore store;
    private final EngineProperties properties;

    public GeneratedTableResult generateTable(GenerateTableRequest request, Actor actor) {
        CapabilityRegistry registry = registryFactory.snapshot();
        TableGeneratorDefinition definition = registry.findTableGenerator(request.getGeneratorId())
                .map(RegisteredTableGenerator::getDefinition)
                .orElseThrow(() -> new ResourceNotFoundException("Table generator", request.getGeneratorId()));

        int rowCount = request.getRowCount() != null ? request.getRowCount() : definition.getDefaultRowCount();
        int maxRows = properties.getGenerator().getMaxRows();
        if (rowCount < 0 || rowCount > maxRows) {
            throw new ValidationException(String.format("Row count must be between 0 and %d", maxRows));
        }
        List<String> unknownTypes = definition.getColumns().stream()
                .map(ColumnTemplate::getType)
                .filter(type -> !registry.isResolvable(type))
                .distinct()
                .toList();
        if (!unknownTypes.isEmpty()) {
            throw new ValidationException("Template uses unavailable column types: " + String.join(", ", unknownTypes));
        }

        UserTable table = tableService.createTable(CreateTableRequest.builder()
                .name(request.getTableName())
                .description(definition.getDescription())
                .visibility(request.getVisibility())
                .purpose(TablePurpose.fromValue(definition.getTargetPurpose()))
                .build(), actor);
        schemaService.ensureColumns(table, definition.getColumns());
        List<TableColumn> columns = store.findColumns(table.getId());

        Map<String, ColumnTemplate> templates = new LinkedHashMap<>();
        definition.getColumns().forEach(template -> templates.put(template.getName(), template));

        Random random = request.getSeed() != null ? new Random(request.getSeed()) : new Random();
        int created = 0;
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            Map<String, Object> input = new LinkedHashMap<>();
            for (TableColumn column : columns) {
                Optional<ValueGenerator> generator = generatorFor(column, templates.get(column.getName()), registry);
                if (generator.isPresent()) {
                    GenerationContext context = GenerationContext.builder()
                            .random(random)
                            .rowIndex(i)
                            .columnName(column.getName())
                            .build();
                    input.put(column.getName(), generator.get().generate(context));
                }
            }
            try {
                rowMutationService.createRow(table.getId(), input, actor);
                created++;
            } catch (TableEngineException e) {
                if (errors.size() < MAX_REPORTED_ERRORS) {
                    errors.add(String.format("Row %d: %s", i + 1, e.getMessage()));
                }
            }
        }

        log.info("Generated table {} from {}: {} rows created, {} failed", table.getId(),
                request.getGeneratorId(), created, rowCount - created);
        return GeneratedTableResult.builder()
                .table(table)
                .columns(columns)
                .rowsCreated(created)
                .rowsFailed(rowCount - created)
                .errors(errors)
                .build();
    }

    /**
     * 优先使用模板指定的生成器，其次是商业角色默认值，最后是列类型自带的生成器
     */
    private Optional<ValueGenerator> generatorFor(TableColumn column, ColumnTemplate template,
                                                  CapabilityRegistry registry) {
        if (template != null && template.getGeneratorId() != null) {
            Optional<ValueGenerator> generator = registry.findGenerator(template.getGeneratorId());
            if (generator.isPresent()) {
                return generator;
            }
            log.warn("Value generator {} not found for column {}", template.getGeneratorId(), column.getName());
        }
        Optional<ColumnRole> role = ColumnRole.of(column.getName());
        if (role.isPresent()) {
            switch (role.get()) {
                case PRICE:
                    return Optional.of(context -> BigDecimal.valueOf(500 + context.getRandom().nextInt(9500), 2));
                case QUANTITY:
                    return Optional.of(context -> 1 + context.getRandom().nextInt(50));
                case FEE:
                    return Optional.of(context -> BigDecimal.valueOf(context.getRandom().nextInt(2000), 2));
                case USED:
                    return Optional.of(context -> Boolean.FALSE);
                case AVAILABLE:
                    return Optional.of(context -> Boolean.TRUE);
                default:
                    break;
            }
        }
        return registry.findGenerator(column.getType());
    }
}
