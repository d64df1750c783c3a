package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.ImportRequest;
import com.dyntable.tableservice.dto.ImportResult;
import com.dyntable.tableservice.dto.ImportRowError;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.exception.TableEngineException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;
import com.dyntable.tableservice.service.registry.CapabilityRegistryFactory;
import com.dyntable.tableservice.service.schema.ColumnNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 已解析行的批量导入。文件解码在别处完成；
 * 每一行都经过常规流程创建，各自独立失败
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowImportService {

    private final TableDataStore store;
    private final TableAccessGuard accessGuard;
    private final CapabilityRegistryFactory registryFactory;
    private final RowMutationService rowMutationService;
    private final EngineProperties properties;

    public ImportResult importRows(String tableId, ImportRequest request, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        List<List<Object>> rows = request.getRows() != null ? request.getRows() : List.of();
        int limit = properties.getImport().getMaxRows();
        if (rows.size() > limit) {
            throw new ValidationException(String.format("Import has %d rows, the limit is %d", rows.size(), limit));
        }

        List<TableColumn> columns = store.findColumns(tableId);
        List<String> unmapped = new ArrayList<>();
        List<TableColumn> mapping = mapColumns(request, columns, unmapped);
        if (mapping.stream().allMatch(column -> column == null)) {
            throw new ValidationException("No import column matches a table column");
        }

        CapabilityRegistry registry = registryFactory.snapshot();
        List<ImportRowError> errors = new ArrayList<>();
        int imported = 0;
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> input = toInput(rows.get(i), mapping);
            try {
                rowMutationService.create(table, columns, input, actor, MutationOptions.none(), registry);
                imported++;
            } catch (TableEngineException e) {
                errors.add(ImportRowError.builder()
                        .rowNumber(i + 1)
                        .message(e.getMessage())
                        .errors(e.getErrors())
                        .build());
            }
        }

        log.info("Imported {} of {} rows into table {} by {}", imported, rows.size(), tableId, actor.getId());
        return ImportResult.builder()
                .totalRows(rows.size())
                .imported(imported)
                .failed(errors.size())
                .rowErrors(errors)
                .unmappedHeaders(unmapped)
                .build();
    }

    /**
     * 每个导入单元格位置一项；不导入的位置为 {@code null}
     */
    private List<TableColumn> mapColumns(ImportRequest request, List<TableColumn> columns, List<String> unmapped) {
        List<TableColumn> mapping = new ArrayList<>();
        if (!request.isHasHeaders() || request.getHeaders() == null) {
            mapping.addAll(columns);
            return mapping;
        }
        for (String header : request.getHeaders()) {
            Optional<TableColumn> column = findColumn(header, columns);
            if (column.isEmpty() || mapping.contains(column.get())) {
                unmapped.add(header);
                mapping.add(null);
            } else {
                mapping.add(column.get());
            }
        }
        return mapping;
    }

    private static Optional<TableColumn> findColumn(String header, List<TableColumn> columns) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        String repaired = ColumnNames.repair(trimmed);
        return columns.stream()
                .filter(c -> c.getName().equals(trimmed)
                        || c.getDisplayName().equalsIgnoreCase(trimmed)
                        || c.getName().equalsIgnoreCase(repaired))
                .findFirst();
    }

    private static Map<String, Object> toInput(List<Object> cells, List<TableColumn> mapping) {
        Map<String, Object> input = new LinkedHashMap<>();
        if (cells == null) {
            return input;
        }
        for (int i = 0; i < cells.size() && i < mapping.size(); i++) {
            TableColumn column = mapping.get(i);
            if (column != null) {
                input.put(column.getName(), cells.get(i));
            }
        }
        return input;
    }
}
