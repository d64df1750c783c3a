package com.dyntable.tableservice.service.coercion;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;
import com.dyntable.tableservice.service.registry.builtin.BooleanColumnType;
import com.dyntable.tableservice.service.registry.builtin.DateFormats;
import com.dyntable.tableservice.service.registry.builtin.NumericColumnType;
import com.dyntable.tableservice.util.RowValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * 将原始输入转换为列类型的存储形式
 *
 * 错误输入不抛异常：所有拒绝都以失败的 {@link CoercionResult} 返回。
 * 数值必须在 double 范围内；国家代码由国家类型校验（2-3 个字母）。
 * 只有无法解析的类型 id 会通过 {@link CapabilityRegistry#resolve(String)} 抛出异常
 */
@Slf4j
@Component
public class ValueCoercer {

    public CoercionResult coerce(Object raw, String typeId, CapabilityRegistry registry) {
        if (RowValues.isBlank(raw)) {
            return CoercionResult.of(null);
        }
        ColumnTypeHandler handler = registry.resolve(typeId);

        if (handler instanceof NumericColumnType) {
            return coerceNumber(raw, handler);
        }
        if (handler instanceof BooleanColumnType) {
            return BooleanColumnType.read(raw)
                    .map(CoercionResult::of)
                    .orElseGet(() -> CoercionResult.failure(
                            String.format("Invalid boolean: \"%s\"", raw), "Use true/false, yes/no, or 1/0"));
        }
        if ("date".equals(typeId)) {
            return DateFormats.parse(String.valueOf(raw))
                    .map(date -> CoercionResult.of(DateFormats.toIso(date)))
                    .orElseGet(() -> CoercionResult.failure(
                            String.format("Invalid date: \"%s\"", raw), "Use format: YYYY-MM-DD (e.g., 2024-01-15)"));
        }
        return viaHandler(String.valueOf(raw).trim(), handler);
    }

    private CoercionResult coerceNumber(Object raw, ColumnTypeHandler handler) {
        Optional<BigDecimal> number = RowValues.toDecimal(raw);
        if (number.isEmpty()) {
            return CoercionResult.failure(String.format("Invalid number: \"%s\"", raw), "Remove non-numeric characters");
        }
        if (Double.isInfinite(number.get().doubleValue())) {
            return CoercionResult.failure(String.format("Number out of range: \"%s\"", raw), "Use a smaller value");
        }
        ValidationResult result = handler.validate(number.get(), Map.of());
        if (!result.isValid()) {
            return CoercionResult.failure(result.getError(), result.getSuggestion());
        }
        return CoercionResult.of(RowValues.normalize(number.get()));
    }

    private CoercionResult viaHandler(String text, ColumnTypeHandler handler) {
        ValidationResult result = handler.validate(text, Map.of());
        if (!result.isValid()) {
            return CoercionResult.failure(result.getError(), result.getSuggestion());
        }
        try {
            return CoercionResult.of(handler.parse(text, Map.of()));
        } catch (RuntimeException e) {
            // 校验通过却无法解析说明类型实现有缺陷
            log.warn("Column type {} accepted but failed to parse value: {}", handler.typeId(), e.getMessage());
            return CoercionResult.failure("Invalid value for " + handler.displayName(), null);
        }
    }
}
