package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.dto.RowFilter;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.util.RowValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 列表和全选批量操作使用的行过滤条件，条件之间为 AND
 */
public final class RowFilters {

    private RowFilters() {
    }

    /**
     * @throws ValidationException 条件引用了未知列或缺少必需的操作数时
     */
    public static Predicate<DataRow> compile(List<RowFilter> filters, List<TableColumn> columns) {
        if (filters == null || filters.isEmpty()) {
            return row -> true;
        }
        List<FieldError> errors = new ArrayList<>();
        for (RowFilter filter : filters) {
            boolean known = columns.stream().anyMatch(c -> c.getName().equals(filter.getColumn()));
            if (!known) {
                errors.add(new FieldError(filter.getColumn(), filter.getValue(), "Unknown filter column"));
            } else if (filter.getOperator() == null) {
                errors.add(new FieldError(filter.getColumn(), filter.getValue(), "Filter operator is required"));
            } else if (needsOperand(filter) && RowValues.isBlank(filter.getValue())) {
                errors.add(new FieldError(filter.getColumn(), null, "Filter value is required"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid filters", errors);
        }
        List<Predicate<DataRow>> predicates = filters.stream().map(RowFilters::toPredicate).collect(Collectors.toList());
        return row -> predicates.stream().allMatch(p -> p.test(row));
    }

    private static boolean needsOperand(RowFilter filter) {
        switch (filter.getOperator()) {
            case EMPTY:
            case NOT_EMPTY:
                return false;
            default:
                return true;
        }
    }

    private static Predicate<DataRow> toPredicate(RowFilter filter) {
        String column = filter.getColumn();
        Object operand = filter.getValue();
        switch (filter.getOperator()) {
            case EQ:
                return row -> equalsLoosely(row.getData().get(column), operand);
            case CONTAINS:
                String needle = String.valueOf(operand).toLowerCase(Locale.ROOT);
                return row -> {
                    Object value = row.getData().get(column);
                    return value != null && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle);
                };
            case GT:
                return row -> compare(row.getData().get(column), operand).map(c -> c > 0).orElse(false);
            case LT:
                return row -> compare(row.getData().get(column), operand).map(c -> c < 0).orElse(false);
            case EMPTY:
                return row -> RowValues.isBlank(row.getData().get(column));
            case NOT_EMPTY:
                return row -> !RowValues.isBlank(row.getData().get(column));
            default:
                throw new IllegalStateException("Unhandled filter operator " + filter.getOperator());
        }
    }

    private static boolean equalsLoosely(Object value, Object operand) {
        if (value == null) {
            return false;
        }
        Optional<BigDecimal> left = RowValues.toDecimal(value);
        Optional<BigDecimal> right = RowValues.toDecimal(operand);
        if (value instanceof Number && left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get()) == 0;
        }
        return String.valueOf(value).equalsIgnoreCase(String.valueOf(operand));
    }

    private static Optional<Integer> compare(Object value, Object operand) {
        Optional<BigDecimal> left = RowValues.toDecimal(value);
        Optional<BigDecimal> right = RowValues.toDecimal(operand);
        if (left.isPresent() && right.isPresent()) {
            return Optional.of(left.get().compareTo(right.get()));
        }
        if (value == null || operand == null) {
            return Optional.empty();
        }
        // ISO 日期和时间按字符串比较即可得到正确顺序
        return Optional.of(String.valueOf(value).compareTo(String.valueOf(operand)));
    }
}
