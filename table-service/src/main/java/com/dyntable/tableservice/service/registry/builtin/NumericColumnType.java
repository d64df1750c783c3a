package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;
import com.dyntable.tableservice.util.RowValues;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * 数值类型族。所有成员都解析为规范数值（整数为 Long，
 * 否则为 Double），区别只在取值范围和精度规则
 */
public class NumericColumnType implements ColumnTypeHandler {

    public enum Kind {
        NUMBER("number", "Number"),
        INTEGER("integer", "Integer"),
        FLOAT("float", "Decimal"),
        CURRENCY("currency", "Currency"),
        PERCENTAGE("percentage", "Percentage"),
        RATING("rating", "Rating");

        private final String typeId;
        private final String displayName;

        Kind(String typeId, String displayName) {
            this.typeId = typeId;
            this.displayName = displayName;
        }
    }

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal FIVE = BigDecimal.valueOf(5);

    private final Kind kind;

    public NumericColumnType(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String typeId() {
        return kind.typeId;
    }

    @Override
    public String displayName() {
        return kind.displayName;
    }

    @Override
    public String category() {
        return "Number";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        Optional<BigDecimal> parsed = RowValues.toDecimal(value);
        if (parsed.isEmpty()) {
            return ValidationResult.failure(
                    kind == Kind.FLOAT ? "Must be a decimal number" : "Must be a number",
                    "Remove non-numeric characters");
        }
        BigDecimal number = parsed.get();
        switch (kind) {
            case INTEGER:
                if (!isWhole(number)) {
                    return ValidationResult.failure("Must be an integer", "Remove the decimal part");
                }
                break;
            case CURRENCY:
                if (number.stripTrailingZeros().scale() > 2) {
                    return ValidationResult.failure("Currency must have at most 2 decimal places",
                            "Round to cents, e.g. " + number.setScale(2, RoundingMode.HALF_UP).toPlainString());
                }
                break;
            case PERCENTAGE:
                if (number.signum() < 0 || number.compareTo(HUNDRED) > 0) {
                    return ValidationResult.failure("Percentage must be between 0 and 100");
                }
                break;
            case RATING:
                boolean wholeScale = isWhole(number) && number.compareTo(BigDecimal.ONE) >= 0 && number.compareTo(FIVE) <= 0;
                boolean unitScale = number.signum() >= 0 && number.compareTo(BigDecimal.ONE) <= 0;
                if (!wholeScale && !unitScale) {
                    return ValidationResult.failure("Rating must be a whole number from 1 to 5 or a value from 0 to 1");
                }
                break;
            default:
                break;
        }
        return ValidationResult.ok();
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        return RowValues.toDecimal(input)
                .<Object>map(RowValues::normalize)
                .orElseThrow(() -> new IllegalArgumentException("Not a number: " + input));
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        if (value == null) {
            return "";
        }
        return RowValues.toDecimal(value)
                .map(number -> kind == Kind.CURRENCY
                        ? number.setScale(2, RoundingMode.HALF_UP).toPlainString()
                        : number.stripTrailingZeros().toPlainString())
                .orElse(String.valueOf(value));
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> {
            switch (kind) {
                case INTEGER:
                    return (long) context.getRandom().nextInt(100);
                case RATING:
                    return 1L + context.getRandom().nextInt(5);
                case PERCENTAGE:
                    return (long) context.getRandom().nextInt(101);
                default:
                    BigDecimal amount = BigDecimal.valueOf(100 + context.getRandom().nextInt(9900), 2);
                    return RowValues.normalize(amount);
            }
        });
    }

    private static boolean isWhole(BigDecimal number) {
        return number.stripTrailingZeros().scale() <= 0;
    }
}
