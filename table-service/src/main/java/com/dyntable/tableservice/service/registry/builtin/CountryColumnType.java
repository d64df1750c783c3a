package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 两位或三位字母的国家代码，以大写存储。只校验格式
 */
public class CountryColumnType implements ColumnTypeHandler {

    @Override
    public String typeId() {
        return "country";
    }

    @Override
    public String displayName() {
        return "Country";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        String code = String.valueOf(value).trim();
        if (!code.matches("[A-Za-z]{2,3}")) {
            return ValidationResult.failure("Must be 2-3 letter country code",
                    "Use 2-letter ISO code (e.g., US, GB, DE)");
        }
        return ValidationResult.ok();
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        return input.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        if (value == null) {
            return "";
        }
        String code = String.valueOf(value).toUpperCase(Locale.ROOT);
        if (code.length() == 2) {
            String name = new Locale("", code).getDisplayCountry(Locale.ENGLISH);
            if (!name.isEmpty() && !name.equals(code)) {
                return code + " (" + name + ")";
            }
        }
        return code;
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> SampleData.pick(context.getRandom(), SampleData.COUNTRIES));
    }
}
