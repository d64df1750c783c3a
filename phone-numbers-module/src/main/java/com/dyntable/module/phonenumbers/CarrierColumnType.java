package com.dyntable.module.phonenumbers;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Telecom carrier name picked from a fixed list.
 */
public class CarrierColumnType implements ColumnTypeHandler {

    public static final String TAG = "carrier";

    static final List<String> CARRIERS = List.of(
            "AT&T", "Verizon", "T-Mobile", "US Cellular", "Vodafone", "O2", "EE", "Three",
            "Deutsche Telekom", "Orange", "SFR", "Bouygues", "Telstra", "Optus",
            "NTT Docomo", "SoftBank", "KDDI", "Other");

    @Override
    public String typeId() {
        return TAG;
    }

    @Override
    public String displayName() {
        return "Carrier";
    }

    @Override
    public String category() {
        return "Telecom";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        String name = String.valueOf(value).trim();
        boolean known = CARRIERS.stream().anyMatch(carrier -> carrier.equalsIgnoreCase(name));
        if (!known) {
            return ValidationResult.failure("Unknown carrier: " + name, "Use one of " + String.join(", ", CARRIERS));
        }
        return ValidationResult.ok();
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        String name = input.trim();
        return CARRIERS.stream()
                .filter(carrier -> carrier.equalsIgnoreCase(name))
                .findFirst()
                .orElse(name);
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> CARRIERS.get(context.getRandom().nextInt(CARRIERS.size())));
    }
}
