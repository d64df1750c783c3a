package com.dyntable.module.phonenumbers;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DID (Direct Inward Dialing) number with country-specific validation and formatting.
 *
 * Options: {@code country} (default US), {@code allowExtension} (default false).
 */
public class DidColumnType implements ColumnTypeHandler {

    public static final String TAG = "did";

    private static final Pattern EXTENSION = Pattern.compile("\\s*[xX]\\.?\\s*(\\d+)$");

    private final PhoneNumberGenerator generator;

    public DidColumnType(PhoneNumberGenerator generator) {
        this.generator = generator;
    }

    @Override
    public String typeId() {
        return TAG;
    }

    @Override
    public String displayName() {
        return "DID Number";
    }

    @Override
    public String category() {
        return "Telecom";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        if (!(value instanceof String number)) {
            return ValidationResult.failure("DID must be a string");
        }
        String country = country(options);
        Optional<DialPlan> plan = DialPlan.of(country);
        if (plan.isEmpty()) {
            return ValidationResult.failure("Unsupported country: " + country);
        }

        String main = number;
        Matcher ext = EXTENSION.matcher(number);
        if (ext.find()) {
            if (!Boolean.parseBoolean(String.valueOf(options.getOrDefault("allowExtension", "false")))) {
                return ValidationResult.failure("Extension numbers are not allowed");
            }
            main = number.substring(0, ext.start());
        }

        if (!plan.get().matches(main)) {
            return ValidationResult.failure("Invalid " + plan.get().name() + " phone number format",
                    "Use format: " + plan.get().dialCode() + " followed by the national number");
        }
        return ValidationResult.ok();
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        if (value == null) {
            return "";
        }
        String text = String.valueOf(value);
        Optional<DialPlan> plan = DialPlan.of(country(options));
        if (plan.isEmpty() || text.isBlank()) {
            return text;
        }
        Matcher ext = EXTENSION.matcher(text);
        if (ext.find()) {
            return plan.get().format(text.substring(0, ext.start())) + " x" + ext.group(1);
        }
        return plan.get().format(text);
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        String cleaned = input.trim();
        if (cleaned.startsWith("+")) {
            return cleaned;
        }
        return DialPlan.of(country(options))
                .map(plan -> plan.dialCode() + cleaned.replaceAll("\\D", ""))
                .orElse(cleaned);
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(generator);
    }

    private static String country(Map<String, Object> options) {
        Object country = options.get("country");
        return country != null ? String.valueOf(country) : "US";
    }
}
