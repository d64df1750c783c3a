package com.dyntable.tableservice.service.registry.builtin;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * 可接受的日期写法。年份在后的斜杠和短横线格式按美式月份在前解析
 */
public final class DateFormats {

    private static final DateTimeFormatter ISO = strict("uuuu-MM-dd");

    private static final List<DateTimeFormatter> ALTERNATIVES = List.of(
            strict("M/d/uuuu"),
            strict("M-d-uuuu"),
            strict("uuuu/M/d"),
            strict("d.M.uuuu"));

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;

    private DateFormats() {
    }

    public static Optional<LocalDate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        if (value.matches("\\d{4}-\\d{2}-\\d{2}")) {
            return tryParse(value, ISO);
        }
        for (DateTimeFormatter formatter : ALTERNATIVES) {
            Optional<LocalDate> date = tryParse(value, formatter)
                    .filter(d -> d.getYear() >= MIN_YEAR && d.getYear() <= MAX_YEAR);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    public static String toIso(LocalDate date) {
        return ISO.format(date);
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
