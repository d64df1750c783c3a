package com.dyntable.module.phonenumbers;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Per-country numbering rules used for validating, formatting and generating DID numbers.
 */
public enum DialPlan {

    US("+1", "^\\+?1?[-.\\s]?\\(?([0-9]{3})\\)?[-.\\s]?([0-9]{3})[-.\\s]?([0-9]{4})$", 7,
            new int[][]{{201, 989}},
            digits -> {
                String d = last(digits, 10);
                if (d.length() < 10) {
                    return "+1 " + d;
                }
                return "+1 (" + d.substring(0, 3) + ") " + d.substring(3, 6) + "-" + d.substring(6);
            }),
    GB("+44", "^\\+?(44)?[-.\\s]?0?([0-9]{2,5})[-.\\s]?([0-9]{3,4})[-.\\s]?([0-9]{3,4})$", 8,
            new int[][]{{20, 29}, {113, 119}, {121, 129}, {131, 139}, {141, 149}, {151, 159}, {161, 169}},
            digits -> {
                String d = national(digits, "44");
                return "+44 " + head(d, 4) + " " + tail(d, 4);
            }),
    DE("+49", "^\\+?(49)?[-.\\s]?0?([0-9]{2,5})[-.\\s]?([0-9]{3,8})$", 7,
            new int[][]{{30, 39}, {40, 49}, {69, 69}, {89, 89}, {211, 219}, {221, 229}},
            digits -> {
                String d = national(digits, "49");
                return "+49 " + head(d, 3) + " " + tail(d, 3);
            }),
    FR("+33", "^\\+?(33)?[-.\\s]?0?([0-9])[-.\\s]?([0-9]{2})[-.\\s]?([0-9]{2})[-.\\s]?([0-9]{2})[-.\\s]?([0-9]{2})$", 8,
            new int[][]{{1, 5}},
            digits -> {
                String d = national(digits, "33");
                if (d.length() < 9) {
                    return "+33 " + d;
                }
                return "+33 " + d.charAt(0) + " " + d.substring(1, 3) + " " + d.substring(3, 5) + " "
                        + d.substring(5, 7) + " " + d.substring(7);
            }),
    AU("+61", "^\\+?(61)?[-.\\s]?0?([0-9])[-.\\s]?([0-9]{4})[-.\\s]?([0-9]{4})$", 8,
            new int[][]{{2, 3}, {7, 8}},
            digits -> {
                String d = national(digits, "61");
                return "+61 " + head(d, 1) + " " + (d.length() > 5 ? d.substring(1, 5) + " " + d.substring(5) : tail(d, 1));
            }),
    JP("+81", "^\\+?(81)?[-.\\s]?0?([0-9]{1,4})[-.\\s]?([0-9]{1,4})[-.\\s]?([0-9]{4})$", 8,
            new int[][]{{3, 3}, {6, 6}, {45, 45}, {52, 52}, {75, 75}, {78, 78}, {92, 92}},
            digits -> {
                String d = national(digits, "81");
                if (d.length() < 8) {
                    return "+81 " + d;
                }
                return "+81 " + d.substring(0, 3) + "-" + d.substring(3, 7) + "-" + d.substring(7);
            });

    private final String dialCode;
    private final Pattern pattern;
    private final int subscriberLength;
    private final int[][] areaCodeRanges;
    private final Function<String, String> formatter;

    DialPlan(String dialCode, String regex, int subscriberLength, int[][] areaCodeRanges,
             Function<String, String> formatter) {
        this.dialCode = dialCode;
        this.pattern = Pattern.compile(regex);
        this.subscriberLength = subscriberLength;
        this.areaCodeRanges = areaCodeRanges;
        this.formatter = formatter;
    }

    public static Optional<DialPlan> of(String country) {
        if (country == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(plan -> plan.name().equalsIgnoreCase(country.trim()))
                .findFirst();
    }

    public String dialCode() {
        return dialCode;
    }

    public int subscriberLength() {
        return subscriberLength;
    }

    public int[][] areaCodeRanges() {
        return areaCodeRanges;
    }

    public boolean matches(String number) {
        return pattern.matcher(number.trim()).matches();
    }

    public String format(String number) {
        return formatter.apply(number.replaceAll("\\D", ""));
    }

    private static String last(String digits, int count) {
        return digits.length() > count ? digits.substring(digits.length() - count) : digits;
    }

    private static String national(String digits, String countryCode) {
        String d = digits.startsWith(countryCode) ? digits.substring(countryCode.length()) : digits;
        return d.startsWith("0") ? d.substring(1) : d;
    }

    private static String head(String digits, int count) {
        return digits.substring(0, Math.min(count, digits.length()));
    }

    private static String tail(String digits, int from) {
        return from < digits.length() ? digits.substring(from) : "";
    }
}
