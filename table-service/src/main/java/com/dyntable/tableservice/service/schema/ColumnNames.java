package com.dyntable.tableservice.service.schema;

import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 显示名称（"Unit Price"）与内部驼峰名称（"unitPrice"）之间的转换
 */
public final class ColumnNames {

    private static final Pattern DISPLAY_NAME = Pattern.compile("^[A-Za-z ]+$");
    private static final Pattern INTERNAL_NAME = Pattern.compile("^[a-z][A-Za-z]*$");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z])(?=[A-Z])");

    private ColumnNames() {
    }

    /**
     * @throws ValidationException 输入为空或包含拉丁字母和空格以外的字符时
     */
    public static String toInternalName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            throw invalid(displayName, "Column name is required");
        }
        if (!DISPLAY_NAME.matcher(displayName).matches()) {
            throw invalid(displayName, "Column name may only contain Latin letters and spaces");
        }
        String name = camelCase(List.of(displayName.trim().split("\\s+")));
        if (name.isEmpty()) {
            throw invalid(displayName, "Column name is required");
        }
        return name;
    }

    public static String toDisplayName(String internalName) {
        if (internalName == null || internalName.isEmpty()) {
            return "";
        }
        String spaced = CAMEL_BOUNDARY.matcher(internalName).replaceAll(" ");
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    public static boolean isValidInternalName(String name) {
        return name != null && INTERNAL_NAME.matcher(name).matches();
    }

    /**
     * 尽力将旧名称或导入的名称转为驼峰形式，不抛异常。
     * 数字和标点作为分词符，其他字符被丢弃
     *
     * @return 修复后的名称；没有可用字符时返回 {@code column}
     */
    public static String repair(String name) {
        if (name == null) {
            return "column";
        }
        List<String> words = new ArrayList<>();
        for (String part : name.split("[^A-Za-z]+")) {
            if (part.isEmpty()) {
                continue;
            }
            for (String word : CAMEL_BOUNDARY.split(part)) {
                words.add(word);
            }
        }
        String repaired = camelCase(words);
        return repaired.isEmpty() ? "column" : repaired;
    }

    private static String camelCase(List<String> words) {
        StringBuilder result = new StringBuilder();
        for (String raw : words) {
            if (raw.isEmpty()) {
                continue;
            }
            // SKU 这类缩写视为一个词
            String word = raw.length() > 1 && raw.equals(raw.toUpperCase(Locale.ROOT))
                    ? raw.toLowerCase(Locale.ROOT) : raw;
            if (result.length() == 0) {
                result.append(Character.toLowerCase(word.charAt(0))).append(word.substring(1));
            } else {
                result.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return result.toString();
    }

    private static ValidationException invalid(String name, String reason) {
        return new ValidationException(reason, List.of(new FieldError("name", name, reason)));
    }
}
