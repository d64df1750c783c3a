package com.dyntable.tableservice.support;

import com.dyntable.module.spi.ColumnTemplate;
import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.module.spi.TableGeneratorDefinition;
import com.dyntable.module.spi.TypeIds;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Small module contributing an {@code acme:sku} column type, a generator and a table template.
 */
public final class SkuTestModule {

    public static final String MODULE_ID = "acme";
    public static final String SKU_TYPE = TypeIds.qualify(MODULE_ID, "sku");

    private static final Pattern SKU = Pattern.compile("^[A-Z]{3}-\\d{3}$");

    private SkuTestModule() {
    }

    public static ModuleCapabilities capabilities() {
        ValueGenerator skuGenerator = context -> String.format("SKU-%03d", context.getRowIndex() + 1);
        return ModuleCapabilities.builder()
                .columnType(new SkuType(skuGenerator))
                .generator("sku", skuGenerator)
                .tableGenerator(TableGeneratorDefinition.builder()
                        .id("catalog")
                        .displayName("Catalog")
                        .description("Products keyed by SKU")
                        .targetPurpose("sale")
                        .defaultRowCount(5)
                        .column(ColumnTemplate.builder().name("sku").type(SKU_TYPE).required(true)
                                .allowDuplicates(false).generatorId(TypeIds.qualify(MODULE_ID, "sku")).build())
                        .column(ColumnTemplate.builder().name("name").type("text").generatorId("product-name").build())
                        .build())
                .build();
    }

    static final class SkuType implements ColumnTypeHandler {

        private final ValueGenerator generator;

        SkuType(ValueGenerator generator) {
            this.generator = generator;
        }

        @Override
        public String typeId() {
            return "sku";
        }

        @Override
        public String displayName() {
            return "SKU";
        }

        @Override
        public ValidationResult validate(Object value, Map<String, Object> options) {
            return SKU.matcher(String.valueOf(value).toUpperCase()).matches()
                    ? ValidationResult.ok()
                    : ValidationResult.failure("Invalid SKU", "Use the form ABC-123");
        }

        @Override
        public String format(Object value, Map<String, Object> options) {
            return value == null ? "" : String.valueOf(value);
        }

        @Override
        public Object parse(String input, Map<String, Object> options) {
            return input.trim().toUpperCase();
        }

        @Override
        public Optional<ValueGenerator> generator() {
            return Optional.of(generator);
        }
    }
}
