package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTemplate;
import com.dyntable.module.spi.GenerationContext;
import com.dyntable.module.spi.TableGeneratorDefinition;
import com.dyntable.module.spi.ValueGenerator;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 始终可用的列类型、值生成器和表模板
 */
public final class BuiltInCapabilities {

    public static final Set<String> BUILT_IN_TYPE_IDS = Set.of(
            "text", "textarea", "number", "integer", "float", "currency", "percentage",
            "date", "time", "datetime", "boolean", "email", "url", "phone", "country",
            "select", "rating", "color");

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9\\s\\-().]{7,20}$");
    private static final Pattern COLOR = Pattern.compile("^#?([0-9A-Fa-f]{3}|[0-9A-Fa-f]{6}|[0-9A-Fa-f]{8})$");

    private static final ValueGenerator PRODUCT_NAME = context -> SampleData.pick(context.getRandom(), SampleData.ADJECTIVES)
            + " " + SampleData.pick(context.getRandom(), SampleData.NOUNS) + " " + (context.getRowIndex() + 1);
    private static final ValueGenerator PERSON_NAME = context -> SampleData.pick(context.getRandom(), SampleData.FIRST_NAMES)
            + " " + SampleData.pick(context.getRandom(), SampleData.LAST_NAMES);
    private static final ValueGenerator EMAIL_ADDRESS = BuiltInCapabilities::email;
    private static final ValueGenerator CATEGORY = context -> SampleData.pick(context.getRandom(), SampleData.CATEGORIES);
    private static final ValueGenerator QUANTITY = context -> (long) context.getRandom().nextInt(50) + 1;
    private static final ValueGenerator SENTENCE = context -> "Sample " + SampleData.pick(context.getRandom(), SampleData.NOUNS)
            .toLowerCase(Locale.ROOT) + " in good condition";

    private BuiltInCapabilities() {
    }

    public static void registerAll(CapabilityRegistry.Builder builder) {
        builder.builtInType(new TextColumnType("text", "Text", 1000, PRODUCT_NAME))
                .builtInType(new TextColumnType("textarea", "Long Text", 10000, SENTENCE))
                .builtInType(new TextColumnType("select", "Select", 255, CATEGORY));
        for (NumericColumnType.Kind kind : NumericColumnType.Kind.values()) {
            builder.builtInType(new NumericColumnType(kind));
        }
        builder.builtInType(new DateColumnType())
                .builtInType(new TimeColumnType())
                .builtInType(new DateTimeColumnType())
                .builtInType(new BooleanColumnType())
                .builtInType(new CountryColumnType())
                .builtInType(new PatternColumnType("email", "Email", EMAIL.asPredicate(), "Invalid email format",
                        value -> value.contains("@") ? null : "Add @ symbol and domain (e.g., user@example.com)",
                        EMAIL_ADDRESS))
                .builtInType(new PatternColumnType("url", "URL", BuiltInCapabilities::isWebUrl, "Invalid URL format",
                        value -> value.startsWith("http") ? null : "Try adding https:// prefix: https://" + value,
                        context -> "https://example.com/items/" + (context.getRowIndex() + 1)))
                .builtInType(new PatternColumnType("phone", "Phone", PHONE.asPredicate(), "Invalid phone number format",
                        value -> "Use format: +1234567890 or (123) 456-7890",
                        context -> String.format("+1 555 %03d %04d",
                                context.getRandom().nextInt(1000), context.getRandom().nextInt(10000))))
                .builtInType(new PatternColumnType("color", "Color", COLOR.asPredicate(),
                        "Invalid color format (use #RGB, #RRGGBB, or #RRGGBBAA)",
                        value -> "Use hex format: #RGB or #RRGGBB (e.g., #ff0000)",
                        context -> String.format("#%06x", context.getRandom().nextInt(0x1000000))));

        builder.builtInGenerator("product-name", PRODUCT_NAME)
                .builtInGenerator("person-name", PERSON_NAME)
                .builtInGenerator("email-address", EMAIL_ADDRESS)
                .builtInGenerator("category", CATEGORY)
                .builtInGenerator("quantity", QUANTITY);

        builder.builtInTableGenerator(products())
                .builtInTableGenerator(rentals())
                .builtInTableGenerator(contacts());
    }

    private static boolean isWebUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return scheme != null && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static Object email(GenerationContext context) {
        String first = SampleData.pick(context.getRandom(), SampleData.FIRST_NAMES).toLowerCase(Locale.ROOT);
        String last = SampleData.pick(context.getRandom(), SampleData.LAST_NAMES).toLowerCase(Locale.ROOT);
        return first + "." + last + (context.getRowIndex() + 1) + "@example.com";
    }

    private static TableGeneratorDefinition products() {
        return TableGeneratorDefinition.builder()
                .id("products")
                .displayName("Product Catalog")
                .description("Items for sale with price and stock")
                .targetPurpose("sale")
                .column(ColumnTemplate.builder().name("name").type("text").required(true)
                        .allowDuplicates(false).generatorId("product-name").build())
                .column(ColumnTemplate.builder().name("description").type("textarea").build())
                .column(ColumnTemplate.builder().name("category").type("select").generatorId("category").build())
                .column(ColumnTemplate.builder().name("price").type("number").required(true).build())
                .column(ColumnTemplate.builder().name("qty").type("integer").required(true)
                        .generatorId("quantity").build())
                .build();
    }

    private static TableGeneratorDefinition rentals() {
        return TableGeneratorDefinition.builder()
                .id("rentals")
                .displayName("Rental Items")
                .description("Items for rent with price, fee and availability")
                .targetPurpose("rent")
                .defaultRowCount(15)
                .column(ColumnTemplate.builder().name("name").type("text").required(true)
                        .generatorId("product-name").build())
                .column(ColumnTemplate.builder().name("price").type("number").build())
                .column(ColumnTemplate.builder().name("fee").type("number").build())
                .column(ColumnTemplate.builder().name("used").type("boolean").build())
                .column(ColumnTemplate.builder().name("available").type("boolean").build())
                .build();
    }

    private static TableGeneratorDefinition contacts() {
        return TableGeneratorDefinition.builder()
                .id("contacts")
                .displayName("Contacts")
                .description("People with email, phone and country")
                .column(ColumnTemplate.builder().name("fullName").type("text").required(true)
                        .generatorId("person-name").build())
                .column(ColumnTemplate.builder().name("email").type("email").allowDuplicates(false).build())
                .column(ColumnTemplate.builder().name("phone").type("phone").build())
                .column(ColumnTemplate.builder().name("country").type("country").build())
                .column(ColumnTemplate.builder().name("vip").type("boolean").build())
                .build();
    }
}
