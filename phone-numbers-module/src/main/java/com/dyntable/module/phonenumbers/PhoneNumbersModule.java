package com.dyntable.module.phonenumbers;

import com.dyntable.module.spi.ColumnTemplate;
import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.module.spi.StoreModule;
import com.dyntable.module.spi.TableGeneratorDefinition;
import com.dyntable.module.spi.TypeIds;
import lombok.extern.slf4j.Slf4j;

/**
 * Telecom column types (DID numbers, carriers) and a DID inventory table generator.
 */
@Slf4j
public class PhoneNumbersModule implements StoreModule {

    public static final String MODULE_ID = "phone-numbers";

    private final PhoneNumberGenerator phoneNumberGenerator = new PhoneNumberGenerator();

    @Override
    public String id() {
        return MODULE_ID;
    }

    @Override
    public String version() {
        return "1.0.0";
    }

    @Override
    public String displayName() {
        return "Phone Numbers";
    }

    @Override
    public String description() {
        return "DID numbers and carriers with country-specific validation";
    }

    @Override
    public ModuleCapabilities capabilities() {
        return ModuleCapabilities.builder()
                .columnType(new DidColumnType(phoneNumberGenerator))
                .columnType(new CarrierColumnType())
                .generator(PhoneNumberGenerator.ID, phoneNumberGenerator)
                .tableGenerator(didInventory())
                .build();
    }

    @Override
    public void onActivate() {
        log.info("Module {} activated", MODULE_ID);
    }

    @Override
    public void onDeactivate() {
        log.info("Module {} deactivated", MODULE_ID);
    }

    private TableGeneratorDefinition didInventory() {
        return TableGeneratorDefinition.builder()
                .id("did-inventory")
                .displayName("DID Inventory")
                .description("Phone numbers for sale, one row per DID")
                .targetPurpose("sale")
                .defaultRowCount(20)
                .column(ColumnTemplate.builder()
                        .name("number")
                        .type(TypeIds.qualify(MODULE_ID, DidColumnType.TAG))
                        .required(true)
                        .allowDuplicates(false)
                        .build())
                .column(ColumnTemplate.builder()
                        .name("carrier")
                        .type(TypeIds.qualify(MODULE_ID, CarrierColumnType.TAG))
                        .build())
                .column(ColumnTemplate.builder()
                        .name("price")
                        .type("number")
                        .required(true)
                        .build())
                .column(ColumnTemplate.builder()
                        .name("qty")
                        .type("integer")
                        .required(true)
                        .defaultValue("1")
                        .build())
                .build();
    }
}
