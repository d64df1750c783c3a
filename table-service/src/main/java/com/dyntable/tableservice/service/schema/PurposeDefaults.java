package com.dyntable.tableservice.service.schema;

import com.dyntable.module.spi.ColumnTemplate;
import com.dyntable.tableservice.enums.TablePurpose;

import java.util.List;

/**
 * 各用途的表初始带有的列
 */
public final class PurposeDefaults {

    private static final List<ColumnTemplate> SALE = List.of(
            ColumnTemplate.builder().name("price").type("number").required(true).build(),
            ColumnTemplate.builder().name("qty").type("integer").required(true).defaultValue("1").build());

    private static final List<ColumnTemplate> RENT = List.of(
            ColumnTemplate.builder().name("price").type("number").build(),
            ColumnTemplate.builder().name("fee").type("number").defaultValue("0").build(),
            ColumnTemplate.builder().name("used").type("boolean").defaultValue("false").build(),
            ColumnTemplate.builder().name("available").type("boolean").defaultValue("true").build());

    private PurposeDefaults() {
    }

    public static List<ColumnTemplate> columnsFor(TablePurpose purpose) {
        switch (purpose) {
            case SALE:
                return SALE;
            case RENT:
                return RENT;
            default:
                return List.of();
        }
    }
}
