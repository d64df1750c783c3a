package com.dyntable.tableservice.service.registry.builtin;

import java.util.List;
import java.util.Random;

/**
 * 内置值生成器使用的词表
 */
final class SampleData {

    static final List<String> ADJECTIVES = List.of(
            "Classic", "Compact", "Deluxe", "Eco", "Express", "Golden", "Heavy", "Lite",
            "Modern", "Premium", "Rapid", "Smart", "Solid", "Urban", "Vintage", "Wireless");

    static final List<String> NOUNS = List.of(
            "Adapter", "Backpack", "Bottle", "Cable", "Chair", "Charger", "Desk", "Headset",
            "Jacket", "Keyboard", "Lamp", "Monitor", "Mug", "Notebook", "Speaker", "Watch");

    static final List<String> FIRST_NAMES = List.of(
            "Alex", "Sam", "Jordan", "Taylor", "Morgan", "Casey", "Robin", "Jamie", "Avery", "Riley");

    static final List<String> LAST_NAMES = List.of(
            "Smith", "Garcia", "Muller", "Rossi", "Tanaka", "Nowak", "Silva", "Khan", "Dubois", "Berg");

    static final List<String> COUNTRIES = List.of("US", "GB", "DE", "FR", "ES", "IT", "NL", "JP", "AU", "CA");

    static final List<String> CATEGORIES = List.of("Electronics", "Office", "Outdoor", "Home", "Apparel");

    private SampleData() {
    }

    static String pick(Random random, List<String> values) {
        return values.get(random.nextInt(values.size()));
    }
}
