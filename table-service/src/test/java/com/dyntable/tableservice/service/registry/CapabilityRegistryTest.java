package com.dyntable.tableservice.service.registry;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.tableservice.exception.ColumnTypeNotFoundException;
import com.dyntable.tableservice.service.registry.builtin.BuiltInCapabilities;
import com.dyntable.tableservice.support.SkuTestModule;
import com.dyntable.tableservice.support.StaticModuleLifecycle;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityRegistryTest {

    private final StaticModuleLifecycle modules = new StaticModuleLifecycle();
    private final CapabilityRegistryFactory factory = new CapabilityRegistryFactory(modules);

    @Test
    void registersEveryBuiltInType() {
        CapabilityRegistry registry = factory.snapshot();

        assertThat(registry.columnTypes()).extracting(RegisteredColumnType::getTypeId)
                .containsAll(BuiltInCapabilities.BUILT_IN_TYPE_IDS);
        assertThat(registry.columnTypes()).allMatch(RegisteredColumnType::isBuiltIn);
        assertThat(registry.findTableGenerator("products")).isPresent();
    }

    @Test
    void namespacesModuleCapabilities() {
        modules.install(SkuTestModule.MODULE_ID, SkuTestModule.capabilities());

        CapabilityRegistry registry = factory.snapshot();

        assertThat(registry.isResolvable("acme:sku")).isTrue();
        assertThat(registry.isResolvable("sku")).isFalse();
        assertThat(registry.findRegistration("acme:sku"))
                .hasValueSatisfying(type -> assertThat(type.getModuleId()).isEqualTo("acme"));
        assertThat(registry.findGenerator("acme:sku")).isPresent();
        assertThat(registry.findTableGenerator("acme:catalog")).isPresent();
        assertThat(registry.activeModules()).containsExactly("acme");
    }

    @Test
    void unknownTypeFailsToResolve() {
        CapabilityRegistry registry = factory.snapshot();

        assertThatThrownBy(() -> registry.resolve("acme:sku"))
                .isInstanceOf(ColumnTypeNotFoundException.class)
                .hasMessage("Column type not found: acme:sku");
    }

    @Test
    void deactivatedModuleDisappearsFromLaterSnapshots() {
        modules.install(SkuTestModule.MODULE_ID, SkuTestModule.capabilities());
        CapabilityRegistry before = factory.snapshot();

        modules.deactivate(SkuTestModule.MODULE_ID);
        CapabilityRegistry after = factory.snapshot();

        assertThat(before.isResolvable("acme:sku")).isTrue();
        assertThat(after.isResolvable("acme:sku")).isFalse();
    }

    @Test
    void typeIdDoublesAsGeneratorId() {
        CapabilityRegistry registry = factory.snapshot();

        assertThat(registry.findGenerator("email")).isPresent();
        assertThat(registry.findGenerator("no-such-generator")).isEmpty();
    }

    @Test
    void moduleWithClashingIdsIsRejectedWhole() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder();
        builder.module("acme", SkuTestModule.capabilities());

        assertThatThrownBy(() -> builder.module("acme", SkuTestModule.capabilities()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("acme:sku");
    }

    @Test
    void brokenModuleIsSkippedWithoutAffectingOthers() {
        ModuleCapabilities duplicated = ModuleCapabilities.builder()
                .columnType(new FixedType("dup"))
                .columnType(new FixedType("dup"))
                .build();
        modules.install("broken", duplicated);
        modules.install(SkuTestModule.MODULE_ID, SkuTestModule.capabilities());

        CapabilityRegistry registry = factory.snapshot();

        assertThat(registry.isResolvable("broken:dup")).isFalse();
        assertThat(registry.isResolvable("acme:sku")).isTrue();
        assertThat(registry.activeModules()).containsExactly("acme");
    }

    @Test
    void rejectsSeparatorInModuleId() {
        assertThatThrownBy(() -> CapabilityRegistry.builder().module("a:b", ModuleCapabilities.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class FixedType implements ColumnTypeHandler {

        private final String typeId;

        FixedType(String typeId) {
            this.typeId = typeId;
        }

        @Override
        public String typeId() {
            return typeId;
        }

        @Override
        public String displayName() {
            return typeId;
        }

        @Override
        public ValidationResult validate(Object value, Map<String, Object> options) {
            return ValidationResult.ok();
        }

        @Override
        public String format(Object value, Map<String, Object> options) {
            return String.valueOf(value);
        }
    }
}
