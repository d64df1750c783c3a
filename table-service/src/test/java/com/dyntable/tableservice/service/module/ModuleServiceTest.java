package com.dyntable.tableservice.service.module;

import com.dyntable.module.spi.ModuleCapabilities;
import com.dyntable.module.spi.StoreModule;
import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.ModuleInfo;
import com.dyntable.tableservice.entity.InstalledModule;
import com.dyntable.tableservice.exception.InternalEngineException;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.repository.InstalledModuleRepository;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.registry.CapabilityRegistryFactory;
import com.dyntable.tableservice.support.SkuTestModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModuleServiceTest {

    private static final Actor ADMIN = Actor.admin("admin-1");

    @Mock
    private InstalledModuleRepository repository;

    private final AcmeModule acme = new AcmeModule();
    private ModuleService moduleService;

    @BeforeEach
    void setUp() {
        moduleService = new ModuleService(new ModuleCatalog(List.of(acme)), repository, new EngineProperties());
        lenient().when(repository.findById(anyString())).thenReturn(Optional.empty());
    }

    @Test
    void discoveredModulesAreActiveByDefault() {
        assertThat(moduleService.listActiveModules()).containsExactly(SkuTestModule.MODULE_ID);

        ModuleInfo info = moduleService.listModules().get(0);
        assertThat(info.isActive()).isTrue();
        assertThat(info.getColumnTypes()).containsExactly("acme:sku");
        assertThat(info.getTableGenerators()).containsExactly("acme:catalog");
    }

    @Test
    void deactivationPersistsStateAndRunsHook() {
        ModuleInfo info = moduleService.deactivate(SkuTestModule.MODULE_ID, ADMIN);

        ArgumentCaptor<InstalledModule> saved = ArgumentCaptor.forClass(InstalledModule.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().isActive()).isFalse();
        assertThat(saved.getValue().getVersion()).isEqualTo("1.0.0");
        assertThat(acme.deactivations).isEqualTo(1);
        assertThat(info.getId()).isEqualTo(SkuTestModule.MODULE_ID);
    }

    @Test
    void persistedStateDecidesActivity() {
        when(repository.findById(SkuTestModule.MODULE_ID)).thenReturn(Optional.of(
                InstalledModule.builder().moduleId(SkuTestModule.MODULE_ID).version("1.0.0").active(false).build()));

        assertThat(moduleService.listActiveModules()).isEmpty();
        assertThat(new CapabilityRegistryFactory(moduleService).snapshot().isResolvable("acme:sku")).isFalse();
    }

    @Test
    void activatingAnActiveModuleIsANoOp() {
        moduleService.activate(SkuTestModule.MODULE_ID, ADMIN);

        verify(repository, never()).save(any());
        assertThat(acme.activations).isZero();
    }

    @Test
    void onlyAdminsManageModules() {
        assertThatThrownBy(() -> moduleService.deactivate(SkuTestModule.MODULE_ID, Actor.user("u-1")))
                .isInstanceOf(TableAccessDeniedException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void unknownModuleIsNotFound() {
        assertThatThrownBy(() -> moduleService.activate("ghost", ADMIN))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Module not found: ghost");
    }

    @Test
    void failingHookLeavesStateUnchanged() {
        acme.failHooks = true;

        assertThatThrownBy(() -> moduleService.deactivate(SkuTestModule.MODULE_ID, ADMIN))
                .isInstanceOf(InternalEngineException.class);
        verify(repository, never()).save(any());
    }

    private static final class AcmeModule implements StoreModule {

        int activations;
        int deactivations;
        boolean failHooks;

        @Override
        public String id() {
            return SkuTestModule.MODULE_ID;
        }

        @Override
        public String version() {
            return "1.0.0";
        }

        @Override
        public String displayName() {
            return "Acme";
        }

        @Override
        public ModuleCapabilities capabilities() {
            return SkuTestModule.capabilities();
        }

        @Override
        public void onActivate() {
            if (failHooks) {
                throw new IllegalStateException("hook failed");
            }
            activations++;
        }

        @Override
        public void onDeactivate() {
            if (failHooks) {
                throw new IllegalStateException("hook failed");
            }
            deactivations++;
        }
    }
}
