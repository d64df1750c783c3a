package com.dyntable.tableservice.config;

import com.dyntable.tableservice.service.module.ModuleCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ModuleConfig {

    @Bean
    public ModuleCatalog moduleCatalog() {
        return ModuleCatalog.discover(Thread.currentThread().getContextClassLoader());
    }
}
