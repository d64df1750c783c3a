package com.dyntable.tableservice.config;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 表引擎可调参数，绑定自 {@code table-engine.*}
 */
@Data
@ConfigurationProperties(prefix = "table-engine")
public class EngineProperties {

    private Inventory inventory = new Inventory();
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Import importing = new Import();
    private MassAction massAction = new MassAction();
    private TypePreview typePreview = new TypePreview();
    private Generator generator = new Generator();
    private Modules modules = new Modules();

    // 绑定为 table-engine.import.*；import 不能作字段名
    public Import getImport() {
        return importing;
    }

    public void setImport(Import importing) {
        this.importing = importing;
    }

    @Data
    public static class Inventory {
        // 数量小于等于该值时产生 LOW_STOCK 告警
        private int lowStockThreshold = 5;
    }

    @Data
    public static class Import {
        private int maxRows = 5000;
    }

    @Data
    public static class MassAction {
        private int maxRows = 1000;
    }

    @Data
    public static class TypePreview {
        private int maxSamples = 10;
    }

    @Data
    public static class Generator {
        private int maxRows = 500;
    }

    @Data
    public static class Modules {
        // 没有持久化记录的已发现模块的默认状态
        private boolean activateOnDiscovery = true;
    }
}
