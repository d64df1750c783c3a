package com.dyntable.tableservice.service.registry;

import com.dyntable.module.spi.TableGeneratorDefinition;
import lombok.Value;

@Value
public class RegisteredTableGenerator {

    String generatorId;
    String moduleId;
    TableGeneratorDefinition definition;
}
