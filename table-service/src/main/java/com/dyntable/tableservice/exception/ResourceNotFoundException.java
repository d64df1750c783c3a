package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.enums.StatusCategory;

public class ResourceNotFoundException extends TableEngineException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(StatusCategory.NOT_FOUND, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
