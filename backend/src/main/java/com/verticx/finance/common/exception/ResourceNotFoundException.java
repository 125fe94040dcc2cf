package com.verticx.finance.common.exception;

public class ResourceNotFoundException extends BusinessRuleException {

    private final String resourceType;
    private final Object identifier;

    public ResourceNotFoundException(String resourceType, Object identifier) {
        this(resourceType, identifier, ErrorCode.RESOURCE_NOT_FOUND);
    }

    public ResourceNotFoundException(String resourceType, Object identifier, ErrorCode errorCode) {
        super(errorCode, String.format("%s with id %s not found", resourceType, identifier));
        this.resourceType = resourceType;
        this.identifier = identifier;
    }

    public String getResourceType() {
        return resourceType;
    }

    public Object getIdentifier() {
        return identifier;
    }
}
