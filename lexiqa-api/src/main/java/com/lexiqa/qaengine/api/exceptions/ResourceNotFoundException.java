package com.lexiqa.qaengine.api.exceptions;

import com.lexiqa.qaengine.api.model.ErrorKind;

/**
 * Thrown when a profile, library or record file that must exist is absent.
 */
public class ResourceNotFoundException extends QaEngineException {

    private final String location;

    public ResourceNotFoundException(String what, String location) {
        super(ErrorKind.MISSING_RESOURCE, what + " not found: " + location);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
