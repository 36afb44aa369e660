package com.libragraph.modelgate.core.error;

/**
 * Valid credential without the rights the route requires.
 */
public class PermissionDeniedException extends ModelGateException {

    private final String resource;
    private final String action;

    public PermissionDeniedException(String resource, String action) {
        super("Permission denied: " + resource + ":" + action);
        this.resource = resource;
        this.action = action;
    }

    public String resource() {
        return resource;
    }

    public String action() {
        return action;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMISSION;
    }
}
