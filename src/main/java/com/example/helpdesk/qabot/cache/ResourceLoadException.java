package com.example.helpdesk.qabot.cache;

/**
 * Thrown by a resource loader. A permanent failure (e.g. a missing credential) stops the cache
 * from retrying the load until the process restarts.
 */
public class ResourceLoadException extends RuntimeException {

    private final boolean permanent;

    public ResourceLoadException(String message, Throwable cause) {
        super(message, cause);
        this.permanent = false;
    }

    private ResourceLoadException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public static ResourceLoadException transientFailure(String message) {
        return new ResourceLoadException(message, false);
    }

    public static ResourceLoadException permanent(String message) {
        return new ResourceLoadException(message, true);
    }

    public boolean isPermanent() {
        return permanent;
    }
}
