package com.example.rcaengine.correlation;

/**
 * A window's internal bookkeeping can no longer be trusted (revision counter
 * overflow). The window is evicted and recreated from its members.
 */
public class WindowStateCorruptedException extends RuntimeException {

    private final String windowId;

    public WindowStateCorruptedException(String windowId, String message) {
        super(message);
        this.windowId = windowId;
    }

    public String getWindowId() {
        return windowId;
    }
}
