package com.sectionviewer.clip;

/**
 * Receives {@link ClippingEvent}s on the update thread.
 */
@FunctionalInterface
public interface ClippingListener {
    void onClippingEvent(ClippingEvent event);
}
