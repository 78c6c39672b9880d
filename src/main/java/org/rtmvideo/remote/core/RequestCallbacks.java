package org.rtmvideo.remote.core;

/**
 * Outcome of a subscribe or unsubscribe request. Exactly one of the two methods
 * is called per request.
 */
public interface RequestCallbacks extends ErrorCallbacks {

    void onOk();
}
