package com.boxsort.service;

import com.boxsort.model.BoxDelta;

/**
 * A connected viewer of one job's progress.
 */
public interface JobObserver {

    /**
     * Stable identifier used for logging and unsubscription.
     */
    String getObserverId();

    /**
     * Delivers one delta. Throwing marks the observer as disconnected.
     */
    void onDelta(BoxDelta delta) throws Exception;
}
