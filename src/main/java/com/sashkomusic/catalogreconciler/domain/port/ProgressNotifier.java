package com.sashkomusic.catalogreconciler.domain.port;

import com.sashkomusic.catalogreconciler.domain.model.ProgressEvent;

/**
 * Fire-and-forget progress sink. Implementations must not block the caller.
 */
@FunctionalInterface
public interface ProgressNotifier {

    void notify(ProgressEvent event);
}
