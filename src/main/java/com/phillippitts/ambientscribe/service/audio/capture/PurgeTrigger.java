package com.phillippitts.ambientscribe.service.audio.capture;

/**
 * What caused retained audio to be purged. Reported in audit events.
 */
public enum PurgeTrigger {
    MANUAL,
    AUTOMATIC_ON_STOP,
    SHUTDOWN
}
