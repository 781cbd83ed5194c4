package org.stackfall.replay;

import java.util.List;

/**
 * A finished recording: metadata plus the ordered event log. Immutable.
 *
 * @param metadata The session summary.
 * @param events   The events ordered by frame number.
 */
public record ReplayData(ReplayMetadata metadata, List<ReplayEvent> events) {

    public ReplayData {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata is required");
        }
        events = List.copyOf(events);
        long previousFrame = 0;
        for (ReplayEvent event : events) {
            if (event.frameNumber() < previousFrame) {
                throw new IllegalArgumentException("Replay events must have non-decreasing frame numbers, found "
                        + event.frameNumber() + " after " + previousFrame);
            }
            previousFrame = event.frameNumber();
        }
    }

    public int eventCount() {
        return events.size();
    }
}
