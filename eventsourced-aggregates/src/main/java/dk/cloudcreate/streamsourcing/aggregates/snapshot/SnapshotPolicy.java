package dk.cloudcreate.streamsourcing.aggregates.snapshot;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;

/**
 * Decides whether a snapshot should be taken after an aggregate has been saved
 */
@FunctionalInterface
public interface SnapshotPolicy {
    /**
     * @param versionBeforeSave the version of the aggregate before the newly saved events
     * @param versionAfterSave  the version of the aggregate after the newly saved events
     * @return true if a snapshot should be taken
     */
    boolean shouldTakeSnapshot(long versionBeforeSave, long versionAfterSave);

    static SnapshotPolicy never() {
        return (versionBeforeSave, versionAfterSave) -> false;
    }

    /**
     * Take a snapshot every time a save crosses a multiple of <code>numberOfEvents</code>
     */
    static SnapshotPolicy everyNumberOfEvents(long numberOfEvents) {
        requireTrue(numberOfEvents > 0, "numberOfEvents must be > 0");
        return (versionBeforeSave, versionAfterSave) -> versionAfterSave / numberOfEvents > versionBeforeSave / numberOfEvents;
    }
}
