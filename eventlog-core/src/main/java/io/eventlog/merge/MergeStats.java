package io.eventlog.merge;

/**
 * Work done by one {@link BoundedMerger#mergeFiles} call.
 *
 * @param rounds          reduction rounds run; 0 when a single input was moved into place
 * @param batchMerges     base merges run across all rounds
 * @param recordsMerged   records passed through base merges, summed over rounds
 * @param peakOpenInputs  most input handles held open at once
 */
public record MergeStats(int rounds, int batchMerges, long recordsMerged, int peakOpenInputs) {
    public static MergeStats moved() {
        return new MergeStats(0, 0, 0, 0);
    }
}
