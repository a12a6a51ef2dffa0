package io.eventlog.transform;

import io.eventlog.core.Record;
import io.eventlog.core.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequentially applies multiple transforms, flattening outputs. The final outputs are reindexed with deterministic subSeq.
 */
public class TransformChain<I, O> implements Transform<I, O> {
    private final List<Transform<?, ?>> stages;

    public TransformChain(Transform<?, ?>... stages) {
        this.stages = List.of(stages);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public List<Record<O>> apply(Record<I> input) {
        List<Record<?>> current = List.of(input);
        for (Transform stage : stages) {
            if (current.isEmpty()) break;
            List<Record<?>> next = new ArrayList<>();
            for (Record<?> r : current) {
                List out = stage.apply(r);
                if (out != null) next.addAll(out);
            }
            current = next;
        }
        // reindex subseq deterministically
        List<Record<O>> result = new ArrayList<>(current.size());
        int i = 0;
        for (Record<?> r : current) {
            result.add(new Record<>(r.seq(), i++, (O) r.payload()));
        }
        return result;
    }
}
