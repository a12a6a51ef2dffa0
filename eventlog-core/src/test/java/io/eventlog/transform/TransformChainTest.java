package io.eventlog.transform;

import io.eventlog.core.Record;
import io.eventlog.core.Transform;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformChainTest {
    @Test
    void applies_stages_in_order_and_reindexes() {
        Transform<String, String> stage1 = r -> List.of(new Record<>(r.seq(), 3, r.payload() + "A"));
        Transform<String, String> stage2 = r -> List.of(new Record<>(r.seq(), 7, r.payload() + "B"));
        TransformChain<String, String> chain = new TransformChain<>(stage1, stage2);
        List<Record<String>> out = chain.apply(new Record<>(42, 0, ""));
        assertEquals(1, out.size());
        assertEquals(42, out.get(0).seq());
        assertEquals(0, out.get(0).subSeq());
        assertEquals("AB", out.get(0).payload());
    }

    @Test
    void dropped_record_skips_later_stages() {
        Transform<String, String> drop = r -> List.of();
        Transform<String, String> explode = r -> { throw new AssertionError("must not run"); };
        assertTrue(new TransformChain<String, String>(drop, explode).apply(Record.of(1, "x")).isEmpty());
    }
}
