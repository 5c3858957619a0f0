package io.github.eutro.funcir.test;

import io.github.eutro.funcir.ir.Fn;
import io.github.eutro.funcir.ir.FunctionalIR;
import io.github.eutro.funcir.passes.meta.MetadataState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetadataStateTest {
    @Test
    void freshGraphsHaveNothingValid() {
        FunctionalIR ir = new FunctionalIR();
        for (MetadataState.Kind kind : MetadataState.Kind.values()) {
            assertFalse(ir.metadata().isValid(kind));
        }
    }

    @Test
    void validateAndInvalidate() {
        MetadataState ms = new MetadataState();
        ms.validate(MetadataState.Kind.TOPOLOGICALLY_SORTED, MetadataState.Kind.BUFS_FORWARDED);
        ms.invalidate(MetadataState.Kind.BUFS_FORWARDED);
        assertTrue(ms.isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
        assertFalse(ms.isValid(MetadataState.Kind.BUFS_FORWARDED));
        ms.graphChanged();
        assertFalse(ms.isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
    }

    @Test
    void ensureValidRunsTheMissingPasses() {
        FunctionalIR ir = TopologicalSortTest.outOfOrder();
        ir.metadata().ensureValid(ir, MetadataState.Kind.BUFS_FORWARDED);
        assertTrue(ir.metadata().isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
        assertTrue(ir.metadata().isValid(MetadataState.Kind.BUFS_FORWARDED));
        TopologicalSortTest.assertSorted(ir);
        assertNotEquals(Fn.BUF, ir.getOutputNode("y").fn());
    }
}
