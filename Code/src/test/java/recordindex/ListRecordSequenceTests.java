package recordindex;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static recordindex.Fixtures.*;

class ListRecordSequenceTests {

    @Test
    void append_assigns_consecutive_positions() {
        ListRecordSequence edl = new ListRecordSequence();
        assertEquals(0, edl.append(rec("1")));
        assertEquals(1, edl.append(rec("2")));
        assertEquals(2, edl.size());
        assertEquals("2", edl.get(1).getCpf());
    }

    @Test
    void mark_deleted_keeps_the_slot() {
        ListRecordSequence edl = new ListRecordSequence(List.of(rec("1"), rec("2"), rec("3")));
        edl.markDeleted(1);
        assertEquals(3, edl.size());
        assertTrue(edl.get(1).isDeleted());
        assertFalse(edl.get(0).isDeleted());
        assertEquals(3, edl.append(rec("4")));
    }

    @Test
    void out_of_range_positions_throw() {
        ListRecordSequence edl = new ListRecordSequence();
        edl.append(rec("1"));
        assertThrows(IndexOutOfBoundsException.class, () -> edl.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> edl.get(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> edl.markDeleted(5));
        assertThrows(NullPointerException.class, () -> edl.append(null));
    }
}
