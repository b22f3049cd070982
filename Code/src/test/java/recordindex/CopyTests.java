package recordindex;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static recordindex.Fixtures.*;

class CopyTests {

    @Test
    void copy_has_same_shape_and_positions() {
        RecordIndex original = indexOf(50, 30, 70, 20, 40, 60);
        RecordIndex copy = original.copy();

        assertEquals(cpfs(original.preOrder()), cpfs(copy.preOrder()));
        assertEquals(cpfs(original.breadthFirst()), cpfs(copy.breadthFirst()));
        assertEquals(original.size(), copy.size());
        assertEquals(original.height(), copy.height());

        List<IndexNode> a = original.nodes(TraversalOrder.PRE_ORDER);
        List<IndexNode> b = copy.nodes(TraversalOrder.PRE_ORDER);
        for (int i = 0; i < a.size(); i++) {
            assertNotSame(a.get(i), b.get(i));
            assertNotSame(a.get(i).getRecord(), b.get(i).getRecord());
            assertEquals(a.get(i).getPosition(), b.get(i).getPosition());
        }
        TreeInvariants.assertValid(copy);
    }

    @Test
    void mutating_original_record_does_not_touch_copy() {
        RecordIndex original = indexOf(50, 30, 70);
        RecordIndex copy = original.copy();

        original.search(key(30)).get().getRecord().setName("Renamed");
        original.search(key(70)).get().getRecord().setBirthDate("1900-01-01");

        assertEquals("Name " + key(30), copy.search(key(30)).get().getRecord().getName());
        assertEquals("2000-01-01", copy.search(key(70)).get().getRecord().getBirthDate());
    }

    @Test
    void removing_from_copy_keeps_original() {
        RecordIndex original = indexOf(50, 30, 70, 20, 40);
        RecordIndex copy = original.copy();

        assertTrue(copy.remove(key(30)));
        assertTrue(copy.remove(key(50)));
        copy.insert(rec(key(99)), 9);

        assertEquals(keys(20, 30, 40, 50, 70), cpfs(original.inOrder()));
        assertEquals(keys(50, 30, 70, 20, 40), cpfs(original.breadthFirst()));
        assertFalse(original.contains(key(99)));
        assertEquals(keys(20, 40, 70, 99), cpfs(copy.inOrder()));
    }

    @Test
    void clearing_original_keeps_copy() {
        RecordIndex original = indexOf(3, 1, 2);
        RecordIndex copy = original.copy();
        original.clear();
        assertEquals(keys(1, 2, 3), cpfs(copy.inOrder()));
    }

    @Test
    void copy_of_empty_is_empty_and_independent() {
        RecordIndex empty = new RecordIndex();
        RecordIndex copy = empty.copy();
        assertTrue(copy.isEmpty());
        copy.insert(rec("1"), 0);
        assertTrue(empty.isEmpty());
    }

    @Test
    void record_copy_is_field_by_field() {
        Record r = new Record("123", "Lucas", "2005-07-10");
        r.markDeleted();
        Record c = r.copy();
        assertNotSame(r, c);
        assertEquals(r, c);
        assertEquals("Lucas", c.getName());
        assertEquals("2005-07-10", c.getBirthDate());
        assertTrue(c.isDeleted());
    }
}
