package recordindex;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * In-memory {@link RecordSequence}. Deletion is logical: the slot keeps its record
 * with the deleted flag set and is never reused.
 */
public class ListRecordSequence implements RecordSequence {
    private final List<Record> records = new ArrayList<>();

    public ListRecordSequence() {
    }

    public ListRecordSequence(final Iterable<Record> initial) {
        for (Record r : initial) append(r);
    }

    /** @return the position of the appended record */
    public int append(final Record record) {
        records.add(checkNotNull(record, "record"));
        return records.size() - 1;
    }

    public void markDeleted(final int position) {
        get(position).markDeleted();
    }

    @Override
    public Record get(final int position) {
        checkElementIndex(position, records.size());
        return records.get(position);
    }

    @Override
    public int size() {
        return records.size();
    }
}
