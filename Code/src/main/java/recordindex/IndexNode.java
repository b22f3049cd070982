package recordindex;

/**
 * A node of {@link RecordIndex}: a copy of the record (used for key comparison only)
 * and the position of the authoritative record in the {@link RecordSequence}.
 * Payload and children are rewritten only by the owning tree.
 */
public final class IndexNode {
    Record record;
    int position;
    IndexNode left;
    IndexNode right;

    IndexNode(final Record record, final int position) {
        this.record = record;
        this.position = position;
    }

    public String getKey() {
        return record.getCpf();
    }

    public Record getRecord() {
        return record;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return "IndexNode{key=" + getKey() + ", position=" + position + "}";
    }
}
