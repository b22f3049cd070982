package recordindex;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link RecordQueries#lookupByKey}. A record is carried only for
 * {@link LookupStatus#FOUND}; a position for both FOUND and DELETED.
 */
public final class LookupResult {
    private static final LookupResult NOT_FOUND = new LookupResult(LookupStatus.NOT_FOUND, null, -1);

    private final LookupStatus status;
    private final Record record;
    private final int position;

    private LookupResult(final LookupStatus status, final Record record, final int position) {
        this.status = status;
        this.record = record;
        this.position = position;
    }

    static LookupResult found(final Record record, final int position) {
        return new LookupResult(LookupStatus.FOUND, record, position);
    }

    static LookupResult deleted(final int position) {
        return new LookupResult(LookupStatus.DELETED, null, position);
    }

    static LookupResult notFound() {
        return NOT_FOUND;
    }

    public LookupStatus status() {
        return status;
    }

    public boolean isFound() {
        return status == LookupStatus.FOUND;
    }

    public Optional<Record> record() {
        return Optional.ofNullable(record);
    }

    /** Position in the record sequence, or -1 when the key is not indexed. */
    public int position() {
        return position;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof LookupResult)) return false;
        final LookupResult that = (LookupResult) o;
        return status == that.status && position == that.position && Objects.equals(record, that.record);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, record, position);
    }

    @Override
    public String toString() {
        return "LookupResult{status=" + status + ", position=" + position + ", record=" + record + "}";
    }
}
