package recordindex;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Queries that resolve index nodes against the record sequence. The sequence is the
 * authoritative source of record content and deletion state; the records held by
 * the index are used only for key comparison.
 * <p>
 * Positions are trusted as stored. If the sequence is compacted or reordered after
 * indexing, the caller must rebuild the index with {@link #buildIndex}.
 */
public final class RecordQueries {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordQueries.class);

    private RecordQueries() {
    }

    public static RecordIndex buildIndex(final RecordSequence sequence) {
        return RecordIndex.of(sequence);
    }

    public static LookupResult lookupByKey(final RecordIndex index, final RecordSequence sequence, final String cpf) {
        checkNotNull(index, "index");
        checkNotNull(sequence, "sequence");
        final Optional<IndexNode> node = index.search(cpf);
        if (!node.isPresent()) {
            return LookupResult.notFound();
        }
        final int position = node.get().getPosition();
        final Record record = sequence.get(position);
        if (record.isDeleted()) {
            LOGGER.debug("Key {} resolves to deleted record at position {}", cpf, position);
            return LookupResult.deleted(position);
        }
        return LookupResult.found(record, position);
    }

    /**
     * Fresh list of the sequence's records in ascending CPF order, resolved by the
     * positions stored in the index. Logically deleted records are included. Neither
     * the index nor the sequence is modified.
     */
    public static List<Record> materializeSorted(final RecordIndex index, final RecordSequence sequence) {
        checkNotNull(index, "index");
        checkNotNull(sequence, "sequence");
        final List<IndexNode> nodes = index.nodes(TraversalOrder.IN_ORDER);
        final List<Record> sorted = new ArrayList<>(nodes.size());
        for (IndexNode n : nodes) {
            sorted.add(sequence.get(n.getPosition()));
        }
        return sorted;
    }
}
