package recordindex;

/**
 * The external record list: an append-only, position-addressable sequence that holds
 * the authoritative record content and deletion state.
 */
public interface RecordSequence {

    /**
     * @throws IndexOutOfBoundsException if {@code position} is outside {@code [0, size())}
     */
    Record get(int position);

    int size();
}
