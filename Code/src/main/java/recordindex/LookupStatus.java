package recordindex;

public enum LookupStatus {
    FOUND,
    /** The key is indexed but its record is logically deleted. */
    DELETED,
    NOT_FOUND
}
