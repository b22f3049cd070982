package recordindex;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A person record stored in the external record list. Ordering and equality
 * are defined by the CPF alone.
 */
public final class Record implements Comparable<Record> {
    private final String cpf;
    private String name;
    private String birthDate;
    private boolean deleted;

    public Record(final String cpf, final String name, final String birthDate) {
        this.cpf = checkNotNull(cpf, "cpf");
        this.name = name;
        this.birthDate = birthDate;
    }

    public String getCpf() {
        return cpf;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public String getBirthDate() {
        return birthDate;
    }

    public void setBirthDate(final String birthDate) {
        this.birthDate = birthDate;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /** Logical deletion; called by the record store, never by the index. */
    public void markDeleted() {
        this.deleted = true;
    }

    /** Field-by-field copy sharing no mutable state with this record. */
    public Record copy() {
        final Record r = new Record(cpf, name, birthDate);
        r.deleted = deleted;
        return r;
    }

    @Override
    public int compareTo(final Record other) {
        return cpf.compareTo(other.cpf);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Record)) return false;
        return cpf.equals(((Record) o).cpf);
    }

    @Override
    public int hashCode() {
        return cpf.hashCode();
    }

    @Override
    public String toString() {
        return "CPF: " + cpf + ", Nome: " + name + ", Nascimento: " + birthDate;
    }
}
