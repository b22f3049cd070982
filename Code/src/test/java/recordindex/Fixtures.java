package recordindex;

import java.util.ArrayList;
import java.util.List;

final class Fixtures {

    private Fixtures() {
    }

    static Record rec(String cpf) {
        return new Record(cpf, "Name " + cpf, "2000-01-01");
    }

    static String key(int k) {
        return String.format("%05d", k);
    }

    /** Inserts {@code keys} in order; each record's position is its insertion index. */
    static RecordIndex indexOf(int... keys) {
        RecordIndex index = new RecordIndex();
        for (int i = 0; i < keys.length; i++) index.insert(rec(key(keys[i])), i);
        return index;
    }

    static List<String> cpfs(List<Record> records) {
        List<String> out = new ArrayList<>(records.size());
        for (Record r : records) out.add(r.getCpf());
        return out;
    }

    static List<String> keys(int... keys) {
        List<String> out = new ArrayList<>(keys.length);
        for (int k : keys) out.add(key(k));
        return out;
    }
}
