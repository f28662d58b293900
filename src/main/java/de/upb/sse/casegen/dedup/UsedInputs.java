package de.upb.sse.casegen.dedup;

import java.util.ArrayList;
import java.util.List;

/** The tuples already tried against one callable. Grows only. */
public class UsedInputs {
    private final List<List<Object>> used = new ArrayList<>();

    /** Adds the tuple unless an equivalent one was seen; returns whether it was added. */
    public boolean tryAdd(List<Object> tuple) {
        for (List<Object> previous : used) {
            if (EquivalenceFilter.equivalent(previous, tuple)) return false;
        }
        used.add(tuple);
        return true;
    }

    public int size() {
        return used.size();
    }
}
