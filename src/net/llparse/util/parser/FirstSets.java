package net.llparse.util.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class FirstSets {

    private final Map<Symbol, Set<Terminal>> sets;
    private final int passes;

    public FirstSets(Map<Symbol, ? extends Set<Terminal>> sets, int passes) {
        Map<Symbol, Set<Terminal>> copy =
            new LinkedHashMap<Symbol, Set<Terminal>>();
        for (Map.Entry<Symbol, ? extends Set<Terminal>> e :
                 sets.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSet(
                new LinkedHashSet<Terminal>(e.getValue())));
        }
        this.sets = Collections.unmodifiableMap(copy);
        this.passes = passes;
    }

    public String toString() {
        return getClass().getName() + sets;
    }

    public boolean equals(Object other) {
        return (other instanceof FirstSets &&
                sets.equals(((FirstSets) other).sets));
    }

    public int hashCode() {
        return sets.hashCode();
    }

    public Map<Symbol, Set<Terminal>> asMap() {
        return sets;
    }

    /* The number of passes the fixed point computation needed. */
    public int getPasses() {
        return passes;
    }

    /* FIRST(sym); terminals (and epsilon) that were not part of the
     * grammar the sets were computed from yield a singleton. */
    public Set<Terminal> get(Symbol sym) {
        Set<Terminal> ret = sets.get(sym);
        if (ret != null) return ret;
        if (sym instanceof Terminal)
            return Collections.singleton((Terminal) sym);
        return Collections.emptySet();
    }

    public boolean isNullable(Symbol sym) {
        return get(sym).contains(Terminal.EPSILON);
    }

}
