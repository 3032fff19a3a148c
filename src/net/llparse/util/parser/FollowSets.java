package net.llparse.util.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class FollowSets {

    private final Map<Nonterminal, Set<Terminal>> sets;
    private final int passes;

    public FollowSets(Map<Nonterminal, ? extends Set<Terminal>> sets,
                      int passes) {
        Map<Nonterminal, Set<Terminal>> copy =
            new LinkedHashMap<Nonterminal, Set<Terminal>>();
        for (Map.Entry<Nonterminal, ? extends Set<Terminal>> e :
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
        return (other instanceof FollowSets &&
                sets.equals(((FollowSets) other).sets));
    }

    public int hashCode() {
        return sets.hashCode();
    }

    public Map<Nonterminal, Set<Terminal>> asMap() {
        return sets;
    }

    public int getPasses() {
        return passes;
    }

    public Set<Terminal> get(Nonterminal sym) {
        Set<Terminal> ret = sets.get(sym);
        return (ret == null) ? Collections.<Terminal>emptySet() : ret;
    }

}
