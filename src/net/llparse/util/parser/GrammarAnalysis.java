package net.llparse.util.parser;

import java.util.List;
import java.util.Map;
import java.util.Set;
import net.llparse.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

public class GrammarAnalysis {

    private final Grammar grammar;
    private final FirstSets first;
    private final FollowSets follow;
    private final ParseTable table;

    public GrammarAnalysis(Grammar grammar, FirstSets first,
                           FollowSets follow, ParseTable table) {
        this.grammar = grammar;
        this.first = first;
        this.follow = follow;
        this.table = table;
    }

    public String toString() {
        return String.format("%s@%h[grammar=%s,ll1=%s]",
            getClass().getName(), this, grammar, isLL1());
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public FirstSets getFirstSets() {
        return first;
    }

    public FollowSets getFollowSets() {
        return follow;
    }

    public ParseTable getTable() {
        return table;
    }

    public List<ParseTable.Conflict> getConflicts() {
        return table.getConflicts();
    }

    public boolean isLL1() {
        return table.isLL1();
    }

    public JSONObject toJSON() {
        JSONArray productions = new JSONArray();
        for (Production p : grammar.getProductions()) {
            productions.put(Util.createJSONObject(
                "id", p.getID(),
                "lhs", p.getLHS().getName(),
                "rhs", Util.createJSONStringArray(p.getRHS())));
        }
        JSONObject firstObj = new JSONObject();
        for (Nonterminal nt : grammar.getNonterminals()) {
            firstObj.put(nt.getName(),
                         Util.createJSONStringArray(first.get(nt)));
        }
        JSONObject followObj = new JSONObject();
        for (Map.Entry<Nonterminal, Set<Terminal>> e :
                 follow.asMap().entrySet()) {
            followObj.put(e.getKey().getName(),
                          Util.createJSONStringArray(e.getValue()));
        }
        JSONObject tableObj = new JSONObject();
        for (Map.Entry<Nonterminal, Map<Terminal, Production>> e :
                 table.asMap().entrySet()) {
            JSONObject row = new JSONObject();
            for (Map.Entry<Terminal, Production> c :
                     e.getValue().entrySet()) {
                row.put(c.getKey().getName(), c.getValue().getID());
            }
            tableObj.put(e.getKey().getName(), row);
        }
        JSONArray conflictArr = new JSONArray();
        for (ParseTable.Conflict c : table.getConflicts()) {
            conflictArr.put(Util.createJSONObject(
                "nonterminal", c.getNonterminalName(),
                "terminal", c.getTerminalName(),
                "existing", c.getExistingProductionID(),
                "candidate", c.getCandidateProductionID()));
        }
        return Util.createJSONObject(
            "start", grammar.getStartSymbol().getName(),
            "terminals", Util.createJSONStringArray(grammar.getTerminals()),
            "nonterminals",
                Util.createJSONStringArray(grammar.getNonterminals()),
            "productions", productions,
            "first", firstObj,
            "follow", followObj,
            "table", tableObj,
            "conflicts", conflictArr,
            "ll1", isLL1());
    }

}
