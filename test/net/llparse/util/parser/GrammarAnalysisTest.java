package net.llparse.util.parser;

import junit.framework.TestCase;
import org.json.JSONArray;
import org.json.JSONObject;

public class GrammarAnalysisTest extends TestCase {

    public void testJSONReport() throws Exception {
        JSONObject obj = Analyzer.analyze(Grammars.repetition()).toJSON();
        assertEquals("S", obj.getString("start"));
        assertTrue(obj.getBoolean("ll1"));
        JSONArray prods = obj.getJSONArray("productions");
        assertEquals(2, prods.length());
        assertEquals("S", prods.getJSONObject(0).getString("lhs"));
        assertEquals("a", prods.getJSONObject(0).getJSONArray("rhs")
                              .getString(0));
        assertEquals("ε", prods.getJSONObject(1).getJSONArray("rhs")
                              .getString(0));
        JSONArray firstS = obj.getJSONObject("first").getJSONArray("S");
        assertEquals(2, firstS.length());
        assertEquals("$", obj.getJSONObject("follow").getJSONArray("S")
                             .getString(0));
        JSONObject row = obj.getJSONObject("table").getJSONObject("S");
        assertEquals(1, row.getInt("a"));
        assertEquals(2, row.getInt("$"));
        assertEquals(0, obj.getJSONArray("conflicts").length());
    }

    public void testJSONConflicts() throws Exception {
        JSONObject obj = Analyzer.analyze(Grammars.ambiguous()).toJSON();
        assertFalse(obj.getBoolean("ll1"));
        JSONObject c = obj.getJSONArray("conflicts").getJSONObject(0);
        assertEquals("Expr", c.getString("nonterminal"));
        assertEquals("identifier", c.getString("terminal"));
        assertEquals(1, c.getInt("existing"));
        assertEquals(2, c.getInt("candidate"));
    }

    public void testAnalysisIsDetachedFromGrammar() throws Exception {
        Grammar g = Grammars.repetition();
        GrammarAnalysis a = Analyzer.analyze(g);
        g.addTerminal("b");
        g.addProduction("S", "b");
        assertEquals(2, a.getGrammar().getProductions().size());
        assertTrue(a.getGrammar().isFrozen());
    }

}
