package net.llparse.util.parser;

import java.util.List;
import net.llparse.api.parser.ParsingException;
import net.llparse.api.parser.Token;

public class TraceAdapter implements TraceListener {

    public void step(List<Symbol> stack, Token lookahead, Terminal terminal,
                     int position) {}

    public void expand(Production prod, int position) {}

    public void match(Terminal terminal, Token token, int position) {}

    public void accept(int position) {}

    public void reject(ParsingException exc) {}

}
