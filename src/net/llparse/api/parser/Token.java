package net.llparse.api.parser;

import net.llparse.api.NamedValue;

/**
 * A token is a piece of source text tagged with a token category.
 * Tokens are produced by a lexical scanner that is not part of this module;
 * parsers consume fully materialized token lists that are terminated by an
 * explicit end-of-input token.
 */
public interface Token extends NamedValue {

    /**
     * The name of this token's category (e.g. "IDENTIFIER").
     */
    String getName();

    /**
     * The text this token encompasses.
     */
    String getContent();

}
