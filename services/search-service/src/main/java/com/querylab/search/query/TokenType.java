package com.querylab.search.query;

public enum TokenType {
    WORD,
    PHRASE,
    FIELD_TERM,
    FIELD_PHRASE,
    FIELD_PREFIX,
    FIELD_RANGE,
    PREFIX,
    FUZZY,
    EXCLUDE,
    OR,
    AND,
    LPAREN,
    RPAREN
}
