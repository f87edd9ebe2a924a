package com.querylab.search.query;

public class Token {
    private final TokenType type;
    private final String value;
    private final String field;
    private final String rangeMin;
    private final String rangeMax;
    private final boolean rangeInclusive;

    public Token(TokenType type, String value) {
        this(type, value, null);
    }

    public Token(TokenType type, String value, String field) {
        this(type, value, field, null, null, true);
    }

    public Token(
        TokenType type,
        String value,
        String field,
        String rangeMin,
        String rangeMax,
        boolean rangeInclusive
    ) {
        this.type = type;
        this.value = value;
        this.field = field;
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.rangeInclusive = rangeInclusive;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getField() {
        return field;
    }

    public String getRangeMin() {
        return rangeMin;
    }

    public String getRangeMax() {
        return rangeMax;
    }

    public boolean isRangeInclusive() {
        return rangeInclusive;
    }

    @Override
    public String toString() {
        if (field == null) {
            return type + "(" + value + ")";
        }
        return type + "(" + field + ":" + value + ")";
    }
}
