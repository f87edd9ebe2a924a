package com.querylab.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a query into tokens by walking a cursor over the input and trying each rule in
 * priority order at the cursor. The first rule that matches wins; if none does, one character
 * is skipped.
 */
public class QueryTokenizer {
    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern FIELD_RANGE = Pattern.compile(
        "(\\w+):([\\[{])(\\S+)\\s+TO\\s+(\\S+)[\\]}]",
        FLAGS | Pattern.CASE_INSENSITIVE
    );
    private static final Pattern FIELD_COMPARE = Pattern.compile("(\\w+):(>=?|<=?)(\\S+)", FLAGS);
    private static final Pattern FIELD_PHRASE = Pattern.compile("(\\w+):[\"']([^\"']+)[\"']", FLAGS);
    private static final Pattern FIELD_PREFIX = Pattern.compile("(\\w+):(\\w+)\\*(?=\\s|$)", FLAGS);
    private static final Pattern FIELD_TERM = Pattern.compile("(\\w+):(\\S+)", FLAGS);
    private static final Pattern PHRASE = Pattern.compile("[\"']([^\"']+)[\"']", FLAGS);
    private static final Pattern PREFIX = Pattern.compile("(\\w+)\\*", FLAGS);
    private static final Pattern FUZZY = Pattern.compile("~(\\w+)", FLAGS);
    private static final Pattern EXCLUDE = Pattern.compile("[-!](\\w+)", FLAGS);
    private static final Pattern OR = Pattern.compile("\\bOR\\b|\\|", FLAGS | Pattern.CASE_INSENSITIVE);
    private static final Pattern AND = Pattern.compile("\\bAND\\b|&", FLAGS | Pattern.CASE_INSENSITIVE);
    private static final Pattern LPAREN = Pattern.compile("\\(");
    private static final Pattern RPAREN = Pattern.compile("\\)");
    private static final Pattern WORD = Pattern.compile("\\b(\\w+)\\b", FLAGS);

    private final List<Rule> rules;

    public QueryTokenizer(boolean enablePrefix, boolean enableFuzzy) {
        List<Rule> ordered = new ArrayList<>();
        ordered.add(new Rule(FIELD_RANGE, QueryTokenizer::fieldRange));
        ordered.add(new Rule(FIELD_COMPARE, QueryTokenizer::fieldCompare));
        ordered.add(new Rule(FIELD_PHRASE, m -> new Token(TokenType.FIELD_PHRASE, m.group(2), m.group(1))));
        if (enablePrefix) {
            ordered.add(new Rule(FIELD_PREFIX, m -> new Token(TokenType.FIELD_PREFIX, m.group(2), m.group(1))));
        }
        ordered.add(new Rule(FIELD_TERM, m -> new Token(TokenType.FIELD_TERM, m.group(2), m.group(1))));
        ordered.add(new Rule(PHRASE, m -> new Token(TokenType.PHRASE, m.group(1))));
        if (enablePrefix) {
            ordered.add(new Rule(PREFIX, m -> new Token(TokenType.PREFIX, m.group(1))));
        }
        if (enableFuzzy) {
            ordered.add(new Rule(FUZZY, m -> new Token(TokenType.FUZZY, m.group(1))));
        }
        ordered.add(new Rule(EXCLUDE, m -> new Token(TokenType.EXCLUDE, m.group(1))));
        ordered.add(new Rule(OR, m -> new Token(TokenType.OR, "OR")));
        ordered.add(new Rule(AND, m -> new Token(TokenType.AND, "AND")));
        ordered.add(new Rule(LPAREN, m -> new Token(TokenType.LPAREN, "(")));
        ordered.add(new Rule(RPAREN, m -> new Token(TokenType.RPAREN, ")")));
        ordered.add(new Rule(WORD, m -> new Token(TokenType.WORD, m.group(1))));
        this.rules = List.copyOf(ordered);
    }

    public List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return tokens;
        }

        int length = input.length();
        List<Matcher> matchers = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            matchers.add(rule.pattern.matcher(input));
        }

        int pos = 0;
        while (pos < length) {
            while (pos < length && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                break;
            }

            boolean matched = false;
            for (int i = 0; i < rules.size(); i++) {
                Matcher matcher = matchers.get(i);
                matcher.region(pos, length);
                if (matcher.lookingAt()) {
                    tokens.add(rules.get(i).factory.apply(matcher));
                    pos = matcher.end();
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                pos++;
            }
        }
        return tokens;
    }

    private static Token fieldRange(Matcher m) {
        String min = m.group(3);
        String max = m.group(4);
        boolean inclusive = "[".equals(m.group(2));
        return new Token(
            TokenType.FIELD_RANGE,
            min + " TO " + max,
            m.group(1),
            "*".equals(min) ? null : min,
            "*".equals(max) ? null : max,
            inclusive
        );
    }

    private static Token fieldCompare(Matcher m) {
        String op = m.group(2);
        String value = m.group(3);
        boolean inclusive = op.contains("=");
        if (op.startsWith(">")) {
            return new Token(TokenType.FIELD_RANGE, value, m.group(1), value, null, inclusive);
        }
        return new Token(TokenType.FIELD_RANGE, value, m.group(1), null, value, inclusive);
    }

    private static final class Rule {
        private final Pattern pattern;
        private final Function<Matcher, Token> factory;

        private Rule(Pattern pattern, Function<Matcher, Token> factory) {
            this.pattern = pattern;
            this.factory = factory;
        }
    }
}
