package com.querylab.search.query;

import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class SearchQueryParser {
    private final QueryTokenizer tokenizer;

    @Autowired
    public SearchQueryParser(QueryParserProperties properties) {
        this(new QueryTokenizer(properties.isEnablePrefix(), properties.isEnableFuzzy()));
    }

    public SearchQueryParser(QueryTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public ParsedQuery parse(String query) {
        ParsedQuery result = new ParsedQuery(query);
        if (query == null || query.isBlank()) {
            return result;
        }

        List<Token> tokens = tokenizer.tokenize(query.strip());
        for (Token token : tokens) {
            apply(token, result);
        }
        result.setNormalizedQuery(buildNormalizedQuery(result));
        return result;
    }

    private void apply(Token token, ParsedQuery result) {
        switch (token.getType()) {
            case WORD -> result.addTextPart(token.getValue());
            case PHRASE -> result.addTextPart("\"" + token.getValue() + "\"");
            case FIELD_TERM, FIELD_PHRASE -> result.addFieldValue(token.getField(), token.getValue());
            case FIELD_PREFIX -> result.addFieldValue(token.getField(), token.getValue() + "*");
            case FIELD_RANGE -> result.putRange(
                token.getField(),
                new RangeFilter(token.getRangeMin(), token.getRangeMax(), token.isRangeInclusive())
            );
            case PREFIX -> result.addPrefixTerm(token.getValue());
            case FUZZY -> result.addFuzzyTerm(token.getValue());
            case EXCLUDE -> result.addExclusion(token.getValue());
            // boolean operators and grouping are recognized but not composed
            case OR, AND, LPAREN, RPAREN -> {
            }
        }
    }

    private String buildNormalizedQuery(ParsedQuery result) {
        List<String> parts = new ArrayList<>(result.getTextParts());
        for (String prefix : result.getPrefixTerms()) {
            parts.add(prefix + ":*");
        }
        return String.join(" ", parts);
    }
}
