package com.querylab.search.api;

import com.querylab.search.api.dto.ExpandResponse;
import com.querylab.search.api.dto.QueryTextRequest;
import com.querylab.search.intent.IntentClassifier;
import com.querylab.search.intent.QueryIntent;
import com.querylab.search.query.ParsedQuery;
import com.querylab.search.query.QueryRewriter;
import com.querylab.search.query.SearchQueryParser;
import com.querylab.search.service.InvalidSearchRequestException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/query")
public class QueryController {
    private final SearchQueryParser queryParser;
    private final QueryRewriter queryRewriter;
    private final IntentClassifier intentClassifier;

    public QueryController(SearchQueryParser queryParser, QueryRewriter queryRewriter, IntentClassifier intentClassifier) {
        this.queryParser = queryParser;
        this.queryRewriter = queryRewriter;
        this.intentClassifier = intentClassifier;
    }

    @PostMapping("/parse")
    public ParsedQuery parse(@RequestBody QueryTextRequest request) {
        return queryParser.parse(requireQuery(request));
    }

    @PostMapping("/expand")
    public ExpandResponse expand(@RequestBody QueryTextRequest request) {
        String query = requireQuery(request);
        String normalized = queryRewriter.normalize(query);
        return new ExpandResponse(query, normalized, queryRewriter.expandSynonyms(normalized));
    }

    @PostMapping("/intent")
    public QueryIntent intent(@RequestBody QueryTextRequest request) {
        return intentClassifier.classify(request == null || request.getQuery() == null ? "" : request.getQuery());
    }

    private static String requireQuery(QueryTextRequest request) {
        if (request == null || request.getQuery() == null) {
            throw new InvalidSearchRequestException("query is required");
        }
        return request.getQuery();
    }
}
