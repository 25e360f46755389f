package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.SearchResult;
import io.newsdigest.pipeline.api.service.RetrievalService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    private final RetrievalService retrieval;

    public SearchController(RetrievalService retrieval) {
        this.retrieval = retrieval;
    }

    @GetMapping
    public List<SearchResult> search(@RequestParam("q") String query,
                                     @RequestParam(required = false) Integer limit,
                                     @RequestParam(name = "use_ai", defaultValue = "false") boolean useAi,
                                     @RequestParam(required = false) Set<String> sources) {
        return retrieval.search(query, limit, useAi, sources == null ? Set.of() : sources);
    }
}
