package at.totenbilder.search.controller;

import at.totenbilder.search.common.convention.result.Result;
import at.totenbilder.search.common.convention.result.Results;
import at.totenbilder.search.dto.ImageSearchResult;
import at.totenbilder.search.dto.SearchRequest;
import at.totenbilder.search.service.ImageSearchService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Image search
 */
@RestController
@RequestMapping("/api")
public class SearchController {

    @Autowired
    private ImageSearchService searchService;

    /**
     * Text or reference image search
     * POST /api/search
     */
    @PostMapping("/search")
    public Result<List<ImageSearchResult>> search(@Valid @RequestBody SearchRequest request) {
        return Results.success(searchService.search(request));
    }

    /**
     * Text search
     * GET /api/search?query=xxx&limit=30&offset=0&delta=alle
     */
    @GetMapping("/search")
    public Result<List<ImageSearchResult>> searchByText(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String delta) {
        SearchRequest request = new SearchRequest(query, null, limit, offset, delta);
        return Results.success(searchService.search(request));
    }
}
