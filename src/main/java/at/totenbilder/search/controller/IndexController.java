package at.totenbilder.search.controller;

import at.totenbilder.search.common.convention.result.Result;
import at.totenbilder.search.common.convention.result.Results;
import at.totenbilder.search.dto.IndexRequest;
import at.totenbilder.search.dto.JobStatus;
import at.totenbilder.search.dto.SingleIndexRequest;
import at.totenbilder.search.service.BackgroundJobService;
import at.totenbilder.search.service.ImageIndexingService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Indexing endpoints. The two index triggers require the X-API-Key header.
 */
@RestController
@RequestMapping("/api")
public class IndexController {

    @Autowired
    private ImageIndexingService indexingService;

    @Autowired
    private BackgroundJobService jobService;

    /**
     * Starts bulk indexing in the background
     * POST /api/index
     */
    @PostMapping("/index")
    public Result<JobStatus> indexAll(@RequestBody(required = false) IndexRequest request) {
        boolean forceReindex = request != null && request.isForceReindex();
        return Results.success(indexingService.submitIndexAll(forceReindex));
    }

    /**
     * Indexes one image synchronously
     * POST /api/index-one
     */
    @PostMapping("/index-one")
    public Result<Map<String, String>> indexOne(@Valid @RequestBody SingleIndexRequest request) {
        String key = indexingService.indexOne(request.getFilename());
        Map<String, String> response = new LinkedHashMap<>();
        response.put("message", "Image indexed");
        response.put("filename", key);
        return Results.success(response);
    }

    @GetMapping("/jobs")
    public Result<List<JobStatus>> listJobs() {
        return Results.success(jobService.list());
    }

    @GetMapping("/jobs/{jobId}")
    public Result<JobStatus> getJob(@PathVariable String jobId) {
        return Results.success(jobService.find(jobId));
    }
}
