package at.totenbilder.search.controller;

import at.totenbilder.search.common.convention.result.Result;
import at.totenbilder.search.common.convention.result.Results;
import at.totenbilder.search.common.support.DependencyAware;
import at.totenbilder.search.common.support.LazyDependency;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HealthController {

    @Autowired
    private List<DependencyAware> dependencies;

    /**
     * Liveness, independent of the external dependencies
     */
    @GetMapping("/health")
    public Result<Map<String, String>> health() {
        return Results.success(Map.of("status", "ok"));
    }

    /**
     * State of each external dependency. Does not trigger initialisation.
     */
    @GetMapping("/api/status")
    public Result<Map<String, Map<String, String>>> status() {
        Map<String, Map<String, String>> states = new LinkedHashMap<>();
        for (DependencyAware aware : dependencies) {
            LazyDependency<?> dependency = aware.dependency();
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("state", dependency.getState().name());
            if (dependency.getFailureMessage() != null) {
                entry.put("error", dependency.getFailureMessage());
            }
            states.put(dependency.getName(), entry);
        }
        return Results.success(states);
    }
}
