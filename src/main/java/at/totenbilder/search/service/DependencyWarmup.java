package at.totenbilder.search.service;

import at.totenbilder.search.common.support.DependencyAware;
import at.totenbilder.search.common.support.LazyDependency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Initialises the external clients in the background once the application accepts requests.
 */
@Slf4j
@Component
public class DependencyWarmup {

    private final List<DependencyAware> dependencies;
    private final Executor executor;

    public DependencyWarmup(List<DependencyAware> dependencies,
                            @Qualifier("indexingJobExecutor") Executor executor) {
        this.dependencies = dependencies;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        for (DependencyAware aware : dependencies) {
            LazyDependency<?> dependency = aware.dependency();
            try {
                executor.execute(dependency::warmUp);
            } catch (RejectedExecutionException e) {
                log.warn("Warm-up of {} not scheduled, it initialises on first use", dependency.getName());
            }
        }
    }
}
