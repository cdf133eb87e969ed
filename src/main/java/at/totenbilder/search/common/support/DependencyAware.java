package at.totenbilder.search.common.support;

/**
 * Component backed by a {@link LazyDependency}. Used by the startup warm-up and the status endpoint.
 */
public interface DependencyAware {

    LazyDependency<?> dependency();
}
