package work.hostcheck.engine.backend;

@FunctionalInterface
public interface BackendFactory {
    Backend create(String selector);
}
