package work.hostcheck.engine.api;

import java.util.Map;

/**
 * Entry point registered for one resource type.
 */
@FunctionalInterface
public interface Verifier {
    /**
     * @param subject name of the resource instance (package name, file path, command line...)
     * @param checks declared checks in declaration order: member name to {@code Boolean} or
     *               {@code {expected, comparison, parameter?}} mapping
     * @throws work.hostcheck.engine.resource.ResourceConstructionException when the resource cannot be built
     */
    VerificationReport verify(String subject, Map<String, Object> checks);
}
