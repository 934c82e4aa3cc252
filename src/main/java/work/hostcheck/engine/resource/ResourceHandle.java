package work.hostcheck.engine.resource;

import java.util.Map;
import java.util.Optional;
import work.hostcheck.engine.backend.Backend;

/**
 * A resource type resolved against a backend, not yet instantiated.
 */
public interface ResourceHandle {
    /**
     * Provider-side (UpperCamelCase) type name.
     */
    String typeName();

    String description();

    Backend backend();

    ConstructorSignature signature();

    /**
     * Builds a resource instance. {@code subject} is ignored when the signature does not accept one.
     *
     * @throws ResourceConstructionException when the subject or an argument does not fit the constructor
     */
    Object instantiate(String subject, Map<String, Object> arguments);

    /**
     * Member declared on the resource type itself.
     */
    Optional<ResourceMember> typeMember(String name);

    /**
     * Member held by a constructed instance.
     */
    Optional<ResourceMember> instanceMember(Object instance, String name);
}
