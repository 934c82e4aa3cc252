package work.hostcheck.engine.dispatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostcheck.engine.api.AssertionResult;
import work.hostcheck.engine.api.VerificationReport;
import work.hostcheck.engine.api.Verifier;
import work.hostcheck.engine.binding.ArgumentBinder;
import work.hostcheck.engine.binding.BoundArguments;
import work.hostcheck.engine.member.MemberKind;
import work.hostcheck.engine.member.MemberResolver;
import work.hostcheck.engine.resource.ResourceConstructionException;
import work.hostcheck.engine.resource.ResourceHandle;
import work.hostcheck.engine.resource.ResourceResolver;
import work.hostcheck.engine.resource.UnsupportedResourceException;
import work.hostcheck.engine.shared.CheckException;

/**
 * Verifies declared checks for one resource type: resolve, bind, construct, then evaluate each check in
 * declaration order.
 * <p>
 * An unsupported resource yields a failed report with no messages. A construction failure propagates as
 * {@link ResourceConstructionException}. Any {@link CheckException} raised by a single check is recorded
 * as a failed assertion and the remaining checks still run.
 */
public final class VerificationDispatcher implements Verifier {
    public static final String RESERVED_PREFIX = "_";

    private static final Logger log = LoggerFactory.getLogger(VerificationDispatcher.class);

    private final String typeName;
    private final String backendSelector;
    private final ResourceResolver resolver;
    private final ArgumentBinder binder;
    private final MemberResolver members;
    private final AssertionEvaluator evaluator;

    public VerificationDispatcher(String typeName, String backendSelector, ResourceResolver resolver) {
        this(typeName, backendSelector, resolver, new ArgumentBinder(), new MemberResolver(), new AssertionEvaluator());
    }

    public VerificationDispatcher(
        String typeName,
        String backendSelector,
        ResourceResolver resolver,
        ArgumentBinder binder,
        MemberResolver members,
        AssertionEvaluator evaluator
    ) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.backendSelector = backendSelector;
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.members = Objects.requireNonNull(members, "members");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public String typeName() {
        return typeName;
    }

    @Override
    public VerificationReport verify(String subject, Map<String, Object> checks) {
        ResourceHandle handle;
        try {
            log.debug("Retrieving {} resource.", typeName);
            handle = resolver.resolve(typeName, backendSelector);
        } catch (UnsupportedResourceException ex) {
            log.warn("The {} resource is not supported for this backend and/or platform: {}", typeName, ex.getMessage());
            return VerificationReport.failed();
        }
        log.debug("Parameters accepted by resource {}: {}", typeName, handle.signature());

        BoundArguments bound = binder.bind(handle.signature(), withoutReserved(checks));
        Object instance;
        try {
            instance = handle.instantiate(bound.passSubject() ? subject : null, bound.constructorArguments());
        } catch (ResourceConstructionException ex) {
            log.error("Resource {} failed to instantiate for {}", typeName, subject, ex);
            throw ex;
        }

        log.debug("Checks to evaluate for {} {}: {}", typeName, subject, bound.remainingChecks().keySet());
        boolean success = true;
        List<String> passMessages = new ArrayList<>();
        List<String> failMessages = new ArrayList<>();
        for (var check : bound.remainingChecks().entrySet()) {
            AssertionResult result = evaluate(handle, instance, check.getKey(), check.getValue());
            String message = result.message(typeName, subject);
            if (result.passed()) {
                passMessages.add(message);
            } else {
                success = false;
                failMessages.add(message);
            }
        }
        return new VerificationReport(success, passMessages, failMessages);
    }

    private AssertionResult evaluate(ResourceHandle handle, Object instance, String member, Object expectation) {
        try {
            MemberKind kind = members.resolve(handle, instance, member);
            Object actual = members.result(handle, kind, expectation);
            boolean passed = evaluator.evaluate(expectation, actual);
            return AssertionResult.evaluated(member, expectation, actual, passed);
        } catch (CheckException ex) {
            log.debug("Check {} on {} failed with {}: {}", member, typeName, ex.code(), ex.getMessage());
            return AssertionResult.errored(member, expectation, ex.getMessage());
        }
    }

    private static Map<String, Object> withoutReserved(Map<String, Object> checks) {
        var filtered = new LinkedHashMap<String, Object>();
        if (checks == null) {
            return filtered;
        }
        for (var entry : checks.entrySet()) {
            String name = entry.getKey();
            if (name != null && !name.startsWith(RESERVED_PREFIX)) {
                filtered.put(name, entry.getValue());
            }
        }
        return filtered;
    }
}
