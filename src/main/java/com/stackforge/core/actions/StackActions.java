package com.stackforge.core.actions;

import com.stackforge.core.StackforgeException;
import com.stackforge.core.diff.StackConfiguration;
import com.stackforge.core.diff.StackDiff;
import com.stackforge.core.diff.StackDiffer;
import com.stackforge.core.hooks.HookRunner;
import com.stackforge.core.model.ChangeSetStatus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import com.stackforge.core.model.StackStatus;
import com.stackforge.core.provider.ChangeSet;
import com.stackforge.core.provider.ConnectionManager;
import com.stackforge.core.provider.ProviderException;
import com.stackforge.core.provider.StackDescription;
import com.stackforge.core.provider.StackDoesNotExistException;
import com.stackforge.core.provider.StackEvent;
import com.stackforge.core.provider.StackProvider;
import com.stackforge.core.provider.StackRequest;
import com.stackforge.core.provider.StackResource;
import com.stackforge.core.resolver.PlaceholderType;
import com.stackforge.core.resolver.ResolutionContext;
import com.stackforge.core.template.TemplateHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The operations that can be applied to a single stack.
 * <p>
 * Every public operation materializes the stack's configuration in a fresh
 * {@link ResolutionContext}, runs the {@code before_<operation>} hooks, calls
 * the provider and, if nothing was thrown, runs the {@code after_<operation>}
 * hooks. Provider errors are not retried here.
 */
public class StackActions {

    private static final Logger log = LoggerFactory.getLogger(StackActions.class);

    /** Status reported for a stack the provider does not know. */
    public static final String PENDING = "PENDING";

    private static final List<String> CHANGE_SET_STATUSES = List.of(
            "CREATE_PENDING", "CREATE_IN_PROGRESS", "CREATE_COMPLETE", "DELETE_COMPLETE", "FAILED");
    private static final List<String> EXECUTION_STATUSES = List.of(
            "UNAVAILABLE", "AVAILABLE", "EXECUTE_IN_PROGRESS", "EXECUTE_COMPLETE", "EXECUTE_FAILED", "OBSOLETE");

    private final Map<String, Stack> stacks;
    private final ConnectionManager connections;
    private final TemplateHandlerRegistry templates;
    private final boolean placeholders;
    private final Duration pollInterval;
    private final Clock clock;
    private final StackDiffer differ = new StackDiffer();

    public StackActions(Map<String, Stack> stacks, ConnectionManager connections, TemplateHandlerRegistry templates,
                        boolean placeholders, Duration pollInterval) {
        this(stacks, connections, templates, placeholders, pollInterval, Clock.systemUTC());
    }

    StackActions(Map<String, Stack> stacks, ConnectionManager connections, TemplateHandlerRegistry templates,
                 boolean placeholders, Duration pollInterval, Clock clock) {
        this.stacks = stacks;
        this.connections = connections;
        this.templates = templates;
        this.placeholders = placeholders;
        this.pollInterval = pollInterval;
        this.clock = clock;
    }

    public StackStatus create(Stack stack) {
        return create(stack, newContext());
    }

    public StackStatus update(Stack stack) {
        return update(stack, newContext());
    }

    public StackStatus delete(Stack stack) {
        return delete(stack, newContext());
    }

    /**
     * Creates the stack if it does not exist and updates it otherwise. A stack
     * whose creation failed is deleted and created again.
     */
    public StackStatus launch(Stack stack) {
        ResolutionContext context = newContext();
        return withHooks(stack, Operation.LAUNCH, context, () -> {
            protect(stack);
            log.info("{} - Launching stack", stack.name());
            String existing = rawStatus(stack, context);
            log.info("{} - Stack is in the {} state", stack.name(), existing);

            if (PENDING.equals(existing)) {
                return create(stack, context);
            }
            if (List.of("CREATE_FAILED", "ROLLBACK_COMPLETE", "REVIEW_IN_PROGRESS").contains(existing)) {
                delete(stack, context);
                return create(stack, context);
            }
            if (existing.endsWith("COMPLETE")) {
                return update(stack, context);
            }
            if (existing.endsWith("IN_PROGRESS")) {
                log.info("{} - Stack action is already in progress and cannot be updated", stack.name());
                return StackStatus.IN_PROGRESS;
            }
            if (existing.endsWith("FAILED")) {
                throw new CannotUpdateFailedStackException(stack.name(), existing);
            }
            throw new UnknownStackStatusException(existing);
        });
    }

    /** Sends a cancel-update request and waits for the rollback to settle. */
    public StackStatus cancelUpdate(Stack stack) {
        ResolutionContext context = newContext();
        return withHooks(stack, Operation.CANCEL_UPDATE, context, () -> cancelUpdate(stack, context));
    }

    /**
     * @return the raw provider status, or {@link #PENDING} when the stack does not exist
     */
    public String status(Stack stack) {
        return rawStatus(stack, newContext());
    }

    public StackDescription describe(Stack stack) {
        ResolutionContext context = newContext();
        return context.providerFor(stack).describeStack(stack.externalName());
    }

    public Map<String, String> outputs(Stack stack) {
        ResolutionContext context = newContext();
        return context.providerFor(stack).describeOutputs(stack.externalName());
    }

    public List<StackEvent> describeEvents(Stack stack) {
        ResolutionContext context = newContext();
        return context.providerFor(stack).describeEvents(stack.externalName());
    }

    /**
     * @return the stack's resources; empty when the stack does not exist
     */
    public List<StackResource> describeResources(Stack stack) {
        ResolutionContext context = newContext();
        log.debug("{} - Describing stack resources", stack.name());
        try {
            return context.providerFor(stack).describeResources(stack.externalName());
        } catch (StackDoesNotExistException e) {
            return List.of();
        }
    }

    /**
     * Compares the stack's local definition with what is deployed. Values that
     * cannot be resolved yet, such as outputs of stacks that were never
     * launched, are compared as placeholders.
     */
    public StackDiff diff(Stack stack) {
        ResolutionContext context = new ResolutionContext(stacks, connections, true);
        return withHooks(stack, Operation.DIFF, context, () -> {
            StackRequest generated = request(stack, context, false);
            StackProvider provider = context.providerFor(stack);
            StackConfiguration deployed = null;
            String deployedTemplate = null;
            try {
                StackDescription description = provider.describeStack(stack.externalName());
                deployed = new StackConfiguration(description.externalName(), description.parameters(),
                        description.tags(), description.notifications(), description.roleArn());
                deployedTemplate = provider.getTemplate(stack.externalName());
            } catch (StackDoesNotExistException e) {
                log.info("{} - Not deployed yet", stack.name());
            }
            var configuration = new StackConfiguration(generated.externalName(), generated.parameters(),
                    generated.tags(), generated.notifications(), generated.roleArn());
            return differ.diff(configuration, generated.templateBody(), deployed, deployedTemplate);
        });
    }

    /**
     * Creates a change set named {@code name} and waits until the provider has
     * computed it. The change set creates the stack when it does not exist.
     */
    public ChangeSetStatus createChangeSet(Stack stack, String name) {
        ResolutionContext context = newContext();
        return withHooks(stack, Operation.CREATE_CHANGE_SET, context, () -> {
            String existing = rawStatus(stack, context);
            log.info("{} - Stack is in the {} state", stack.name(), existing);
            boolean create = PENDING.equals(existing) || "REVIEW_IN_PROGRESS".equals(existing);
            StackProvider provider = context.providerFor(stack);
            provider.createChangeSet(name, request(stack, context, create));
            log.info("{} - Creating change set '{}'", stack.name(), name);
            return waitForChangeSet(stack, provider, name);
        });
    }

    public ChangeSet describeChangeSet(Stack stack, String name) {
        ResolutionContext context = newContext();
        log.debug("{} - Describing change set '{}'", stack.name(), name);
        return context.providerFor(stack).describeChangeSet(stack.externalName(), name);
    }

    /**
     * Executes a change set and waits for the stack to settle. A change set
     * without changes is skipped and counts as complete.
     */
    public StackStatus executeChangeSet(Stack stack, String name) {
        protect(stack);
        ResolutionContext context = newContext();
        StackProvider provider = context.providerFor(stack);
        ChangeSet changeSet = provider.describeChangeSet(stack.externalName(), name);
        if (simplify(changeSet) == ChangeSetStatus.NO_CHANGES) {
            log.info("{} - Change set '{}' has no changes; skipping", stack.name(), name);
            return StackStatus.COMPLETE;
        }
        log.info("{} - Executing change set '{}'", stack.name(), name);
        provider.executeChangeSet(stack.externalName(), name);
        return waitForCompletion(stack, provider, 0);
    }

    public void deleteChangeSet(Stack stack, String name) {
        ResolutionContext context = newContext();
        context.providerFor(stack).deleteChangeSet(stack.externalName(), name);
        log.info("{} - Deleted change set '{}'", stack.name(), name);
    }

    public List<ChangeSet> listChangeSets(Stack stack) {
        ResolutionContext context = newContext();
        log.debug("{} - Listing change sets", stack.name());
        return context.providerFor(stack).listChangeSets(stack.externalName());
    }

    /**
     * @throws ProviderException when the provider rejects the template
     */
    public Map<String, Object> validate(Stack stack) {
        ResolutionContext context = newContext();
        return withHooks(stack, Operation.VALIDATE, context, () -> {
            log.debug("{} - Validating template", stack.name());
            return context.providerFor(stack).validateTemplate(templateBody(stack, context));
        });
    }

    /** The rendered template, without calling the provider. */
    public String generate(Stack stack) {
        ResolutionContext context = newContext();
        return withHooks(stack, Operation.GENERATE, context, () -> templateBody(stack, context));
    }

    /** The stack's materialized configuration, hooks excluded. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> dumpConfig(Stack stack) {
        ResolutionContext context = newContext();
        var raw = new LinkedHashMap<String, Object>(stack.attributes());
        raw.remove(Stack.HOOKS);
        var config = new LinkedHashMap<String, Object>();
        config.put("name", stack.name());
        config.put("external_name", stack.externalName());
        config.put("dependencies", List.copyOf(stack.dependencies()));
        config.putAll((Map<String, Object>) context.materialize(raw, PlaceholderType.EXPLICIT));
        return config;
    }

    /**
     * Simplifies a raw provider status.
     *
     * @throws UnknownStackStatusException when the status has no known suffix
     */
    public static StackStatus simplify(String status) {
        if (status.endsWith("ROLLBACK_COMPLETE")) {
            return StackStatus.FAILED;
        } else if (status.endsWith("_COMPLETE")) {
            return StackStatus.COMPLETE;
        } else if (status.endsWith("_IN_PROGRESS")) {
            return StackStatus.IN_PROGRESS;
        } else if (status.endsWith("_FAILED")) {
            return StackStatus.FAILED;
        }
        throw new UnknownStackStatusException(status);
    }

    /**
     * Simplifies the status of a change set.
     *
     * @throws UnknownStackStatusException when the status or execution status is not known
     */
    public static ChangeSetStatus simplify(ChangeSet changeSet) {
        String status = changeSet.status();
        String execution = changeSet.executionStatus();
        if (!CHANGE_SET_STATUSES.contains(status)) {
            throw new UnknownStackStatusException(status);
        }
        if (!EXECUTION_STATUSES.contains(execution)) {
            throw new UnknownStackStatusException(execution);
        }
        boolean executable = "UNAVAILABLE".equals(execution) || "AVAILABLE".equals(execution);
        if ("CREATE_COMPLETE".equals(status) && "AVAILABLE".equals(execution)) {
            return ChangeSetStatus.READY;
        } else if (status.startsWith("CREATE_") && executable) {
            return ChangeSetStatus.PENDING;
        } else if ("FAILED".equals(status) && hasNoChanges(changeSet.statusReason())) {
            return ChangeSetStatus.NO_CHANGES;
        }
        return ChangeSetStatus.DEFUNCT;
    }

    static boolean hasNoChanges(String reason) {
        if (reason == null) {
            return false;
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        return lower.contains("submitted information didn't contain changes")
                || lower.contains("no updates are to be performed");
    }

    private StackStatus create(Stack stack, ResolutionContext context) {
        return withHooks(stack, Operation.CREATE, context, () -> {
            protect(stack);
            log.info("{} - Creating stack", stack.name());
            StackProvider provider = context.providerFor(stack);
            try {
                provider.createStack(request(stack, context, true));
            } catch (ProviderException e) {
                if (e.hasCode(ProviderException.ALREADY_EXISTS)) {
                    log.info("{} - Stack already exists", stack.name());
                    return StackStatus.COMPLETE;
                }
                throw e;
            }
            return waitForCompletion(stack, provider, 0);
        });
    }

    private StackStatus update(Stack stack, ResolutionContext context) {
        return withHooks(stack, Operation.UPDATE, context, () -> {
            protect(stack);
            log.info("{} - Updating stack", stack.name());
            StackProvider provider = context.providerFor(stack);
            try {
                provider.updateStack(request(stack, context, false));
            } catch (ProviderException e) {
                if (e.hasCode(ProviderException.NO_UPDATES)) {
                    log.info("{} - No updates to perform", stack.name());
                    return StackStatus.COMPLETE;
                }
                throw e;
            }
            int timeout = stack.stackTimeout();
            StackStatus status = waitForCompletion(stack, provider, timeout);
            if (status == StackStatus.IN_PROGRESS) {
                log.warn("{} - Update exceeded the timeout of {} minute(s)", stack.name(), timeout);
                StackStatus afterCancel;
                try {
                    afterCancel = cancelUpdate(stack, context);
                } catch (ProviderException e) {
                    log.error("{} - Could not cancel the update: {}", stack.name(), e.getMessage());
                    var timedOut = new StackTimeoutException(stack.name(), timeout, "UNKNOWN");
                    timedOut.addSuppressed(e);
                    throw timedOut;
                }
                throw new StackTimeoutException(stack.name(), timeout, afterCancel.name());
            }
            return status;
        });
    }

    private StackStatus delete(Stack stack, ResolutionContext context) {
        return withHooks(stack, Operation.DELETE, context, () -> {
            protect(stack);
            log.info("{} - Deleting stack", stack.name());
            StackProvider provider = context.providerFor(stack);
            try {
                provider.describeStack(stack.externalName());
            } catch (StackDoesNotExistException e) {
                log.info("{} - Does not exist", stack.name());
                return StackStatus.COMPLETE;
            }

            Object roleArn = context.attribute(stack, Stack.ROLE_ARN, PlaceholderType.NONE);
            provider.deleteStack(stack.externalName(), roleArn == null ? null : roleArn.toString());
            StackStatus status;
            try {
                status = waitForCompletion(stack, provider, 0);
            } catch (StackDoesNotExistException e) {
                status = StackStatus.COMPLETE;
            }
            log.info("{} - Delete {}", stack.name(), status);
            return status;
        });
    }

    private StackStatus cancelUpdate(Stack stack, ResolutionContext context) {
        log.warn("{} - Cancelling update", stack.name());
        StackProvider provider = context.providerFor(stack);
        provider.cancelUpdate(stack.externalName());
        return waitForCompletion(stack, provider, 0);
    }

    private String rawStatus(Stack stack, ResolutionContext context) {
        try {
            return context.providerFor(stack).describeStack(stack.externalName()).status();
        } catch (StackDoesNotExistException e) {
            return PENDING;
        }
    }

    /**
     * Polls until the stack leaves IN_PROGRESS or {@code timeoutMinutes} elapse.
     *
     * @return the simplified status; IN_PROGRESS only when the timeout elapsed
     */
    private StackStatus waitForCompletion(Stack stack, StackProvider provider, int timeoutMinutes) {
        Instant deadline = timeoutMinutes > 0 ? clock.instant().plus(Duration.ofMinutes(timeoutMinutes)) : null;
        while (true) {
            StackDescription description = provider.describeStack(stack.externalName());
            StackStatus status = simplify(description.status());
            log.debug("{} - {} {}", stack.name(), description.status(),
                    description.statusReason() == null ? "" : description.statusReason());
            if (status != StackStatus.IN_PROGRESS) {
                return status;
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                return StackStatus.IN_PROGRESS;
            }
            sleep();
        }
    }

    private ChangeSetStatus waitForChangeSet(Stack stack, StackProvider provider, String name) {
        while (true) {
            ChangeSetStatus status = simplify(provider.describeChangeSet(stack.externalName(), name));
            if (status != ChangeSetStatus.PENDING) {
                log.info("{} - Change set '{}' is {}", stack.name(), name, status);
                return status;
            }
            sleep();
        }
    }

    private void sleep() {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StackforgeException("Interrupted while waiting for the stack to settle", e);
        }
    }

    private StackRequest request(Stack stack, ResolutionContext context, boolean create) {
        Map<String, Object> parameters = context.mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT);
        Map<String, Object> tags = context.mapAttribute(stack, Stack.TAGS, PlaceholderType.EXPLICIT);
        List<Object> notifications = context.listAttribute(stack, Stack.NOTIFICATIONS, PlaceholderType.EXPLICIT);
        Object roleArn = context.attribute(stack, Stack.ROLE_ARN, PlaceholderType.NONE);
        Object onFailure = create ? context.attribute(stack, Stack.ON_FAILURE, PlaceholderType.EXPLICIT) : null;
        boolean disableRollback = Boolean.parseBoolean(String.valueOf(stack.attribute(Stack.DISABLE_ROLLBACK)));

        return new StackRequest(
                stack.externalName(),
                templateBody(stack, context),
                formatParameters(parameters),
                stringify(tags),
                notifications.stream().map(String::valueOf).toList(),
                roleArn == null ? null : roleArn.toString(),
                onFailure == null ? null : onFailure.toString(),
                disableRollback,
                create ? stack.stackTimeout() : 0);
    }

    /** Drops null values and joins lists with commas. */
    static Map<String, String> formatParameters(Map<String, Object> parameters) {
        var formatted = new LinkedHashMap<String, String>();
        parameters.forEach((key, value) -> {
            if (value instanceof List<?> list) {
                formatted.put(key, list.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else if (value != null) {
                formatted.put(key, String.valueOf(value));
            }
        });
        return formatted;
    }

    private static Map<String, String> stringify(Map<String, Object> values) {
        var strings = new LinkedHashMap<String, String>();
        values.forEach((key, value) -> strings.put(key, String.valueOf(value)));
        return strings;
    }

    private String templateBody(Stack stack, ResolutionContext context) {
        Map<String, Object> userData = context.mapAttribute(stack, Stack.USER_DATA, PlaceholderType.ALPHANUM);
        Object path = context.attribute(stack, Stack.TEMPLATE_PATH, PlaceholderType.ALPHANUM);
        if (path != null) {
            return templates.handler(TemplateHandlerRegistry.DEFAULT_TYPE)
                    .render(stack, Map.of("path", path.toString()), userData);
        }
        var arguments = new LinkedHashMap<>(context.mapAttribute(stack, Stack.TEMPLATE, PlaceholderType.ALPHANUM));
        Object type = arguments.remove("type");
        return templates.handler(type == null ? null : type.toString()).render(stack, arguments, userData);
    }

    private static void protect(Stack stack) {
        if (stack.isProtected()) {
            throw new ProtectedStackException(stack.name());
        }
    }

    private <T> T withHooks(Stack stack, Operation operation, ResolutionContext context, Supplier<T> action) {
        HookRunner.run(stack, operation.beforeHook(), context);
        T result = action.get();
        HookRunner.run(stack, operation.afterHook(), context);
        return result;
    }

    private ResolutionContext newContext() {
        return new ResolutionContext(stacks, connections, placeholders);
    }
}
