package com.stackforge.core.actions;

import com.stackforge.core.StackforgeException;
import com.stackforge.core.engine.OperationOutcome;
import com.stackforge.core.engine.OperationRunner;
import com.stackforge.core.engine.StackOperationException;
import com.stackforge.core.hooks.HookException;
import com.stackforge.core.model.ChangeSetStatus;
import com.stackforge.core.model.FailureReason;
import com.stackforge.core.model.InvalidConfigurationException;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import com.stackforge.core.model.StackStatus;
import com.stackforge.core.provider.ProviderException;
import com.stackforge.core.resolver.ResolutionException;
import com.stackforge.core.template.TemplateException;

/**
 * Adapts {@link StackActions} to the executor: dispatches on the operation and
 * turns every failure into a {@link StackOperationException} with a reason.
 */
public class StackActionsRunner implements OperationRunner {

    private final StackActions actions;
    private final String changeSetName;

    public StackActionsRunner(StackActions actions) {
        this(actions, null);
    }

    /**
     * @param changeSetName the change set the change set operations act on, nullable
     */
    public StackActionsRunner(StackActions actions, String changeSetName) {
        this.actions = actions;
        this.changeSetName = changeSetName;
    }

    @Override
    public OperationOutcome run(Stack stack, Operation operation) {
        OperationOutcome outcome;
        try {
            outcome = dispatch(stack, operation);
        } catch (StackOperationException e) {
            throw e;
        } catch (StackforgeException e) {
            throw new StackOperationException(stack.name(), operation, classify(e), e.getMessage(), e);
        }

        if (operation.isMutating() && outcome.status() != StackStatus.COMPLETE) {
            throw new StackOperationException(stack.name(), operation, FailureReason.PROVIDER_ERROR,
                    operation.verb() + " of '" + stack.name() + "' ended in status " + outcome.status());
        }
        return outcome;
    }

    private OperationOutcome dispatch(Stack stack, Operation operation) {
        return switch (operation) {
            case CREATE -> OperationOutcome.of(actions.create(stack));
            case UPDATE -> OperationOutcome.of(actions.update(stack));
            case LAUNCH -> OperationOutcome.of(actions.launch(stack));
            case DELETE -> OperationOutcome.of(actions.delete(stack));
            case CANCEL_UPDATE -> OperationOutcome.of(actions.cancelUpdate(stack));
            case STATUS -> {
                String raw = actions.status(stack);
                StackStatus status = StackActions.PENDING.equals(raw) ? StackStatus.PENDING : StackActions.simplify(raw);
                yield new OperationOutcome(status, raw);
            }
            case DESCRIBE -> {
                var description = actions.describe(stack);
                yield new OperationOutcome(StackActions.simplify(description.status()), description);
            }
            case OUTPUTS -> new OperationOutcome(null, actions.outputs(stack));
            case VALIDATE -> new OperationOutcome(null, actions.validate(stack));
            case GENERATE -> new OperationOutcome(null, actions.generate(stack));
            case DUMP_CONFIG -> new OperationOutcome(null, actions.dumpConfig(stack));
            case DIFF -> new OperationOutcome(null, actions.diff(stack));
            case DESCRIBE_EVENTS -> new OperationOutcome(null, actions.describeEvents(stack));
            case DESCRIBE_RESOURCES -> new OperationOutcome(null, actions.describeResources(stack));
            case CREATE_CHANGE_SET -> {
                ChangeSetStatus status = actions.createChangeSet(stack, changeSetName);
                if (status == ChangeSetStatus.DEFUNCT) {
                    throw new StackOperationException(stack.name(), operation, FailureReason.PROVIDER_ERROR,
                            "Change set '" + changeSetName + "' of '" + stack.name() + "' failed");
                }
                yield new OperationOutcome(null, status);
            }
            case DESCRIBE_CHANGE_SET -> new OperationOutcome(null, actions.describeChangeSet(stack, changeSetName));
            case EXECUTE_CHANGE_SET -> OperationOutcome.of(actions.executeChangeSet(stack, changeSetName));
            case DELETE_CHANGE_SET -> {
                actions.deleteChangeSet(stack, changeSetName);
                yield new OperationOutcome(null, null);
            }
            case LIST_CHANGE_SETS -> new OperationOutcome(null, actions.listChangeSets(stack));
        };
    }

    static FailureReason classify(StackforgeException e) {
        if (e instanceof ProtectedStackException) {
            return FailureReason.PROTECTED;
        } else if (e instanceof StackTimeoutException) {
            return FailureReason.TIMEOUT;
        } else if (e instanceof HookException) {
            return FailureReason.HOOK_ERROR;
        } else if (e instanceof ResolutionException || e instanceof InvalidConfigurationException) {
            return FailureReason.RESOLUTION_ERROR;
        } else if (e instanceof TemplateException) {
            return FailureReason.TEMPLATE_ERROR;
        } else if (e instanceof ProviderException
                || e instanceof CannotUpdateFailedStackException
                || e instanceof UnknownStackStatusException) {
            return FailureReason.PROVIDER_ERROR;
        }
        return FailureReason.UNEXPECTED;
    }
}
