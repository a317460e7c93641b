package com.stackforge.core.provider;

import java.util.List;
import java.util.Map;

/**
 * Client for the remote infrastructure-as-code API.
 * <p>
 * Calls are synchronous from the caller's point of view but the provider may
 * only have accepted a request when a mutating call returns; completion is
 * observed through {@link #describeStack(String)}. Implementations must be
 * safe for concurrent use.
 */
public interface StackProvider {

    /**
     * Requests creation of a stack.
     *
     * @throws ProviderException with code {@link ProviderException#ALREADY_EXISTS} when the stack exists
     */
    void createStack(StackRequest request);

    /**
     * Requests an update of an existing stack.
     *
     * @throws ProviderException with code {@link ProviderException#NO_UPDATES} when nothing changed
     */
    void updateStack(StackRequest request);

    /** Requests deletion of a stack. */
    void deleteStack(String externalName, String roleArn);

    /** Requests rollback of an update that is in progress. */
    void cancelUpdate(String externalName);

    /**
     * @throws StackDoesNotExistException when no stack has this name
     */
    StackDescription describeStack(String externalName);

    /**
     * @throws StackDoesNotExistException when no stack has this name
     */
    Map<String, String> describeOutputs(String externalName);

    /**
     * Checks a template body and returns what the provider reports about it.
     *
     * @throws ProviderException when the template is invalid
     */
    Map<String, Object> validateTemplate(String templateBody);

    /**
     * The template body the stack was last deployed with.
     *
     * @throws StackDoesNotExistException when no stack has this name
     */
    String getTemplate(String externalName);

    /**
     * Newest first.
     *
     * @throws StackDoesNotExistException when no stack has this name
     */
    List<StackEvent> describeEvents(String externalName);

    /**
     * @throws StackDoesNotExistException when no stack has this name
     */
    List<StackResource> describeResources(String externalName);

    /**
     * Requests a change set describing what {@code request} would change. A
     * change set for a stack that does not exist yet has type
     * {@link ChangeSet#TYPE_CREATE}.
     *
     * @throws ProviderException with code {@link ProviderException#ALREADY_EXISTS} when the name is taken
     */
    void createChangeSet(String changeSetName, StackRequest request);

    /**
     * @throws ChangeSetNotFoundException when the stack has no change set of this name
     */
    ChangeSet describeChangeSet(String externalName, String changeSetName);

    /**
     * Applies a change set to its stack. Completion is observed through
     * {@link #describeStack(String)}.
     *
     * @throws ChangeSetNotFoundException when the stack has no change set of this name
     * @throws ProviderException when the change set is not available for execution
     */
    void executeChangeSet(String externalName, String changeSetName);

    /**
     * @throws ChangeSetNotFoundException when the stack has no change set of this name
     */
    void deleteChangeSet(String externalName, String changeSetName);

    /** Change sets of a stack, oldest first; empty when there are none. */
    List<ChangeSet> listChangeSets(String externalName);
}
