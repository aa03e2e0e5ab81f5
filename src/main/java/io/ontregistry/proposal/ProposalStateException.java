package io.ontregistry.proposal;

import io.ontregistry.RegistryException;
import io.ontregistry.model.ApprovalStatus;

/**
 * An approval-lifecycle operation was attempted from a state that does not allow it. The proposal
 * is left as it was.
 */
public class ProposalStateException extends RegistryException {
    private final String proposalId;
    private final ApprovalStatus state;
    private final String operation;

    public ProposalStateException(String proposalId, ApprovalStatus state, String operation) {
        super("Cannot " + operation + " proposal " + proposalId + " in state " + state.wireName());
        this.proposalId = proposalId;
        this.state = state;
        this.operation = operation;
    }

    public String proposalId() {
        return proposalId;
    }

    public ApprovalStatus state() {
        return state;
    }

    public String operation() {
        return operation;
    }
}
