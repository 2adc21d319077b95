package com.mouse.betinfo.exception;

import com.mouse.betinfo.enums.ProposalStatus;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends LedgerException {

    private final ProposalStatus from;
    private final ProposalStatus to;

    public InvalidTransitionException(ProposalStatus from, ProposalStatus to) {
        super(String.format("Illegal proposal status transition %s -> %s", from, to));
        this.from = from;
        this.to = to;
    }
}
