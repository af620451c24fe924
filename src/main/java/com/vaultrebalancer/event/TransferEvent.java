package com.vaultrebalancer.event;

import com.vaultrebalancer.domain.model.TransferAction;
import org.springframework.context.ApplicationEvent;

/** Published by the transfer executor once per action, after it reached its terminal status. */
public class TransferEvent extends ApplicationEvent {

    private final TransferAction action;
    private final boolean dryRun;

    public TransferEvent(Object source, TransferAction action, boolean dryRun) {
        super(source);
        this.action = action;
        this.dryRun = dryRun;
    }

    public TransferAction getAction() {
        return action;
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
