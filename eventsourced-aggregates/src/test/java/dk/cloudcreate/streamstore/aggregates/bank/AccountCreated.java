package dk.cloudcreate.streamstore.aggregates.bank;

import dk.cloudcreate.streamstore.aggregates.correlated.CorrelatedEvent;
import dk.cloudcreate.streamstore.common.correlation.Correlation;

import java.util.UUID;

public class AccountCreated extends CorrelatedEvent {
    private UUID   accountId;
    private String owner;

    private AccountCreated() {
    }

    public AccountCreated(Correlation correlation, UUID accountId, String owner) {
        super(correlation);
        this.accountId = accountId;
        this.owner = owner;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getOwner() {
        return owner;
    }
}
