package de.caluga.topology.driver.commands;

import java.util.Map;

public class AbortTransactionCommand extends AdminMongoCommand<AbortTransactionCommand> {
    private Map<String, Object> writeConcern;
    private Map<String, Object> recoveryToken;

    public Map<String, Object> getWriteConcern() {
        return writeConcern;
    }

    public AbortTransactionCommand setWriteConcern(Map<String, Object> writeConcern) {
        this.writeConcern = writeConcern;
        return this;
    }

    public Map<String, Object> getRecoveryToken() {
        return recoveryToken;
    }

    public AbortTransactionCommand setRecoveryToken(Map<String, Object> recoveryToken) {
        this.recoveryToken = recoveryToken;
        return this;
    }

    @Override
    public String getCommandName() {
        return "abortTransaction";
    }
}
