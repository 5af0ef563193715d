package de.caluga.topology.driver.commands;

import java.util.Map;

public class CommitTransactionCommand extends AdminMongoCommand<CommitTransactionCommand> {
    private Map<String, Object> writeConcern;
    private Integer maxTimeMS;
    private Map<String, Object> recoveryToken;

    public Map<String, Object> getWriteConcern() {
        return writeConcern;
    }

    public CommitTransactionCommand setWriteConcern(Map<String, Object> writeConcern) {
        this.writeConcern = writeConcern;
        return this;
    }

    public Integer getMaxTimeMS() {
        return maxTimeMS;
    }

    public CommitTransactionCommand setMaxTimeMS(Integer maxTimeMS) {
        this.maxTimeMS = maxTimeMS;
        return this;
    }

    public Map<String, Object> getRecoveryToken() {
        return recoveryToken;
    }

    public CommitTransactionCommand setRecoveryToken(Map<String, Object> recoveryToken) {
        this.recoveryToken = recoveryToken;
        return this;
    }

    @Override
    public String getCommandName() {
        return "commitTransaction";
    }
}
