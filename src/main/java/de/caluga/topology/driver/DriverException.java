package de.caluga.topology.driver;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * error during accessing the database through the driver.
 * <p>
 * Errors carry a set of labels (see {@link ErrorLabel}). Labels are attached either by the server or by
 * the driver and are the only thing retry logic should look at.
 **/
public class DriverException extends Exception {
    private String db;
    private Map<String, Object> command;
    private Integer mongoCode;
    private String mongoReason;
    private Map<String, Object> reply;
    private final Set<String> errorLabels = new LinkedHashSet<>();

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }

    public DriverException(String message, Throwable cause, String db, Map<String, Object> command) {
        super(message, cause);
        this.db = db;
        this.command = command;
    }

    public Integer getMongoCode() {
        return mongoCode;
    }

    public DriverException setMongoCode(Integer mongoCode) {
        this.mongoCode = mongoCode;
        return this;
    }

    public String getMongoReason() {
        return mongoReason;
    }

    public DriverException setMongoReason(String mongoReason) {
        this.mongoReason = mongoReason;
        return this;
    }

    public Map<String, Object> getReply() {
        return reply;
    }

    public DriverException setReply(Map<String, Object> reply) {
        this.reply = reply;
        return this;
    }

    public String getDb() {
        return db;
    }

    public DriverException setDb(String db) {
        this.db = db;
        return this;
    }

    public Map<String, Object> getCommand() {
        return command;
    }

    public DriverException setCommand(Map<String, Object> command) {
        this.command = command;
        return this;
    }

    public Set<String> getErrorLabels() {
        return Collections.unmodifiableSet(errorLabels);
    }

    public boolean hasErrorLabel(String label) {
        return errorLabels.contains(label);
    }

    public boolean hasErrorLabel(ErrorLabel label) {
        return errorLabels.contains(label.getLabel());
    }

    public DriverException addErrorLabel(String label) {
        errorLabels.add(label);
        return this;
    }

    public DriverException addErrorLabel(ErrorLabel label) {
        return addErrorLabel(label.getLabel());
    }

    public DriverException removeErrorLabel(ErrorLabel label) {
        errorLabels.remove(label.getLabel());
        return this;
    }
}
