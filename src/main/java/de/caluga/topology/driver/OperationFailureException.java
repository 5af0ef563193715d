package de.caluga.topology.driver;

import java.util.Map;

/**
 * the server answered with <code>ok: 0</code>
 */
public class OperationFailureException extends DriverException {
    private String codeName;

    public OperationFailureException(String message, Integer code, Map<String, Object> reply) {
        super(message);
        setMongoCode(code);
        setMongoReason(message);
        setReply(reply);
    }

    public String getCodeName() {
        return codeName;
    }

    public OperationFailureException setCodeName(String codeName) {
        this.codeName = codeName;
        return this;
    }
}
