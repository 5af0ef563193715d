package de.caluga.topology.driver.wire;

import de.caluga.topology.driver.DriverException;
import de.caluga.topology.driver.ErrorCodes;
import de.caluga.topology.driver.NotPrimaryException;
import de.caluga.topology.driver.OperationFailureException;
import de.caluga.topology.driver.WriteConcernException;

import java.util.List;
import java.util.Map;

/**
 * turns error replies into exceptions
 */
public final class ReplyHelper {

    private ReplyHelper() {
    }

    /**
     * checks <code>ok</code> and <code>writeConcernError</code> of a reply. Error labels of the reply are
     * copied to the exception.
     */
    @SuppressWarnings("unchecked")
    public static void checkReply(Map<String, Object> reply) throws DriverException {
        if (reply == null) {
            throw new DriverException("reply is null");
        }

        if (!isOk(reply)) {
            Integer code = toInt(reply.get("code"));
            String errmsg = reply.get("errmsg") == null ? "command failed" : reply.get("errmsg").toString();
            OperationFailureException ex;

            if (isNotPrimary(code, errmsg)) {
                ex = new NotPrimaryException(errmsg, code, reply);
            } else {
                ex = new OperationFailureException(errmsg, code, reply);
            }

            if (reply.get("codeName") != null) {
                ex.setCodeName(reply.get("codeName").toString());
            }

            copyLabels(reply.get("errorLabels"), ex);
            throw ex;
        }

        if (reply.get("writeConcernError") instanceof Map) {
            Map<String, Object> wce = (Map<String, Object>) reply.get("writeConcernError");
            Integer code = toInt(wce.get("code"));
            String errmsg = wce.get("errmsg") == null ? "write concern error" : wce.get("errmsg").toString();
            boolean wTimeout = false;

            if (wce.get("errInfo") instanceof Map) {
                wTimeout = Boolean.TRUE.equals(((Map<String, Object>) wce.get("errInfo")).get("wtimeout"));
            }

            WriteConcernException ex = new WriteConcernException(errmsg, code, reply, wTimeout);

            if (wce.get("codeName") != null) {
                ex.setCodeName(wce.get("codeName").toString());
            }

            copyLabels(reply.get("errorLabels"), ex);
            copyLabels(wce.get("errorLabels"), ex);
            throw ex;
        }
    }

    public static boolean isOk(Map<String, Object> reply) {
        Object ok = reply.get("ok");

        if (ok instanceof Number) {
            return ((Number) ok).doubleValue() == 1.0;
        }

        return Boolean.TRUE.equals(ok);
    }

    private static boolean isNotPrimary(Integer code, String errmsg) {
        if (code != null) {
            return ErrorCodes.isNotPrimary(code);
        }

        return errmsg.startsWith("not master") || errmsg.startsWith("node is recovering");
    }

    private static Integer toInt(Object o) {
        if (o instanceof Number) {
            return ((Number) o).intValue();
        }

        return null;
    }

    private static void copyLabels(Object labels, DriverException ex) {
        if (labels instanceof List) {
            for (Object l : (List<?>) labels) {
                ex.addErrorLabel(String.valueOf(l));
            }
        }
    }
}
