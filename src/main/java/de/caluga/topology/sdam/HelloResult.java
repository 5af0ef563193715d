package de.caluga.topology.sdam;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.bson.MongoId;
import de.caluga.topology.driver.bson.MongoTimestamp;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed reply of <code>hello</code> / legacy <code>isMaster</code>. Fields are named like the reply keys and
 * filled by reflection.
 */
@SuppressWarnings("unused")
public class HelloResult {
    private static final Logger log = LoggerFactory.getLogger(HelloResult.class);

    private Double ok;
    private Boolean helloOk;
    private Boolean isWritablePrimary;
    private Boolean ismaster;
    private Boolean secondary;
    private Boolean arbiterOnly;
    private Boolean hidden;
    private Boolean passive;
    private Boolean isreplicaset;
    //isdbgrid for mongos
    private String msg;
    private String setName;
    private Integer setVersion;
    private MongoId electionId;
    private String primary;
    private String me;
    private List<String> hosts;
    private List<String> passives;
    private List<String> arbiters;
    private Map<String, Object> tags;
    private Integer minWireVersion;
    private Integer maxWireVersion;
    private Integer maxBsonObjectSize;
    private Integer maxMessageSizeBytes;
    private Integer maxWriteBatchSize;
    private Integer logicalSessionTimeoutMinutes;
    private Integer connectionId;
    private Map<String, Object> lastWrite;
    private Date localTime;
    private List<String> compression;
    private Map<String, Object> $clusterTime;
    private MongoTimestamp operationTime;
    private Map<String, Object> topologyVersion;

    @SuppressWarnings("unchecked")
    public static HelloResult fromMsg(Map<String, Object> msg) {
        if (msg == null) {
            return null;
        }

        HelloResult ret = new HelloResult();

        for (Field f : HelloResult.class.getDeclaredFields()) {
            if (Modifier.isStatic(f.getModifiers()) || !msg.containsKey(f.getName())) {
                continue;
            }

            Object v = convert(msg.get(f.getName()), f.getType());

            try {
                f.setAccessible(true);
                f.set(ret, v);
            } catch (Exception e) {
                log.warn("could not set {} to {}: {}", f.getName(), v, e.getMessage());
            }
        }

        return ret;
    }

    private static Object convert(Object v, Class<?> target) {
        if (v == null || target.isInstance(v)) {
            return v;
        }

        if (v instanceof Number) {
            Number n = (Number) v;

            if (target.equals(Integer.class)) {
                return n.intValue();
            } else if (target.equals(Long.class)) {
                return n.longValue();
            } else if (target.equals(Double.class)) {
                return n.doubleValue();
            } else if (target.equals(Boolean.class)) {
                return n.doubleValue() != 0;
            }
        } else if (v instanceof ObjectId && target.equals(MongoId.class)) {
            return new MongoId(((ObjectId) v).toByteArray());
        } else if (v instanceof Boolean && target.equals(Double.class)) {
            return (Boolean) v ? 1.0 : 0.0;
        }

        return null;
    }

    public Map<String, Object> toMsg() {
        Doc ret = new Doc();

        for (Field f : HelloResult.class.getDeclaredFields()) {
            if (Modifier.isStatic(f.getModifiers())) {
                continue;
            }

            try {
                f.setAccessible(true);
                ret.addIfNotNull(f.getName(), f.get(this));
            } catch (IllegalAccessException e) {
                log.error("could not read field {}", f.getName(), e);
            }
        }

        return ret;
    }

    public boolean isOk() {
        return ok != null && ok != 0;
    }

    public ServerType getServerType() {
        if (!isOk()) {
            return ServerType.Unknown;
        }

        if (Boolean.TRUE.equals(isreplicaset)) {
            return ServerType.RSGhost;
        }

        if (setName != null) {
            if (Boolean.TRUE.equals(hidden)) {
                return ServerType.RSOther;
            } else if (isWritablePrimary()) {
                return ServerType.RSPrimary;
            } else if (Boolean.TRUE.equals(secondary)) {
                return ServerType.RSSecondary;
            } else if (Boolean.TRUE.equals(arbiterOnly)) {
                return ServerType.RSArbiter;
            }

            return ServerType.RSOther;
        }

        if ("isdbgrid".equals(msg)) {
            return ServerType.Mongos;
        }

        return ServerType.Standalone;
    }

    public boolean isWritablePrimary() {
        return Boolean.TRUE.equals(isWritablePrimary) || Boolean.TRUE.equals(ismaster);
    }

    /**
     * hosts, passives and arbiters, lower case
     */
    public List<String> getAllHosts() {
        List<String> ret = new ArrayList<>();

        for (List<String> l : List.of(nullSafe(hosts), nullSafe(passives), nullSafe(arbiters))) {
            for (String h : l) {
                String lc = h.toLowerCase(Locale.ROOT);

                if (!ret.contains(lc)) {
                    ret.add(lc);
                }
            }
        }

        return ret;
    }

    private static List<String> nullSafe(List<String> l) {
        return l == null ? List.of() : l;
    }

    /**
     * lastWrite.lastWriteDate in epoch millis
     */
    public Long getLastWriteDate() {
        if (lastWrite == null) {
            return null;
        }

        Object d = lastWrite.get("lastWriteDate");

        if (d instanceof Date) {
            return ((Date) d).getTime();
        } else if (d instanceof Number) {
            return ((Number) d).longValue();
        }

        return null;
    }

    public Map<String, String> getTagsAsStrings() {
        Map<String, String> ret = new LinkedHashMap<>();

        if (tags != null) {
            tags.forEach((k, v) -> ret.put(k, String.valueOf(v)));
        }

        return ret;
    }

    public Double getOk() {
        return ok;
    }

    public HelloResult setOk(Double ok) {
        this.ok = ok;
        return this;
    }

    public Boolean getHelloOk() {
        return helloOk;
    }

    public HelloResult setHelloOk(Boolean helloOk) {
        this.helloOk = helloOk;
        return this;
    }

    public Boolean getIsWritablePrimary() {
        return isWritablePrimary;
    }

    public HelloResult setWritablePrimary(Boolean writablePrimary) {
        isWritablePrimary = writablePrimary;
        return this;
    }

    public Boolean getIsmaster() {
        return ismaster;
    }

    public HelloResult setIsmaster(Boolean ismaster) {
        this.ismaster = ismaster;
        return this;
    }

    public Boolean getSecondary() {
        return secondary;
    }

    public HelloResult setSecondary(Boolean secondary) {
        this.secondary = secondary;
        return this;
    }

    public Boolean getArbiterOnly() {
        return arbiterOnly;
    }

    public HelloResult setArbiterOnly(Boolean arbiterOnly) {
        this.arbiterOnly = arbiterOnly;
        return this;
    }

    public Boolean getHidden() {
        return hidden;
    }

    public HelloResult setHidden(Boolean hidden) {
        this.hidden = hidden;
        return this;
    }

    public Boolean getPassive() {
        return passive;
    }

    public HelloResult setPassive(Boolean passive) {
        this.passive = passive;
        return this;
    }

    public Boolean getIsreplicaset() {
        return isreplicaset;
    }

    public HelloResult setIsreplicaset(Boolean isreplicaset) {
        this.isreplicaset = isreplicaset;
        return this;
    }

    public String getMsg() {
        return msg;
    }

    public HelloResult setMsg(String msg) {
        this.msg = msg;
        return this;
    }

    public String getSetName() {
        return setName;
    }

    public HelloResult setSetName(String setName) {
        this.setName = setName;
        return this;
    }

    public Integer getSetVersion() {
        return setVersion;
    }

    public HelloResult setSetVersion(Integer setVersion) {
        this.setVersion = setVersion;
        return this;
    }

    public MongoId getElectionId() {
        return electionId;
    }

    public HelloResult setElectionId(MongoId electionId) {
        this.electionId = electionId;
        return this;
    }

    public String getPrimary() {
        return primary;
    }

    public HelloResult setPrimary(String primary) {
        this.primary = primary;
        return this;
    }

    public String getMe() {
        return me;
    }

    public HelloResult setMe(String me) {
        this.me = me;
        return this;
    }

    public List<String> getHosts() {
        return hosts;
    }

    public HelloResult setHosts(List<String> hosts) {
        this.hosts = hosts;
        return this;
    }

    public List<String> getPassives() {
        return passives;
    }

    public HelloResult setPassives(List<String> passives) {
        this.passives = passives;
        return this;
    }

    public List<String> getArbiters() {
        return arbiters;
    }

    public HelloResult setArbiters(List<String> arbiters) {
        this.arbiters = arbiters;
        return this;
    }

    public Map<String, Object> getTags() {
        return tags;
    }

    public HelloResult setTags(Map<String, Object> tags) {
        this.tags = tags;
        return this;
    }

    public Integer getMinWireVersion() {
        return minWireVersion;
    }

    public HelloResult setMinWireVersion(Integer minWireVersion) {
        this.minWireVersion = minWireVersion;
        return this;
    }

    public Integer getMaxWireVersion() {
        return maxWireVersion;
    }

    public HelloResult setMaxWireVersion(Integer maxWireVersion) {
        this.maxWireVersion = maxWireVersion;
        return this;
    }

    public Integer getMaxBsonObjectSize() {
        return maxBsonObjectSize;
    }

    public HelloResult setMaxBsonObjectSize(Integer maxBsonObjectSize) {
        this.maxBsonObjectSize = maxBsonObjectSize;
        return this;
    }

    public Integer getMaxMessageSizeBytes() {
        return maxMessageSizeBytes;
    }

    public HelloResult setMaxMessageSizeBytes(Integer maxMessageSizeBytes) {
        this.maxMessageSizeBytes = maxMessageSizeBytes;
        return this;
    }

    public Integer getMaxWriteBatchSize() {
        return maxWriteBatchSize;
    }

    public HelloResult setMaxWriteBatchSize(Integer maxWriteBatchSize) {
        this.maxWriteBatchSize = maxWriteBatchSize;
        return this;
    }

    public Integer getLogicalSessionTimeoutMinutes() {
        return logicalSessionTimeoutMinutes;
    }

    public HelloResult setLogicalSessionTimeoutMinutes(Integer logicalSessionTimeoutMinutes) {
        this.logicalSessionTimeoutMinutes = logicalSessionTimeoutMinutes;
        return this;
    }

    public Integer getConnectionId() {
        return connectionId;
    }

    public HelloResult setConnectionId(Integer connectionId) {
        this.connectionId = connectionId;
        return this;
    }

    public Map<String, Object> getLastWrite() {
        return lastWrite;
    }

    public HelloResult setLastWrite(Map<String, Object> lastWrite) {
        this.lastWrite = lastWrite;
        return this;
    }

    public HelloResult setLastWriteDate(long epochMillis) {
        this.lastWrite = Doc.of("lastWriteDate", new Date(epochMillis));
        return this;
    }

    public Date getLocalTime() {
        return localTime;
    }

    public HelloResult setLocalTime(Date localTime) {
        this.localTime = localTime;
        return this;
    }

    public List<String> getCompression() {
        return compression;
    }

    public HelloResult setCompression(List<String> compression) {
        this.compression = compression;
        return this;
    }

    public Map<String, Object> getClusterTime() {
        return $clusterTime;
    }

    public HelloResult setClusterTime(Map<String, Object> clusterTime) {
        this.$clusterTime = clusterTime;
        return this;
    }

    public MongoTimestamp getOperationTime() {
        return operationTime;
    }

    public HelloResult setOperationTime(MongoTimestamp operationTime) {
        this.operationTime = operationTime;
        return this;
    }

    public Map<String, Object> getTopologyVersion() {
        return topologyVersion;
    }

    public HelloResult setTopologyVersion(Map<String, Object> topologyVersion) {
        this.topologyVersion = topologyVersion;
        return this;
    }

    @Override
    public String toString() {
        return "HelloResult" + toMsg();
    }
}
