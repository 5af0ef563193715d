package de.caluga.topology.driver;

public enum ReadPreferenceType {
    PRIMARY("primary", "Primary"),
    PRIMARY_PREFERRED("primaryPreferred", "PrimaryPreferred"),
    SECONDARY("secondary", "Secondary"),
    SECONDARY_PREFERRED("secondaryPreferred", "SecondaryPreferred"),
    NEAREST("nearest", "Nearest");

    private final String mongoName;
    private final String displayName;

    ReadPreferenceType(String mongoName, String displayName) {
        this.mongoName = mongoName;
        this.displayName = displayName;
    }

    /**
     * name as used in commands and connection strings
     */
    public String getMongoName() {
        return mongoName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * accepts the mongo name (<code>secondaryPreferred</code>) as well as the enum name
     */
    public static ReadPreferenceType fromName(String name) {
        if (name != null) {
            for (ReadPreferenceType t : values()) {
                if (t.mongoName.equalsIgnoreCase(name) || t.name().equalsIgnoreCase(name)) {
                    return t;
                }
            }
        }

        throw new ConfigurationException("unknown read preference mode: " + name);
    }
}
