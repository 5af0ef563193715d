package de.caluga.topology.driver.bson;

/**
 * immutable Extended JSON settings. Use one of the presets and the <code>with...</code> methods to change
 * single values.
 */
public record JsonOptions(JsonMode mode, boolean strictNumberLong, DatetimeRepresentation datetimeRepresentation, boolean strictUuid,
                          UUIDRepresentation uuidRepresentation, TypeCodecRegistry registry) {

    public static final JsonOptions LEGACY = new JsonOptions(JsonMode.LEGACY, false, DatetimeRepresentation.LEGACY, false,
        UUIDRepresentation.STANDARD, TypeCodecRegistry.EMPTY);
    public static final JsonOptions RELAXED = new JsonOptions(JsonMode.RELAXED, false, DatetimeRepresentation.ISO8601, true,
        UUIDRepresentation.STANDARD, TypeCodecRegistry.EMPTY);
    public static final JsonOptions CANONICAL = new JsonOptions(JsonMode.CANONICAL, true, DatetimeRepresentation.NUMBERLONG, true,
        UUIDRepresentation.STANDARD, TypeCodecRegistry.EMPTY);

    public JsonOptions {
        if (mode == null || datetimeRepresentation == null || uuidRepresentation == null) {
            throw new IllegalArgumentException("mode, datetime and uuid representation are mandatory");
        }

        if (registry == null) {
            registry = TypeCodecRegistry.EMPTY;
        }
    }

    public static JsonOptions forMode(JsonMode mode) {
        switch (mode) {
            case LEGACY:
                return LEGACY;

            case CANONICAL:
                return CANONICAL;

            default:
                return RELAXED;
        }
    }

    public JsonOptions withStrictNumberLong(boolean v) {
        return new JsonOptions(mode, v, datetimeRepresentation, strictUuid, uuidRepresentation, registry);
    }

    public JsonOptions withDatetimeRepresentation(DatetimeRepresentation v) {
        return new JsonOptions(mode, strictNumberLong, v, strictUuid, uuidRepresentation, registry);
    }

    public JsonOptions withStrictUuid(boolean v) {
        return new JsonOptions(mode, strictNumberLong, datetimeRepresentation, v, uuidRepresentation, registry);
    }

    public JsonOptions withUuidRepresentation(UUIDRepresentation v) {
        return new JsonOptions(mode, strictNumberLong, datetimeRepresentation, strictUuid, v, registry);
    }

    public JsonOptions withRegistry(TypeCodecRegistry v) {
        return new JsonOptions(mode, strictNumberLong, datetimeRepresentation, strictUuid, uuidRepresentation, v);
    }
}
