package de.caluga.topology.driver.bson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.caluga.topology.driver.Doc;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Calendar;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MongoDB Extended JSON. Parsing is strict: a type wrapper with missing or additional fields is an error,
 * it is never interpreted as a plain document.
 */
public final class ExtendedJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter ISO_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final long MAX_ISO_MILLIS = ZonedDateTime.of(10000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant().toEpochMilli();
    private static final String REGEX_FLAGS = "ilmsux";

    private ExtendedJson() {
    }

    public static String toJson(Object value) {
        return toJson(value, JsonOptions.RELAXED);
    }

    public static String toJson(Object value, JsonOptions options) {
        StringWriter w = new StringWriter();

        try (JsonGenerator g = MAPPER.getFactory().createGenerator(w)) {
            writeValue(g, value, options);
        } catch (IOException e) {
            throw new UncheckedIOException("could not write json", e);
        }

        return w.toString();
    }

    public static Object fromJson(String json) {
        return fromJson(json, JsonOptions.RELAXED);
    }

    public static Object fromJson(String json, JsonOptions options) {
        JsonNode n;

        try {
            n = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtendedJsonException("could not parse json: " + e.getOriginalMessage(), e);
        }

        if (n == null) {
            throw new ExtendedJsonException("no json content");
        }

        return convert(n, options);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseDocument(String json, JsonOptions options) {
        Object o = fromJson(json, options);

        if (!(o instanceof Map)) {
            throw new ExtendedJsonException("json is not a document: " + json);
        }

        return (Map<String, Object>) o;
    }

    public static Map<String, Object> parseDocument(String json) {
        return parseDocument(json, JsonOptions.RELAXED);
    }

    // ---------------------------------------------------------------------------------------------- parsing

    private static Object convert(JsonNode n, JsonOptions o) {
        if (n.isObject()) {
            Doc d = new Doc();
            Iterator<Map.Entry<String, JsonNode>> it = n.fields();

            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                d.put(e.getKey(), convert(e.getValue(), o));
            }

            return objectHook(d, o);
        } else if (n.isArray()) {
            List<Object> l = new ArrayList<>(n.size());

            for (JsonNode c : n) {
                l.add(convert(c, o));
            }

            return l;
        } else if (n.isTextual()) {
            return n.textValue();
        } else if (n.isBoolean()) {
            return n.booleanValue();
        } else if (n.isNull()) {
            return null;
        } else if (n.isInt()) {
            return n.intValue();
        } else if (n.isLong()) {
            return n.longValue();
        } else if (n.isBigInteger()) {
            throw new ExtendedJsonException("integer out of int64 range: " + n.asText());
        } else if (n.isNumber()) {
            return n.doubleValue();
        }

        throw new ExtendedJsonException("unsupported json node " + n.getNodeType());
    }

    private static Object objectHook(Doc dct, JsonOptions o) {
        if (dct.containsKey("$oid")) {
            return parseOid(dct);
        }

        if (dct.get("$ref") instanceof String && dct.containsKey("$id") && (dct.get("$db") == null || dct.get("$db") instanceof String)) {
            return parseDbRef(dct);
        }

        if (dct.containsKey("$date")) {
            return parseDate(dct);
        }

        if (dct.containsKey("$regex")) {
            return parseLegacyRegex(dct);
        }

        if (dct.containsKey("$minKey")) {
            checkKey(dct, "$minKey");
            return MongoMinKey.INSTANCE;
        }

        if (dct.containsKey("$maxKey")) {
            checkKey(dct, "$maxKey");
            return MongoMaxKey.INSTANCE;
        }

        if (dct.containsKey("$binary")) {
            if (dct.containsKey("$type")) {
                return parseLegacyBinary(dct, o);
            }

            return parseCanonicalBinary(dct, o);
        }

        if (dct.containsKey("$code")) {
            return parseCode(dct);
        }

        if (dct.containsKey("$uuid")) {
            return parseUuid(dct);
        }

        if (dct.containsKey("$undefined")) {
            checkSingle(dct, "$undefined");
            return null;
        }

        if (dct.containsKey("$numberLong")) {
            return parseNumberLong(dct);
        }

        if (dct.containsKey("$timestamp")) {
            return parseTimestamp(dct);
        }

        if (dct.containsKey("$numberDecimal")) {
            String s = stringValue(dct, "$numberDecimal");

            try {
                return Decimal128.parse(s);
            } catch (NumberFormatException e) {
                throw new ExtendedJsonException("Bad $numberDecimal: " + dct, e);
            }
        }

        if (dct.containsKey("$dbPointer")) {
            return parseDbPointer(dct);
        }

        if (dct.containsKey("$regularExpression")) {
            return parseCanonicalRegex(dct);
        }

        if (dct.containsKey("$symbol")) {
            return stringValue(dct, "$symbol");
        }

        if (dct.containsKey("$numberInt")) {
            String s = stringValue(dct, "$numberInt");

            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                throw new ExtendedJsonException("Bad $numberInt: " + dct, e);
            }
        }

        if (dct.containsKey("$numberDouble")) {
            String s = stringValue(dct, "$numberDouble");

            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new ExtendedJsonException("Bad $numberDouble: " + dct, e);
            }
        }

        if (!o.registry().isEmpty()) {
            return o.registry().decode(dct);
        }

        return dct;
    }

    private static void checkSingle(Map<String, Object> dct, String key) {
        if (dct.size() != 1) {
            throw new ExtendedJsonException("Bad " + key + ", extra field(s): " + dct);
        }
    }

    private static String stringValue(Map<String, Object> dct, String key) {
        checkSingle(dct, key);
        Object v = dct.get(key);

        if (!(v instanceof String)) {
            throw new ExtendedJsonException(key + " must be string: " + dct);
        }

        return (String) v;
    }

    private static void checkKey(Map<String, Object> dct, String key) {
        Object v = dct.get(key);

        if (!(v instanceof Integer) || (Integer) v != 1) {
            throw new ExtendedJsonException(key + " value must be 1: " + dct);
        }

        checkSingle(dct, key);
    }

    private static MongoId parseOid(Map<String, Object> dct) {
        Object v = dct.get("$oid");
        checkSingle(dct, "$oid");

        if (!(v instanceof String) || !MongoId.isValid((String) v)) {
            throw new ExtendedJsonException("Bad $oid, not a 24 character hex string: " + dct);
        }

        return new MongoId((String) v);
    }

    private static Object parseDbRef(Doc dct) {
        for (String k : dct.keySet()) {
            if (k.startsWith("$") && !k.equals("$ref") && !k.equals("$id") && !k.equals("$db")) {
                //other $ keys - not a DBRef
                return dct;
            }
        }

        Doc extra = new Doc(dct);
        extra.remove("$ref");
        extra.remove("$id");
        extra.remove("$db");
        return new DBRef((String) dct.get("$ref"), dct.get("$id"), (String) dct.get("$db"), extra);
    }

    private static Date parseDate(Map<String, Object> dct) {
        checkSingle(dct, "$date");
        Object dtm = dct.get("$date");

        if (dtm instanceof String) {
            return new Date(parseIsoDate((String) dtm, dct));
        } else if (dtm instanceof Long || dtm instanceof Integer) {
            return new Date(((Number) dtm).longValue());
        }

        throw new ExtendedJsonException("Bad $date: " + dct);
    }

    private static long parseIsoDate(String dtm, Map<String, Object> dct) {
        String dt;
        String offset;
        int len = dtm.length();

        if (dtm.endsWith("Z")) {
            dt = dtm.substring(0, len - 1);
            offset = "Z";
        } else if (len > 6 && isSign(dtm.charAt(len - 6)) && dtm.charAt(len - 3) == ':') {
            // +HH:MM
            dt = dtm.substring(0, len - 6);
            offset = dtm.substring(len - 6);
        } else if (len > 5 && isSign(dtm.charAt(len - 5))) {
            // +HHMM
            dt = dtm.substring(0, len - 5);
            offset = dtm.substring(len - 5);
        } else if (len > 3 && isSign(dtm.charAt(len - 3))) {
            // +HH
            dt = dtm.substring(0, len - 3);
            offset = dtm.substring(len - 3);
        } else {
            dt = dtm;
            offset = "Z";
        }

        try {
            LocalDateTime ldt = LocalDateTime.parse(dt);
            return ldt.toInstant(ZoneOffset.of(offset)).toEpochMilli();
        } catch (DateTimeException e) {
            throw new ExtendedJsonException("Bad $date: " + dct, e);
        }
    }

    private static boolean isSign(char c) {
        return c == '+' || c == '-';
    }

    private static Object parseLegacyRegex(Doc dct) {
        Object pattern = dct.get("$regex");

        if (!(pattern instanceof String)) {
            //$regex query operator
            return dct;
        }

        Object opts = dct.get("$options");
        StringBuilder flags = new StringBuilder();

        if (opts instanceof String) {
            for (char c : ((String) opts).toCharArray()) {
                if (REGEX_FLAGS.indexOf(c) >= 0 && flags.indexOf(String.valueOf(c)) < 0) {
                    flags.append(c);
                }
            }
        }

        return new MongoRegex((String) pattern, flags.toString());
    }

    private static Object parseLegacyBinary(Map<String, Object> dct, JsonOptions o) {
        if (dct.size() != 2) {
            throw new ExtendedJsonException("Bad $binary, extra field(s): " + dct);
        }

        Object type = dct.get("$type");
        Object b64 = dct.get("$binary");

        if (!(b64 instanceof String)) {
            throw new ExtendedJsonException("$binary must be a base64 string: " + dct);
        }

        String t;

        if (type instanceof Integer) {
            t = String.format("%02x", (Integer) type);
        } else if (type instanceof String) {
            t = (String) type;
        } else {
            throw new ExtendedJsonException("Bad $type: " + dct);
        }

        long subtype;

        try {
            subtype = Long.parseLong(t, 16);

            if (subtype >= 0xffffff80L && t.length() > 6) {
                //mongoexport writes negative subtypes as 8 hex digits
                subtype = Long.parseLong(t.substring(6), 16);
            }
        } catch (NumberFormatException e) {
            throw new ExtendedJsonException("Bad $type: " + dct, e);
        }

        if (subtype < 0 || subtype > 255) {
            throw new ExtendedJsonException("Bad $type, out of range: " + dct);
        }

        return binaryOrUuid(decodeBase64((String) b64, dct), (int) subtype, o);
    }

    @SuppressWarnings("unchecked")
    private static Object parseCanonicalBinary(Map<String, Object> dct, JsonOptions o) {
        checkSingle(dct, "$binary");
        Object bin = dct.get("$binary");

        if (!(bin instanceof Map)) {
            throw new ExtendedJsonException("$binary must be a document with base64 and subType: " + dct);
        }

        Map<String, Object> binary = (Map<String, Object>) bin;
        Object b64 = binary.get("base64");
        Object subtype = binary.get("subType");

        if (!(b64 instanceof String)) {
            throw new ExtendedJsonException("$binary base64 must be a string: " + dct);
        }

        if (!(subtype instanceof String) || ((String) subtype).isEmpty() || ((String) subtype).length() > 2) {
            throw new ExtendedJsonException("$binary subType must be a string at most 2 characters: " + dct);
        }

        if (binary.size() != 2) {
            throw new ExtendedJsonException("$binary must include only \"base64\" and \"subType\" components: " + dct);
        }

        int st;

        try {
            st = Integer.parseInt((String) subtype, 16);
        } catch (NumberFormatException e) {
            throw new ExtendedJsonException("$binary subType must be hex: " + dct, e);
        }

        return binaryOrUuid(decodeBase64((String) b64, dct), st, o);
    }

    private static byte[] decodeBase64(String b64, Map<String, Object> dct) {
        try {
            return Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new ExtendedJsonException("Bad $binary, invalid base64: " + dct, e);
        }
    }

    private static Object binaryOrUuid(byte[] data, int subtype, JsonOptions o) {
        if (subtype == MongoBinary.SUBTYPE_UUID || subtype == MongoBinary.SUBTYPE_UUID_LEGACY) {
            UUID u = UuidHelper.decode(data, subtype, o.uuidRepresentation());

            if (u != null) {
                return u;
            }
        }

        if (subtype == MongoBinary.SUBTYPE_GENERIC) {
            return data;
        }

        return new MongoBinary(data, subtype);
    }

    @SuppressWarnings("unchecked")
    private static MongoJSScript parseCode(Map<String, Object> dct) {
        boolean hasScope = dct.containsKey("$scope");

        if (dct.size() != (hasScope ? 2 : 1)) {
            throw new ExtendedJsonException("Bad $code, extra field(s): " + dct);
        }

        Object code = dct.get("$code");

        if (!(code instanceof String)) {
            throw new ExtendedJsonException("$code must be string: " + dct);
        }

        if (hasScope) {
            Object scope = dct.get("$scope");

            if (!(scope instanceof Map)) {
                throw new ExtendedJsonException("$scope must be a document: " + dct);
            }

            return new MongoJSScript((String) code, (Map<String, Object>) scope);
        }

        return new MongoJSScript((String) code);
    }

    private static UUID parseUuid(Map<String, Object> dct) {
        String s = stringValue(dct, "$uuid");

        if (s.length() == 32 && s.indexOf('-') < 0) {
            s = s.substring(0, 8) + "-" + s.substring(8, 12) + "-" + s.substring(12, 16) + "-" + s.substring(16, 20) + "-" + s.substring(20);
        }

        if (s.length() != 36) {
            throw new ExtendedJsonException("Bad $uuid: " + dct);
        }

        try {
            return UUID.fromString(s);
        } catch (IllegalArgumentException e) {
            throw new ExtendedJsonException("Bad $uuid: " + dct, e);
        }
    }

    private static Long parseNumberLong(Map<String, Object> dct) {
        String s = stringValue(dct, "$numberLong");

        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new ExtendedJsonException("Bad $numberLong: " + dct, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static MongoTimestamp parseTimestamp(Map<String, Object> dct) {
        checkSingle(dct, "$timestamp");
        Object ts = dct.get("$timestamp");

        if (!(ts instanceof Map)) {
            throw new ExtendedJsonException("Bad $timestamp, expected a document with t and i: " + dct);
        }

        Map<String, Object> tsp = (Map<String, Object>) ts;
        Object t = tsp.get("t");
        Object i = tsp.get("i");

        if (tsp.size() != 2 || !isIntegral(t) || !isIntegral(i)) {
            throw new ExtendedJsonException("Bad $timestamp, must include only \"t\" and \"i\" integers: " + dct);
        }

        long tv = ((Number) t).longValue();
        long iv = ((Number) i).longValue();

        if (tv < 0 || tv > 0xFFFFFFFFL || iv < 0 || iv > 0xFFFFFFFFL) {
            throw new ExtendedJsonException("Bad $timestamp, values out of range: " + dct);
        }

        return new MongoTimestamp((int) tv, (int) iv);
    }

    private static boolean isIntegral(Object o) {
        return o instanceof Integer || o instanceof Long;
    }

    private static DBRef parseDbPointer(Map<String, Object> dct) {
        checkSingle(dct, "$dbPointer");
        Object v = dct.get("$dbPointer");

        if (!(v instanceof DBRef)) {
            throw new ExtendedJsonException("Bad $dbPointer, expected a DBRef: " + dct);
        }

        DBRef ref = (DBRef) v;

        if (ref.getDatabase() != null) {
            throw new ExtendedJsonException("Bad $dbPointer, extra field $db: " + ref.asDoc());
        }

        if (!(ref.getId() instanceof MongoId)) {
            throw new ExtendedJsonException("Bad $dbPointer, $id must be an ObjectId: " + ref.asDoc());
        }

        if (!ref.getExtra().isEmpty()) {
            throw new ExtendedJsonException("Bad $dbPointer, extra field(s) in DBRef: " + ref.asDoc());
        }

        return ref;
    }

    @SuppressWarnings("unchecked")
    private static MongoRegex parseCanonicalRegex(Map<String, Object> dct) {
        checkSingle(dct, "$regularExpression");
        Object v = dct.get("$regularExpression");

        if (!(v instanceof Map) || ((Map<String, Object>) v).size() != 2) {
            throw new ExtendedJsonException("Bad $regularExpression must include only \"pattern\" and \"options\" components: " + dct);
        }

        Map<String, Object> regex = (Map<String, Object>) v;
        Object pattern = regex.get("pattern");
        Object opts = regex.get("options");

        if (!(pattern instanceof String)) {
            throw new ExtendedJsonException("Bad $regularExpression pattern, must be string: " + dct);
        }

        if (!(opts instanceof String)) {
            throw new ExtendedJsonException("Bad $regularExpression options, options must be string: " + dct);
        }

        return new MongoRegex((String) pattern, (String) opts);
    }

    // ---------------------------------------------------------------------------------------------- writing

    @SuppressWarnings("unchecked")
    private static void writeValue(JsonGenerator g, Object v, JsonOptions o) throws IOException {
        if (v == null) {
            g.writeNull();
        } else if (v instanceof String) {
            g.writeString((String) v);
        } else if (v instanceof Boolean) {
            g.writeBoolean((Boolean) v);
        } else if (v instanceof Map) {
            g.writeStartObject();

            for (Map.Entry<String, Object> e : ((Map<String, Object>) v).entrySet()) {
                g.writeFieldName(e.getKey());
                writeValue(g, e.getValue(), o);
            }

            g.writeEndObject();
        } else if (v instanceof Collection) {
            g.writeStartArray();

            for (Object e : (Collection<?>) v) {
                writeValue(g, e, o);
            }

            g.writeEndArray();
        } else if (v instanceof byte[]) {
            writeBinary(g, (byte[]) v, MongoBinary.SUBTYPE_GENERIC, o);
        } else if (v.getClass().isArray()) {
            g.writeStartArray();

            for (int i = 0; i < Array.getLength(v); i++) {
                writeValue(g, Array.get(v, i), o);
            }

            g.writeEndArray();
        } else if (v instanceof MongoId) {
            writeWrapper(g, "$oid", v.toString());
        } else if (v instanceof ObjectId) {
            writeWrapper(g, "$oid", ((ObjectId) v).toHexString());
        } else if (v instanceof DBRef) {
            writeValue(g, ((DBRef) v).asDoc(), o);
        } else if (v instanceof Date) {
            writeDate(g, ((Date) v).getTime(), o);
        } else if (v instanceof Calendar) {
            writeDate(g, ((Calendar) v).getTimeInMillis(), o);
        } else if (v instanceof Long) {
            if (o.strictNumberLong() || o.mode() == JsonMode.CANONICAL) {
                writeWrapper(g, "$numberLong", v.toString());
            } else {
                g.writeNumber((Long) v);
            }
        } else if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            if (o.mode() == JsonMode.CANONICAL) {
                writeWrapper(g, "$numberInt", v.toString());
            } else {
                g.writeNumber(((Number) v).intValue());
            }
        } else if (v instanceof Double || v instanceof Float) {
            writeDouble(g, ((Number) v).doubleValue(), o);
        } else if (v instanceof MongoRegex) {
            writeRegex(g, ((MongoRegex) v).getPattern(), ((MongoRegex) v).getFlags(), o);
        } else if (v instanceof Pattern) {
            writeRegex(g, ((Pattern) v).pattern(), MongoRegex.flagsOf(((Pattern) v).flags()), o);
        } else if (v instanceof MongoMinKey) {
            g.writeStartObject();
            g.writeNumberField("$minKey", 1);
            g.writeEndObject();
        } else if (v instanceof MongoMaxKey) {
            g.writeStartObject();
            g.writeNumberField("$maxKey", 1);
            g.writeEndObject();
        } else if (v instanceof MongoTimestamp) {
            MongoTimestamp ts = (MongoTimestamp) v;
            g.writeStartObject();
            g.writeObjectFieldStart("$timestamp");
            g.writeNumberField("t", ts.getTime());
            g.writeNumberField("i", ts.getInc());
            g.writeEndObject();
            g.writeEndObject();
        } else if (v instanceof MongoJSScript) {
            MongoJSScript c = (MongoJSScript) v;
            g.writeStartObject();
            g.writeStringField("$code", c.getJs());

            if (c.getScope() != null) {
                g.writeFieldName("$scope");
                writeValue(g, c.getScope(), o);
            }

            g.writeEndObject();
        } else if (v instanceof MongoBinary) {
            writeBinary(g, ((MongoBinary) v).getData(), ((MongoBinary) v).getSubtype(), o);
        } else if (v instanceof UUID) {
            if (o.strictUuid()) {
                if (o.uuidRepresentation() == UUIDRepresentation.UNSPECIFIED) {
                    throw new ExtendedJsonException("cannot encode UUID with UNSPECIFIED representation");
                }

                writeBinary(g, UuidHelper.encode((UUID) v, o.uuidRepresentation()), o.uuidRepresentation().getSubtype(), o);
            } else {
                writeWrapper(g, "$uuid", v.toString());
            }
        } else if (v instanceof Decimal128) {
            writeWrapper(g, "$numberDecimal", v.toString());
        } else if (v.getClass().isEnum()) {
            g.writeString(((Enum<?>) v).name());
        } else {
            Map<String, Object> encoded = o.registry().encode(v);

            if (encoded == null) {
                throw new ExtendedJsonException(v.getClass().getName() + " is not JSON serializable: " + v);
            }

            writeValue(g, encoded, o);
        }
    }

    private static void writeWrapper(JsonGenerator g, String key, String value) throws IOException {
        g.writeStartObject();
        g.writeStringField(key, value);
        g.writeEndObject();
    }

    private static void writeDate(JsonGenerator g, long millis, JsonOptions o) throws IOException {
        if (o.datetimeRepresentation() == DatetimeRepresentation.ISO8601 && millis >= 0 && millis < MAX_ISO_MILLIS) {
            ZonedDateTime z = Instant.ofEpochMilli(millis).atZone(ZoneOffset.UTC);
            int ms = (int) (millis % 1000);
            String frac = ms != 0 ? String.format(".%03d", ms) : "";
            writeWrapper(g, "$date", ISO_SECONDS.format(z) + frac + "Z");
        } else if (o.datetimeRepresentation() == DatetimeRepresentation.LEGACY) {
            g.writeStartObject();
            g.writeNumberField("$date", millis);
            g.writeEndObject();
        } else {
            g.writeStartObject();
            g.writeFieldName("$date");
            writeWrapper(g, "$numberLong", Long.toString(millis));
            g.writeEndObject();
        }
    }

    private static void writeDouble(JsonGenerator g, double d, JsonOptions o) throws IOException {
        if (o.mode() != JsonMode.LEGACY) {
            if (Double.isNaN(d)) {
                writeWrapper(g, "$numberDouble", "NaN");
                return;
            } else if (Double.isInfinite(d)) {
                writeWrapper(g, "$numberDouble", d > 0 ? "Infinity" : "-Infinity");
                return;
            } else if (o.mode() == JsonMode.CANONICAL) {
                writeWrapper(g, "$numberDouble", Double.toString(d));
                return;
            }
        }

        g.writeNumber(d);
    }

    private static void writeRegex(JsonGenerator g, String pattern, String flags, JsonOptions o) throws IOException {
        g.writeStartObject();

        if (o.mode() == JsonMode.LEGACY) {
            g.writeStringField("$regex", pattern);
            g.writeStringField("$options", flags);
        } else {
            g.writeObjectFieldStart("$regularExpression");
            g.writeStringField("pattern", pattern);
            g.writeStringField("options", flags);
            g.writeEndObject();
        }

        g.writeEndObject();
    }

    private static void writeBinary(JsonGenerator g, byte[] data, int subtype, JsonOptions o) throws IOException {
        String b64 = Base64.getEncoder().encodeToString(data);
        String st = String.format("%02x", subtype);
        g.writeStartObject();

        if (o.mode() == JsonMode.LEGACY) {
            g.writeStringField("$binary", b64);
            g.writeStringField("$type", st);
        } else {
            g.writeObjectFieldStart("$binary");
            g.writeStringField("base64", b64);
            g.writeStringField("subType", st);
            g.writeEndObject();
        }

        g.writeEndObject();
    }
}
