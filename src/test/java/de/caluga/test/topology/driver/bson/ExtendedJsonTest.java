package de.caluga.test.topology.driver.bson;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.bson.DBRef;
import de.caluga.topology.driver.bson.ExtendedJson;
import de.caluga.topology.driver.bson.ExtendedJsonException;
import de.caluga.topology.driver.bson.JsonOptions;
import de.caluga.topology.driver.bson.MongoBinary;
import de.caluga.topology.driver.bson.MongoId;
import de.caluga.topology.driver.bson.MongoMaxKey;
import de.caluga.topology.driver.bson.MongoMinKey;
import de.caluga.topology.driver.bson.MongoRegex;
import de.caluga.topology.driver.bson.MongoTimestamp;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("codec")
public class ExtendedJsonTest {
    private static final Logger log = LoggerFactory.getLogger(ExtendedJsonTest.class);

    enum Mode {
        CANONICAL(JsonOptions.CANONICAL), RELAXED(JsonOptions.RELAXED);
        final JsonOptions options;

        Mode(JsonOptions o) {
            options = o;
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void wrapperTypesSurviveRoundTrip(Mode mode) {
        MongoId id = new MongoId("5f1e9c2b8a1d4e3f2a1b0c9d");
        Doc doc = Doc.of("_id", id, "long", 4000000000L, "decimal", Decimal128.parse("1234.5678"), "ts", new MongoTimestamp(1600000000, 7));
        doc.put("binary", new MongoBinary(new byte[] {1, 2, 3, 4}, 0x80));
        doc.put("regex", new MongoRegex("^abc$", "mi"));
        doc.put("ref", new DBRef("coll", id, "db"));
        doc.put("min", MongoMinKey.INSTANCE);
        doc.put("max", MongoMaxKey.INSTANCE);
        String json = ExtendedJson.toJson(doc, mode.options);
        log.debug("{}: {}", mode, json);
        Map<String, Object> back = ExtendedJson.parseDocument(json, mode.options);
        assertEquals(doc, back);
    }

    @Test
    public void canonicalNumbers() {
        String json = ExtendedJson.toJson(Doc.of("i", 1, "l", 2L, "d", 1.5), JsonOptions.CANONICAL);
        assertEquals("{\"i\":{\"$numberInt\":\"1\"},\"l\":{\"$numberLong\":\"2\"},\"d\":{\"$numberDouble\":\"1.5\"}}", json);
    }

    @Test
    public void relaxedNumbers() {
        String json = ExtendedJson.toJson(Doc.of("i", 1, "l", 2L, "d", 1.5, "nan", Double.NaN), JsonOptions.RELAXED);
        assertEquals("{\"i\":1,\"l\":2,\"d\":1.5,\"nan\":{\"$numberDouble\":\"NaN\"}}", json);
    }

    @Test
    public void relaxedDatesAreIso() {
        Date d = new Date(1577836800123L);
        assertEquals("{\"d\":{\"$date\":\"2020-01-01T00:00:00.123Z\"}}", ExtendedJson.toJson(Doc.of("d", d), JsonOptions.RELAXED));
        assertEquals("{\"d\":{\"$date\":{\"$numberLong\":\"1577836800123\"}}}", ExtendedJson.toJson(Doc.of("d", d), JsonOptions.CANONICAL));
        assertEquals("{\"d\":{\"$date\":1577836800123}}", ExtendedJson.toJson(Doc.of("d", d), JsonOptions.LEGACY));
        // before the epoch relaxed falls back to numberLong
        assertThat(ExtendedJson.toJson(Doc.of("d", new Date(-1000)), JsonOptions.RELAXED)).contains("$numberLong");
    }

    @Test
    public void dateOffsetsAreParsed() {
        long expected = 1577836800000L;
        assertEquals(new Date(expected), ExtendedJson.fromJson("{\"$date\":\"2020-01-01T00:00:00Z\"}"));
        assertEquals(new Date(expected), ExtendedJson.fromJson("{\"$date\":\"2020-01-01T01:00:00+01:00\"}"));
        assertEquals(new Date(expected), ExtendedJson.fromJson("{\"$date\":\"2020-01-01T01:00:00+0100\"}"));
        assertEquals(new Date(expected), ExtendedJson.fromJson("{\"$date\":\"2019-12-31T23:00:00-01\"}"));
        assertEquals(new Date(expected), ExtendedJson.fromJson("{\"$date\":{\"$numberLong\":\"1577836800000\"}}"));
        assertEquals(new Date(expected), ExtendedJson.fromJson("{\"$date\":1577836800000}"));
    }

    @Test
    public void invalidDatesAreRejected() {
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$date\":\"2020-13-01T00:00:00Z\"}")).isInstanceOf(ExtendedJsonException.class).hasMessageStartingWith("Bad $date");
        // offset out of range
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$date\":\"2020-01-01T00:00:00+25:00\"}")).isInstanceOf(ExtendedJsonException.class).hasMessageStartingWith("Bad $date");
    }

    @Test
    public void regexFlagsAreOrdered() {
        Pattern p = Pattern.compile("a.c", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        assertEquals("{\"r\":{\"$regex\":\"a.c\",\"$options\":\"ims\"}}", ExtendedJson.toJson(Doc.of("r", p), JsonOptions.LEGACY));
        assertEquals("{\"r\":{\"$regularExpression\":{\"pattern\":\"a.c\",\"options\":\"ims\"}}}", ExtendedJson.toJson(Doc.of("r", p), JsonOptions.RELAXED));
    }

    @Test
    public void regexQueryOperatorIsKept() {
        Object o = ExtendedJson.fromJson("{\"$regex\":{\"$in\":[\"a\"]}}");
        assertThat(o).isInstanceOf(Map.class);
    }

    @Test
    public void extraFieldsAreRejected() {
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$oid\":\"5f1e9c2b8a1d4e3f2a1b0c9d\",\"x\":1}")).isInstanceOf(ExtendedJsonException.class)
        .hasMessageContaining("Bad $oid, extra field(s)");
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$numberLong\":\"1\",\"x\":1}")).isInstanceOf(ExtendedJsonException.class)
        .hasMessageContaining("$numberLong");
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$timestamp\":{\"t\":1}}")).isInstanceOf(ExtendedJsonException.class)
        .hasMessageContaining("$timestamp");
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$binary\":{\"base64\":\"AQI=\",\"subType\":\"800\"}}")).isInstanceOf(ExtendedJsonException.class)
        .hasMessageContaining("subType");
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$minKey\":2}")).isInstanceOf(ExtendedJsonException.class);
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$numberInt\":1}")).isInstanceOf(ExtendedJsonException.class)
        .hasMessageContaining("must be string");
    }

    @Test
    public void dbRefWithOtherDollarKeyStaysDocument() {
        Object o = ExtendedJson.fromJson("{\"$ref\":\"c\",\"$id\":1,\"$foo\":2}");
        assertThat(o).isInstanceOf(Map.class).isNotInstanceOf(DBRef.class);
        Object ref = ExtendedJson.fromJson("{\"$ref\":\"c\",\"$id\":1,\"$db\":\"d\",\"extra\":true}");
        assertThat(ref).isInstanceOf(DBRef.class);
        assertEquals(Map.of("extra", true), ((DBRef) ref).getExtra());
    }

    @Test
    public void dbPointerMustWrapObjectIdRef() {
        Object o = ExtendedJson.fromJson("{\"$dbPointer\":{\"$ref\":\"c\",\"$id\":{\"$oid\":\"5f1e9c2b8a1d4e3f2a1b0c9d\"}}}");
        assertThat(o).isInstanceOf(DBRef.class);
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$dbPointer\":{\"$ref\":\"c\",\"$id\":1}}")).isInstanceOf(ExtendedJsonException.class);
        assertThatThrownBy(() -> ExtendedJson.fromJson("{\"$dbPointer\":{\"$ref\":\"c\",\"$id\":{\"$oid\":\"5f1e9c2b8a1d4e3f2a1b0c9d\"},\"$db\":\"x\"}}"))
        .isInstanceOf(ExtendedJsonException.class);
    }

    @Test
    public void uuidEncoding() {
        UUID u = UUID.fromString("00112233-4455-6677-8899-aabbccddeeff");
        String strict = ExtendedJson.toJson(Doc.of("u", u), JsonOptions.RELAXED);
        assertEquals("{\"u\":{\"$binary\":{\"base64\":\"ABEiM0RVZneImaq7zN3u/w==\",\"subType\":\"04\"}}}", strict);
        assertEquals(u, ExtendedJson.parseDocument(strict).get("u"));
        assertEquals("{\"u\":{\"$uuid\":\"00112233-4455-6677-8899-aabbccddeeff\"}}", ExtendedJson.toJson(Doc.of("u", u), JsonOptions.LEGACY));
        assertEquals(u, ExtendedJson.fromJson("{\"$uuid\":\"00112233445566778899aabbccddeeff\"}"));
    }

    @Test
    public void unknownTypeIsNotSerializable() {
        assertThatThrownBy(() -> ExtendedJson.toJson(Doc.of("x", new Object()))).isInstanceOf(ExtendedJsonException.class)
        .hasMessageContaining("is not JSON serializable");
    }

    @Test
    public void documentsKeepOrderAndNest() {
        Map<String, Object> d = ExtendedJson.parseDocument("{\"z\":1,\"a\":[{\"$numberLong\":\"5\"},{\"b\":null}],\"m\":{\"$symbol\":\"s\"}}");
        assertThat(d.keySet()).containsExactly("z", "a", "m");
        assertEquals(5L, ((List<?>) d.get("a")).get(0));
        assertEquals("s", d.get("m"));
    }
}
