package de.caluga.topology.driver.wireprotocol;

import de.caluga.topology.driver.Doc;
import de.caluga.topology.driver.bson.BsonDecoder;
import de.caluga.topology.driver.bson.BsonEncoder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32C;

/**
 * see https://github.com/mongodb/specifications/blob/master/source/message/OP_MSG.rst
 * <p>
 * OP_MSG {
 * MsgHeader header;          // standard message header
 * flagBits;                  // message flags
 * Sections[] sections;       // data sections
 * checksum;                  // optional CRC-32C checksum
 * }
 * <p>
 * section type 0 (BASIC):
 * byte 0;
 * BSON-Document
 * <p>
 * section type 1 (document sequence):
 * byte 1;
 * int32 size
 * CString sequence id;
 * BSON-Documents
 */
public class OpMsg extends WireProtocolMessage {
    public static final int CHECKSUM_PRESENT = 1;
    public static final int MORE_TO_COME = 2;
    public static final int EXHAUST_ALLOWED = 65536;

    private Map<String, Object> firstDoc;
    private Map<String, List<Map<String, Object>>> documents;

    private int flags;

    public void addDoc(String seqId, Map<String, Object> o) {
        if (documents == null) {
            documents = new LinkedHashMap<>();
        }

        documents.computeIfAbsent(seqId, k -> new ArrayList<>()).add(o);
    }

    public Map<String, List<Map<String, Object>>> getDocuments() {
        return documents;
    }

    public Map<String, Object> getFirstDoc() {
        return firstDoc;
    }

    public OpMsg setFirstDoc(Map<String, Object> o) {
        firstDoc = o;
        return this;
    }

    public int getFlags() {
        return flags;
    }

    public OpMsg setFlags(int flags) {
        this.flags = flags;
        return this;
    }

    /**
     * the reply document with all document sequences merged in as lists under their sequence id
     */
    public Map<String, Object> getReply() {
        if (documents == null || documents.isEmpty()) {
            return firstDoc;
        }

        Doc ret = firstDoc == null ? new Doc() : new Doc(firstDoc);

        for (Map.Entry<String, List<Map<String, Object>>> e : documents.entrySet()) {
            ret.put(e.getKey(), e.getValue());
        }

        return ret;
    }

    @Override
    public void parsePayload(byte[] bytes, int offset) throws IOException {
        flags = readInt(bytes, offset);
        int idx = offset + 4;
        int len = bytes.length;

        if ((flags & CHECKSUM_PRESENT) != 0) {
            len = bytes.length - 4;
            int crc = readInt(bytes, len);
            CRC32C c = new CRC32C();
            c.update(bytes, offset, len - offset);

            if (crc != (int) c.getValue()) {
                throw new IOException("OP_MSG checksum mismatch");
            }
        }

        while (idx < len) {
            byte section = bytes[idx];
            idx++;

            if (section == 0) {
                Doc result = new Doc();
                idx += BsonDecoder.decodeDocumentIn(result, bytes, idx);
                firstDoc = result;
            } else if (section == 1) {
                int size = readInt(bytes, idx);
                String seqId = readString(bytes, idx + 4);
                int strLen = strLen(bytes, idx + 4);
                int i = 0;

                while (4 + strLen + i < size) {
                    Doc doc = new Doc();
                    i += BsonDecoder.decodeDocumentIn(doc, bytes, idx + 4 + strLen + i);
                    addDoc(seqId, doc);
                }

                idx += size;
            } else {
                throw new IOException("wrong section ID " + section);
            }
        }
    }

    @Override
    public byte[] getPayload() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeInt(flags, out);
        out.write(0);
        out.write(BsonEncoder.encodeDocument(firstDoc));

        if (documents != null) {
            for (Map.Entry<String, List<Map<String, Object>>> e : documents.entrySet()) {
                ByteArrayOutputStream sectionOut = new ByteArrayOutputStream();
                writeString(e.getKey(), sectionOut);

                for (Map<String, Object> doc : e.getValue()) {
                    sectionOut.write(BsonEncoder.encodeDocument(doc));
                }

                byte[] section = sectionOut.toByteArray();
                out.write(1);
                writeInt(section.length + 4, out);
                out.write(section);
            }
        }

        if ((flags & CHECKSUM_PRESENT) != 0) {
            CRC32C crc = new CRC32C();
            byte[] ret = out.toByteArray();
            crc.update(ret);
            writeInt((int) crc.getValue(), out);
        }

        return out.toByteArray();
    }

    @Override
    public int getOpCode() {
        return OpCode.OP_MSG.opCode;
    }

    public boolean hasCursor() {
        return firstDoc != null && firstDoc.containsKey("cursor");
    }
}
