package de.caluga.topology.driver.wireprotocol;

import org.xerial.snappy.Snappy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * OP_COMPRESSED envelope: original opcode, uncompressed size, compressor id and the compressed bytes.
 */
public class OpCompressed extends WireProtocolMessage {
    public static final int COMPRESSOR_NOOP = 0;
    public static final int COMPRESSOR_SNAPPY = 1;
    public static final int COMPRESSOR_ZLIB = 2;
    public static final int COMPRESSOR_ZSTD = 3;

    private int originalOpCode;
    private int uncompressedSize;
    private int compressorId;
    private byte[] compressedMessage;

    /**
     * maps a compressor name as used in hello's <code>compression</code> field to its id
     *
     * @return the id or -1 if not supported
     */
    public static int compressorIdFor(String name) {
        if ("snappy".equalsIgnoreCase(name)) {
            return COMPRESSOR_SNAPPY;
        } else if ("zlib".equalsIgnoreCase(name)) {
            return COMPRESSOR_ZLIB;
        } else if ("noop".equalsIgnoreCase(name)) {
            return COMPRESSOR_NOOP;
        }

        return -1;
    }

    /**
     * the first compressor in <code>ours</code> that the server also announced
     */
    public static int negotiate(List<String> ours, List<String> serverCompressors) {
        if (ours == null || serverCompressors == null) {
            return COMPRESSOR_NOOP;
        }

        for (String c : ours) {
            if (compressorIdFor(c) > 0 && serverCompressors.contains(c)) {
                return compressorIdFor(c);
            }
        }

        return COMPRESSOR_NOOP;
    }

    public static byte[] compress(byte[] data, int compressorId) throws IOException {
        if (compressorId == COMPRESSOR_SNAPPY) {
            return Snappy.compress(data);
        } else if (compressorId == COMPRESSOR_ZLIB) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            try (DeflaterOutputStream zlibOut = new DeflaterOutputStream(out)) {
                zlibOut.write(data);
            }

            return out.toByteArray();
        } else if (compressorId == COMPRESSOR_NOOP) {
            return data;
        }

        throw new IllegalArgumentException("unsupported compression id: " + compressorId);
    }

    @Override
    public void parsePayload(byte[] bytes, int offset) throws IOException {
        int idx = offset;
        originalOpCode = readInt(bytes, idx);
        idx += 4;
        uncompressedSize = readInt(bytes, idx);
        idx += 4;
        compressorId = bytes[idx] & 0xff;
        idx++;
        compressedMessage = new byte[bytes.length - idx];
        System.arraycopy(bytes, idx, compressedMessage, 0, compressedMessage.length);
    }

    public byte[] uncompress() throws IOException {
        byte[] ret;

        if (compressorId == COMPRESSOR_SNAPPY) {
            ret = Snappy.uncompress(compressedMessage);
        } else if (compressorId == COMPRESSOR_ZLIB) {
            try (InflaterInputStream iis = new InflaterInputStream(new ByteArrayInputStream(compressedMessage))) {
                ret = iis.readAllBytes();
            }
        } else if (compressorId == COMPRESSOR_NOOP) {
            ret = compressedMessage;
        } else {
            throw new IOException("unsupported compression id: " + compressorId);
        }

        if (ret.length != uncompressedSize) {
            throw new IOException("uncompressed size mismatch: expected " + uncompressedSize + " got " + ret.length);
        }

        return ret;
    }

    @Override
    public byte[] getPayload() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeInt(originalOpCode, out);
        writeInt(uncompressedSize, out);
        out.write(compressorId);
        out.write(compressedMessage);
        return out.toByteArray();
    }

    @Override
    public int getOpCode() {
        return OpCode.OP_COMPRESSED.opCode;
    }

    public int getOriginalOpCode() {
        return originalOpCode;
    }

    public void setOriginalOpCode(int originalOpCode) {
        this.originalOpCode = originalOpCode;
    }

    public int getUncompressedSize() {
        return uncompressedSize;
    }

    public void setUncompressedSize(int uncompressedSize) {
        this.uncompressedSize = uncompressedSize;
    }

    public int getCompressorId() {
        return compressorId;
    }

    public void setCompressorId(int compressorId) {
        this.compressorId = compressorId;
    }

    public byte[] getCompressedMessage() {
        return compressedMessage;
    }

    public void setCompressedMessage(byte[] compressedMessage) {
        this.compressedMessage = compressedMessage;
    }
}
