package de.caluga.topology.driver.wireprotocol;

import de.caluga.topology.driver.DriverNetworkException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Message header handling for the mongo wire protocol. Only OP_MSG and OP_COMPRESSED are spoken.
 */
public abstract class WireProtocolMessage {
    public static final int HEADER_SIZE = 16;
    public static final int MAX_MESSAGE_SIZE = 48 * 1000 * 1000;

    private int size;
    private int messageId;
    private int responseTo;

    /**
     * reads one message from the stream. OP_COMPRESSED messages are unwrapped.
     *
     * @return the message, or null if the stream ended before a new header started
     */
    public static WireProtocolMessage parseFromStream(InputStream in) throws DriverNetworkException {
        if (in == null) {
            return null;
        }

        try {
            byte[] header = new byte[HEADER_SIZE];

            if (!readFully(in, header, true)) {
                return null;
            }

            int size = readInt(header, 0);
            int messageId = readInt(header, 4);
            int responseTo = readInt(header, 8);
            int opCode = readInt(header, 12);

            if (size < HEADER_SIZE || size > MAX_MESSAGE_SIZE) {
                throw new DriverNetworkException("Illegal message size " + size);
            }

            byte[] buf = new byte[size - HEADER_SIZE];
            readFully(in, buf, false);
            OpCode c = OpCode.findByCode(opCode);

            if (c == null) {
                throw new DriverNetworkException("Illegal opcode " + opCode);
            }

            WireProtocolMessage message;
            byte[] payload = buf;

            if (c == OpCode.OP_COMPRESSED) {
                OpCompressed compressed = new OpCompressed();
                compressed.parsePayload(buf, 0);
                c = OpCode.findByCode(compressed.getOriginalOpCode());

                if (c == null || c == OpCode.OP_COMPRESSED) {
                    throw new DriverNetworkException("Illegal opcode " + compressed.getOriginalOpCode() + " inside OP_COMPRESSED");
                }

                payload = compressed.uncompress();
                size = payload.length + HEADER_SIZE;
            }

            message = c.create();
            message.setMessageId(messageId);
            message.setResponseTo(responseTo);
            message.setSize(size);
            message.parsePayload(payload, 0);
            return message;
        } catch (DriverNetworkException e) {
            throw e;
        } catch (IOException e) {
            throw new DriverNetworkException("could not read from socket", e);
        } catch (RuntimeException e) {
            throw new DriverNetworkException("could not parse message: " + e.getMessage(), e);
        }
    }

    private static boolean readFully(InputStream in, byte[] buf, boolean eofAllowed) throws IOException {
        int numRead = 0;

        while (numRead < buf.length) {
            int r = in.read(buf, numRead, buf.length - numRead);

            if (r == -1) {
                if (numRead == 0 && eofAllowed) {
                    return false;
                }

                throw new EOFException("connection closed after " + numRead + " of " + buf.length + " bytes");
            }

            numRead += r;
        }

        return true;
    }

    public static String readString(byte[] bytes, int idx) {
        int i = idx;

        while (bytes[i] != 0) {
            i++;
        }

        return new String(bytes, idx, i - idx, StandardCharsets.UTF_8);
    }

    public static int strLen(byte[] bytes, int idx) {
        int i = idx;

        while (bytes[i] != 0) {
            i++;
        }

        return i - idx + 1;
    }

    public static int readInt(byte[] bytes, int idx) {
        return (bytes[idx] & 0xff) | ((bytes[idx + 1] & 0xff) << 8) | ((bytes[idx + 2] & 0xff) << 16) | ((bytes[idx + 3] & 0xff) << 24);
    }

    public static void writeInt(int value, OutputStream to) throws IOException {
        to.write(value & 0xff);
        to.write((value >> 8) & 0xff);
        to.write((value >> 16) & 0xff);
        to.write((value >> 24) & 0xff);
    }

    public static void writeString(String n, OutputStream to) throws IOException {
        to.write(n.getBytes(StandardCharsets.UTF_8));
        to.write(0);
    }

    public abstract void parsePayload(byte[] bytes, int offset) throws IOException;

    public abstract byte[] getPayload() throws IOException;

    public abstract int getOpCode();

    public final byte[] bytes() throws IOException {
        return bytes(OpCompressed.COMPRESSOR_NOOP);
    }

    /**
     * serializes header and payload, wrapping the payload into OP_COMPRESSED unless the compressor is
     * {@link OpCompressed#COMPRESSOR_NOOP}
     */
    public final byte[] bytes(int compressorId) throws IOException {
        byte[] payload = getPayload();
        int opCode = getOpCode();

        if (compressorId != OpCompressed.COMPRESSOR_NOOP) {
            OpCompressed compressed = new OpCompressed();
            compressed.setOriginalOpCode(opCode);
            compressed.setCompressorId(compressorId);
            compressed.setUncompressedSize(payload.length);
            compressed.setCompressedMessage(OpCompressed.compress(payload, compressorId));
            payload = compressed.getPayload();
            opCode = compressed.getOpCode();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeInt(payload.length + HEADER_SIZE, out);
        writeInt(messageId, out);
        writeInt(responseTo, out);
        writeInt(opCode, out);
        out.write(payload);
        return out.toByteArray();
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public int getMessageId() {
        return messageId;
    }

    public void setMessageId(int messageId) {
        this.messageId = messageId;
    }

    public int getResponseTo() {
        return responseTo;
    }

    public void setResponseTo(int responseTo) {
        this.responseTo = responseTo;
    }

    public enum OpCode {
        OP_COMPRESSED(2012), OP_MSG(2013);

        final int opCode;

        OpCode(int opCode) {
            this.opCode = opCode;
        }

        public int getOpCode() {
            return opCode;
        }

        WireProtocolMessage create() {
            if (this == OP_MSG) {
                return new OpMsg();
            }

            return new OpCompressed();
        }

        static OpCode findByCode(int c) {
            for (OpCode o : OpCode.values()) {
                if (o.opCode == c) {
                    return o;
                }
            }

            return null;
        }
    }
}
