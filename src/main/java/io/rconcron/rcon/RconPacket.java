package io.rconcron.rcon;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * One RCON frame: little-endian length, request id and type, payload, two NUL bytes.
 */
public record RconPacket(int requestId, int type, String payload) {
    public static final int TYPE_RESPONSE = 0;
    public static final int TYPE_COMMAND = 2;
    public static final int TYPE_AUTH_RESPONSE = 2;
    public static final int TYPE_LOGIN = 3;
    public static final int AUTH_FAILED_ID = -1;
    public static final int MAX_OUTBOUND_PAYLOAD = 1446;
    private static final int MAX_INBOUND_LENGTH = 4096 + 10;

    public byte[] encode() {
        byte[] body = payload == null ? new byte[0] : payload.getBytes(StandardCharsets.UTF_8);
        int length = 4 + 4 + body.length + 2;
        ByteBuffer buffer = ByteBuffer.allocate(4 + length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(length);
        buffer.putInt(requestId);
        buffer.putInt(type);
        buffer.put(body);
        buffer.put((byte) 0);
        buffer.put((byte) 0);
        return buffer.array();
    }

    public static RconPacket read(InputStream in) throws IOException {
        return decode(readFrame(in));
    }

    /**
     * Reads one frame without decoding it: request id, type, payload bytes and the two NULs.
     */
    static byte[] readFrame(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        byte[] lengthBytes = new byte[4];
        try {
            data.readFully(lengthBytes);
        } catch (EOFException e) {
            throw new EOFException("RCON connection closed by server");
        }
        int length = ByteBuffer.wrap(lengthBytes).order(ByteOrder.LITTLE_ENDIAN).getInt();
        if (length < 10 || length > MAX_INBOUND_LENGTH) {
            throw new IOException("Invalid RCON packet length: " + length);
        }
        byte[] frame = new byte[length];
        data.readFully(frame);
        return frame;
    }

    static int requestId(byte[] frame) {
        return ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN).getInt(0);
    }

    static int payloadLength(byte[] frame) {
        return frame.length - 10;
    }

    static RconPacket decode(byte[] frame) {
        ByteBuffer buffer = ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN);
        int requestId = buffer.getInt();
        int type = buffer.getInt();
        String payload = new String(frame, 8, payloadLength(frame), StandardCharsets.UTF_8);
        return new RconPacket(requestId, type, payload);
    }
}
