package io.rconcron.rcon;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plain TCP RCON client. Not thread-safe; {@code RemoteConnection} serialises access.
 */
public final class SocketRconTransport implements RconTransport {
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final AtomicInteger requestIds = new AtomicInteger(0);

    private SocketRconTransport(Socket socket) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    public static RconTransportFactory factory(Duration timeout) {
        int timeoutMs = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        return (host, port) -> {
            Socket socket = new Socket();
            try {
                socket.connect(new InetSocketAddress(host, port), timeoutMs);
                socket.setSoTimeout(timeoutMs);
                return new SocketRconTransport(socket);
            } catch (IOException e) {
                socket.close();
                throw e;
            }
        };
    }

    @Override
    public void authenticate(String password) throws IOException {
        int id = nextRequestId();
        send(new RconPacket(id, RconPacket.TYPE_LOGIN, password));
        RconPacket reply = RconPacket.read(in);
        // Some servers send an empty RESPONSE_VALUE ahead of the auth response.
        while (reply.type() == RconPacket.TYPE_RESPONSE && reply.requestId() != RconPacket.AUTH_FAILED_ID) {
            reply = RconPacket.read(in);
        }
        if (reply.requestId() == RconPacket.AUTH_FAILED_ID || reply.requestId() != id) {
            throw new RconAuthenticationException("RCON login rejected");
        }
    }

    @Override
    public String command(String command) throws IOException {
        if (command.getBytes(StandardCharsets.UTF_8).length > RconPacket.MAX_OUTBOUND_PAYLOAD) {
            throw new IOException("RCON command exceeds " + RconPacket.MAX_OUTBOUND_PAYLOAD + " bytes");
        }
        int id = nextRequestId();
        int marker = nextRequestId();
        send(new RconPacket(id, RconPacket.TYPE_COMMAND, command));
        // Long replies arrive split over several frames; the server answers the empty marker
        // packet only after the last fragment of the command reply.
        send(new RconPacket(marker, RconPacket.TYPE_RESPONSE, ""));
        ByteArrayOutputStream response = new ByteArrayOutputStream();
        while (true) {
            byte[] frame = RconPacket.readFrame(in);
            int replyId = RconPacket.requestId(frame);
            if (replyId == RconPacket.AUTH_FAILED_ID) {
                throw new RconAuthenticationException("RCON session is not authenticated");
            }
            if (replyId == marker) {
                return response.toString(StandardCharsets.UTF_8);
            }
            if (replyId == id) {
                response.write(frame, 8, RconPacket.payloadLength(frame));
            }
            // Anything else answers an earlier request, e.g. a second marker echo.
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private void send(RconPacket packet) throws IOException {
        out.write(packet.encode());
        out.flush();
    }

    private int nextRequestId() {
        return requestIds.updateAndGet(v -> v >= Integer.MAX_VALUE - 1 ? 1 : v + 1);
    }
}
