package io.fixorder.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TcpOrderTransport implements OrderTransport {
    private static final Logger LOGGER = LoggerFactory.getLogger(TcpOrderTransport.class);

    @Override
    public TransportOutcome send(TransportEndpoint endpoint, byte[] message, TransportTimeouts timeouts) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timeouts, "timeouts");

        TransportOutcome outcome;
        try (Socket socket = new Socket()) {
            if (connect(socket, endpoint, timeouts)) {
                outcome = exchange(socket, message, timeouts);
            } else {
                outcome = new TransportOutcome.TransportError(
                    endpoint,
                    "Connect to " + endpoint + " timed out after " + timeouts.connectTimeout().toMillis() + " ms"
                );
            }
        } catch (ConnectException refused) {
            LOGGER.debug("Connect refused [endpoint={}]", endpoint, refused);
            outcome = new TransportOutcome.Refused(endpoint);
        } catch (UnknownHostException unknownHost) {
            outcome = new TransportOutcome.TransportError(endpoint, "Unknown host: " + endpoint.host());
        } catch (IOException ioFailure) {
            outcome = new TransportOutcome.TransportError(endpoint, describe(ioFailure));
        }

        if (outcome.failed()) {
            LOGGER.warn("Order exchange failed [endpoint={}]: {}", endpoint, outcome.describe());
        } else {
            LOGGER.debug("Order exchange finished [endpoint={}, outcome={}]", endpoint, outcome);
        }
        return outcome;
    }

    private static boolean connect(Socket socket, TransportEndpoint endpoint, TransportTimeouts timeouts) throws IOException {
        InetSocketAddress address = new InetSocketAddress(endpoint.host(), endpoint.port());
        if (address.isUnresolved()) {
            throw new UnknownHostException(endpoint.host());
        }
        try {
            socket.connect(address, timeouts.connectTimeoutMillis());
            return true;
        } catch (SocketTimeoutException connectTimeout) {
            return false;
        }
    }

    private static TransportOutcome exchange(Socket socket, byte[] message, TransportTimeouts timeouts) throws IOException {
        socket.setTcpNoDelay(true);
        OutputStream out = socket.getOutputStream();
        out.write(message);
        out.flush();
        LOGGER.debug("Sent {} bytes to {}", message.length, socket.getRemoteSocketAddress());

        socket.setSoTimeout(timeouts.readTimeoutMillis());
        byte[] buffer = new byte[timeouts.receiveBufferSize()];
        InputStream in = socket.getInputStream();
        try {
            int read = in.read(buffer);
            if (read < 0) {
                return new TransportOutcome.ClosedByPeer();
            }
            return new TransportOutcome.Received(Arrays.copyOf(buffer, read));
        } catch (SocketTimeoutException readTimeout) {
            return new TransportOutcome.TimedOut(timeouts.readTimeout().toMillis());
        }
    }

    private static String describe(IOException failure) {
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return failure.getClass().getSimpleName();
        }
        return message;
    }
}
