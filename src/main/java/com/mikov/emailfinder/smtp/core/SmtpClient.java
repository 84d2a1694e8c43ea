package com.mikov.emailfinder.smtp.core;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Minimal line-oriented SMTP session over a plain socket. Every connect and read is bounded by a timeout.
 */
@Slf4j
@Getter
public class SmtpClient implements Closeable {
    private final String host;
    private final int port;
    private final int connectTimeout;
    private final int readTimeout;
    private Socket socket;
    private BufferedReader in;
    private PrintWriter out;

    public SmtpClient(String host, int port, int connectTimeout, int readTimeout) {
        this.host = host;
        this.port = port;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    /**
     * Opens the connection and returns the server greeting.
     */
    public SmtpResponse connect() throws IOException {
        log.debug("Connecting to SMTP server {}:{}", host, port);
        socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeout);
            socket.setSoTimeout(readTimeout);
            in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            out = new PrintWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.US_ASCII));
            return new SmtpResponse(readResponse());
        } catch (IOException e) {
            closeQuietly();
            throw e;
        }
    }

    public SmtpResponse executeCommand(SmtpCommand command) throws IOException {
        log.debug("Executing command on {}: {}", host, command);
        String response = sendCommand(command.getCommand());
        return new SmtpResponse(response);
    }

    private String sendCommand(String command) throws IOException {
        out.print(command + "\r\n");
        out.flush();
        if (out.checkError()) {
            throw new IOException("Failed to write command to " + host);
        }
        return readResponse();
    }

    private String readResponse() throws IOException {
        StringBuilder response = new StringBuilder();
        String line;
        while ((line = in.readLine()) != null) {
            response.append(line).append("\n");
            if (line.length() < 4 || line.charAt(3) != '-') {
                break;
            }
        }
        if (line == null && response.length() == 0) {
            throw new EOFException("Connection closed by " + host);
        }
        return response.toString().trim();
    }

    public boolean isConnected() {
        return socket != null && socket.isConnected() && !socket.isClosed();
    }

    /**
     * Sends QUIT when possible and closes the socket.
     */
    @Override
    public void close() {
        if (isConnected() && out != null) {
            try {
                sendCommand("QUIT");
            } catch (IOException e) {
                log.debug("Error sending QUIT command to {}: {}", host, e.getMessage());
            }
        }
        closeQuietly();
    }

    private void closeQuietly() {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Error closing socket to {}: {}", host, e.getMessage());
            }
        }
    }
}
