package com.kreasipositif.wpsprocessor.submission.connector;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import com.kreasipositif.wpsprocessor.exception.TransmissionException;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionCredentials;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Bank SFTP drop-box channel.
 *
 * <p>The file is uploaded to {@code <uploadPath>/<fileName>}. The bank later drops
 * {@code <downloadPath>/<fileName>.ACK} whose first line reads {@code STATUS,code,message};
 * until it appears the file counts as processing. The endpoint is {@code sftp://host[:port]}
 * or {@code host[:port]}.
 */
@Slf4j
@Component
public class SftpBankConnector implements BankConnector {

    static final int DEFAULT_PORT = 22;
    static final String ACK_SUFFIX = ".ACK";

    private final int connectTimeoutMillis;

    public SftpBankConnector(@Value("${wps.sftp.connect-timeout:10s}") Duration connectTimeout) {
        this.connectTimeoutMillis = (int) connectTimeout.toMillis();
    }

    @Override
    public BankProtocol protocol() {
        return BankProtocol.SFTP;
    }

    @Override
    public ConnectorResponse transmit(BankConnection connection, TransmitRequest request) {
        String target = path(connection.credentials().uploadPath(), request.fileName());
        Session session = openSession(connection);
        try {
            ChannelSftp sftp = openChannel(session);
            try {
                sftp.put(new ByteArrayInputStream(request.content()), target, ChannelSftp.OVERWRITE);
                log.info("Uploaded {} ({} bytes) to {}:{}", request.fileName(), request.size(), connection.endpoint(), target);
                return ConnectorResponse.accepted("SFTP-" + request.fileName(), "UPLOADED", "Uploaded to " + target);
            } finally {
                sftp.disconnect();
            }
        } catch (SftpException e) {
            throw new TransmissionException("SFTP upload of %s failed: %s".formatted(target, e.getMessage()), e);
        } finally {
            session.disconnect();
        }
    }

    @Override
    public StatusResponse checkStatus(BankConnection connection, String bankReference, String fileName) {
        String downloadPath = connection.credentials().downloadPath();
        String ackPath = path(downloadPath == null ? connection.credentials().uploadPath() : downloadPath,
                fileName + ACK_SUFFIX);
        Session session = openSession(connection);
        try {
            ChannelSftp sftp = openChannel(session);
            try (InputStream in = sftp.get(ackPath)) {
                return parseAck(readFirstLine(in));
            } finally {
                sftp.disconnect();
            }
        } catch (SftpException e) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return StatusResponse.processing("No acknowledgement yet at " + ackPath);
            }
            throw new TransmissionException("Reading %s failed: %s".formatted(ackPath, e.getMessage()), e);
        } catch (IOException e) {
            throw new TransmissionException("Reading %s failed: %s".formatted(ackPath, e.getMessage()), e);
        } finally {
            session.disconnect();
        }
    }

    @Override
    public ConnectionTestResult test(BankConnection connection) {
        try {
            Session session = openSession(connection);
            try {
                ChannelSftp sftp = openChannel(session);
                try {
                    sftp.stat(connection.credentials().uploadPath());
                } finally {
                    sftp.disconnect();
                }
            } finally {
                session.disconnect();
            }
            return ConnectionTestResult.ok("Upload directory reachable on " + connection.endpoint());
        } catch (SftpException | RuntimeException e) {
            log.warn("SFTP connection test for {} failed: {}", connection.id(), e.getMessage());
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    /**
     * Parses the first line of an acknowledgement file: {@code STATUS,code,message}. The message
     * may itself contain commas.
     */
    static StatusResponse parseAck(String line) {
        if (line == null || line.isBlank()) {
            return StatusResponse.processing("Acknowledgement file is empty");
        }
        String[] parts = line.trim().split(",", 3);
        String code = parts.length > 1 ? parts[1].trim() : null;
        String message = parts.length > 2 ? parts[2].trim() : null;
        return new StatusResponse(BankStatus.parse(parts[0]), code, message);
    }

    // ─── JSch plumbing ───────────────────────────────────────────────────────

    private Session openSession(BankConnection connection) {
        ConnectionCredentials credentials = connection.credentials();
        URI uri = URI.create(connection.endpoint().contains("://") ? connection.endpoint() : "sftp://" + connection.endpoint());
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        try {
            JSch jsch = new JSch();
            if (credentials.hasPrivateKey()) {
                jsch.addIdentity(credentials.privateKeyPath());
            }
            boolean verifyHostKey = credentials.knownHostsPath() != null && !credentials.knownHostsPath().isBlank();
            if (verifyHostKey) {
                jsch.setKnownHosts(credentials.knownHostsPath());
            } else {
                log.warn("Connection {} has no known_hosts file; host key of {} is not verified",
                        connection.id(), uri.getHost());
            }
            Session session = jsch.getSession(credentials.username(), uri.getHost(), port);
            if (credentials.hasPassword()) {
                session.setPassword(credentials.password());
            }
            session.setConfig("StrictHostKeyChecking", verifyHostKey ? "yes" : "no");
            session.connect(connectTimeoutMillis);
            return session;
        } catch (JSchException e) {
            throw new TransmissionException("SFTP connection to %s:%d failed: %s".formatted(uri.getHost(), port, e.getMessage()), e);
        }
    }

    private ChannelSftp openChannel(Session session) {
        try {
            ChannelSftp channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(connectTimeoutMillis);
            return channel;
        } catch (JSchException e) {
            throw new TransmissionException("SFTP channel could not be opened: " + e.getMessage(), e);
        }
    }

    private static String readFirstLine(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII));
        return reader.readLine();
    }

    private static String path(String directory, String fileName) {
        if (directory == null || directory.isBlank()) {
            return fileName;
        }
        return directory.endsWith("/") ? directory + fileName : directory + "/" + fileName;
    }
}
