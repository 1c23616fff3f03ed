package speakermigrator.shell;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.config.MigratorConfig;
import speakermigrator.exceptions.RemoteShellException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Properties;

/**
 * SSH transport built on JSch.
 *
 * <p>Opens one session per call. Speaker firmware ships an old SSH daemon, so
 * legacy key exchanges, ciphers and host key types are enabled and host key
 * checking is off. Uploads stream the content into {@code cat > path}.
 */
public final class JschRemoteShell implements RemoteShell {

    private static final Logger log = LoggerFactory.getLogger(JschRemoteShell.class);

    private static final String KEX = String.join(",",
            "curve25519-sha256@libssh.org",
            "ecdh-sha2-nistp256",
            "ecdh-sha2-nistp384",
            "ecdh-sha2-nistp521",
            "diffie-hellman-group14-sha1",
            "diffie-hellman-group1-sha1");

    private static final String CIPHERS = String.join(",",
            "aes128-ctr",
            "aes192-ctr",
            "aes256-ctr",
            "aes128-gcm@openssh.com",
            "aes128-cbc",
            "3des-cbc");

    private static final String HOST_KEYS = String.join(",",
            "rsa-sha2-256",
            "rsa-sha2-512",
            "ssh-rsa",
            "ssh-dss",
            "ecdsa-sha2-nistp256",
            "ecdsa-sha2-nistp384",
            "ecdsa-sha2-nistp521",
            "ssh-ed25519");

    private static final long POLL_MS = 20;

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final int timeoutMs;

    public JschRemoteShell(String host, MigratorConfig config) {
        this(host, config.sshPort(), config.sshUser(), config.sshPassword(), config.sshTimeout());
    }

    public JschRemoteShell(String host, int port, String user, String password, Duration timeout) {
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
        this.timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    }

    /**
     * Factory creating JSch-backed shells with the given configuration.
     */
    public static RemoteShellFactory factory(MigratorConfig config) {
        return host -> new JschRemoteShell(host, config);
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public CommandResult run(ShellCommand command) {
        String cmd = command.render();
        Session session = null;
        ChannelExec channel = null;
        try {
            session = openSession();
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(cmd);
            channel.setInputStream(null);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            channel.setOutputStream(out, true);
            channel.setErrStream(out, true);
            channel.connect(timeoutMs);
            awaitClose(channel);

            int status = channel.getExitStatus();
            String output = out.toString(StandardCharsets.UTF_8);
            log.debug("{}: '{}' exited {}", host, cmd, status);
            return CommandResult.exited(output, status);
        } catch (JSchException e) {
            log.debug("{}: '{}' transport failure: {}", host, cmd, e.getMessage());
            return CommandResult.transportFailure("ssh to " + host + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandResult.transportFailure("interrupted while running command on " + host);
        } finally {
            disconnect(channel, session);
        }
    }

    @Override
    public void upload(byte[] content, String remotePath) throws RemoteShellException {
        String cmd = ShellCommand.of("cat").render() + " > " + ShellCommand.quote(remotePath);
        Session session = null;
        ChannelExec channel = null;
        try {
            session = openSession();
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(cmd);
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            channel.setErrStream(err, true);
            OutputStream stdin = channel.getOutputStream();
            channel.connect(timeoutMs);
            try (stdin) {
                stdin.write(content);
                stdin.flush();
            }
            awaitClose(channel);

            int status = channel.getExitStatus();
            if (status != 0) {
                throw new RemoteShellException(host, "upload to " + remotePath + " exited " + status
                        + " (stderr: " + err.toString(StandardCharsets.UTF_8).trim() + ")");
            }
            log.debug("{}: uploaded {} bytes to {}", host, content.length, remotePath);
        } catch (JSchException | IOException e) {
            throw new RemoteShellException(host, "upload to " + remotePath + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteShellException(host, "interrupted while uploading " + remotePath, e);
        } finally {
            disconnect(channel, session);
        }
    }

    private Session openSession() throws JSchException {
        JSch jsch = new JSch();
        Session session = jsch.getSession(user, host, port);
        session.setPassword(password);

        Properties cfg = new Properties();
        cfg.put("StrictHostKeyChecking", "no");
        cfg.put("kex", KEX);
        cfg.put("cipher.s2c", CIPHERS);
        cfg.put("cipher.c2s", CIPHERS);
        cfg.put("server_host_key", HOST_KEYS);
        cfg.put("PreferredAuthentications", "none,password,keyboard-interactive");
        session.setConfig(cfg);
        session.setTimeout(timeoutMs);
        session.connect(timeoutMs);
        return session;
    }

    private static void awaitClose(ChannelExec channel) throws InterruptedException {
        while (!channel.isClosed()) {
            Thread.sleep(POLL_MS);
        }
    }

    private static void disconnect(ChannelExec channel, Session session) {
        if (channel != null) channel.disconnect();
        if (session != null) session.disconnect();
    }
}
