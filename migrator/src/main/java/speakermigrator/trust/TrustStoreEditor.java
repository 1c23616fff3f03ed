package speakermigrator.trust;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.alert.OperationLog;
import speakermigrator.ca.CertificateAuthority;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.exceptions.RemoteShellException;
import speakermigrator.patch.PatchResult;
import speakermigrator.patch.TrustBundleEditor;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Installs and removes the local CA in the speaker's shared trust bundle.
 *
 * <p>The bundle is backed up to its {@code .original} sibling once before the
 * first edit. Injection always leaves exactly one labelled block with the
 * current CA, however often it runs.
 */
public final class TrustStoreEditor {

    private static final Logger log = LoggerFactory.getLogger(TrustStoreEditor.class);

    private final RemoteShell shell;
    private final CertificateAuthority ca;

    public TrustStoreEditor(RemoteShell shell, CertificateAuthority ca) {
        this.shell = shell;
        this.ca = ca;
    }

    /**
     * Checks whether the bundle carries the local CA, first by label and then by
     * the first base64 line of the certificate.
     */
    public boolean isTrusted() {
        CommandResult byLabel = shell.run(DeviceCommands.grepFixed(TrustBundleEditor.LABEL, DevicePaths.CA_BUNDLE));
        if (byLabel.succeeded() && byLabel.output().contains(TrustBundleEditor.LABEL)) {
            return true;
        }
        if (ca == null) {
            return false;
        }
        String fingerprint;
        try {
            fingerprint = TrustBundleEditor.firstBodyLine(readCaPem());
        } catch (IOException e) {
            log.debug("{}: cannot read CA certificate for trust check: {}", shell.host(), e.getMessage());
            return false;
        }
        if (fingerprint.isEmpty()) {
            return false;
        }
        return shell.run(DeviceCommands.grepFixed(fingerprint, DevicePaths.CA_BUNDLE)).succeeded();
    }

    /**
     * Injects the CA unless {@link #isTrusted()} already reports it.
     *
     * @throws MigrateException if injection is needed and fails
     */
    public void ensureTrusted(OperationLog oplog) throws MigrateException {
        if (isTrusted()) {
            oplog.add("CA certificate already trusted, skipping injection");
            return;
        }
        oplog.add("Trusting CA:");
        inject(oplog);
    }

    /**
     * Replaces any labelled block in the bundle with a fresh one for the current CA.
     *
     * @throws MigrateException if the CA, the bundle or the upload fails
     */
    public void inject(OperationLog oplog) throws MigrateException {
        String pem;
        try {
            pem = readCaPem();
        } catch (IOException e) {
            throw oplog.failure("failed to read CA certificate: " + e.getMessage(), "trust", e);
        }

        ShellCommand rw = DeviceCommands.writeAccess();
        oplog.command(rw, shell.run(rw));

        if (!shell.run(DeviceCommands.isFile(DevicePaths.original(DevicePaths.CA_BUNDLE))).succeeded()) {
            ShellCommand cp = DeviceCommands.copy(DevicePaths.CA_BUNDLE, DevicePaths.original(DevicePaths.CA_BUNDLE));
            oplog.command(cp, shell.run(cp));
        }

        CommandResult bundle = shell.run(DeviceCommands.cat(DevicePaths.CA_BUNDLE));
        oplog.add("cat " + DevicePaths.CA_BUNDLE + " (check existing)");
        if (!bundle.succeeded()) {
            throw oplog.failure("failed to read bundle: " + bundle.failureReason(), "trust", null);
        }

        String updated = TrustBundleEditor.inject(bundle.output(), pem);
        try {
            shell.upload(updated.getBytes(StandardCharsets.UTF_8), DevicePaths.CA_BUNDLE);
        } catch (RemoteShellException e) {
            throw oplog.failure("failed to update bundle: " + e.getMessage(), "trust", e);
        }
        oplog.add("Uploaded updated bundle to " + DevicePaths.CA_BUNDLE);
        log.info("{}: local CA injected into trust bundle", shell.host());
    }

    /**
     * Strips the labelled block from the bundle. Best effort: failures become
     * warnings in the log.
     */
    public void remove(OperationLog oplog) {
        CommandResult bundle = shell.run(DeviceCommands.cat(DevicePaths.CA_BUNDLE));
        if (!bundle.succeeded()) {
            return;
        }
        PatchResult stripped = TrustBundleEditor.strip(bundle.output());
        if (!stripped.changed()) {
            return;
        }
        oplog.add("Removing local CA certificate from " + DevicePaths.CA_BUNDLE);
        ShellCommand rw = DeviceCommands.writeAccess();
        oplog.command(rw, shell.run(rw));
        try {
            shell.upload(stripped.text().getBytes(StandardCharsets.UTF_8), DevicePaths.CA_BUNDLE);
            oplog.add("Uploaded updated bundle (CA removed)");
        } catch (RemoteShellException e) {
            oplog.warn("failed to remove CA from " + DevicePaths.CA_BUNDLE + ": " + e.getMessage());
        }
    }

    private String readCaPem() throws IOException {
        if (ca == null) {
            throw new IOException("no certificate authority configured");
        }
        return new String(ca.caCertificatePem(), StandardCharsets.US_ASCII);
    }
}
