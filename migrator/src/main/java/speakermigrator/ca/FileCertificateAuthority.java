package speakermigrator.ca;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Certificate authority stored as {@code ca.crt} and {@code ca.key} in a directory.
 */
public final class FileCertificateAuthority implements CertificateAuthority {

    public static final String CA_CERT_FILE = "ca.crt";
    public static final String CA_KEY_FILE = "ca.key";

    private final Path certsDir;

    public FileCertificateAuthority(Path certsDir) {
        this.certsDir = certsDir;
    }

    @Override
    public Path caCertPath() {
        return certsDir.resolve(CA_CERT_FILE);
    }

    @Override
    public Path caKeyPath() {
        return certsDir.resolve(CA_KEY_FILE);
    }

    @Override
    public byte[] caCertificatePem() throws IOException {
        Path path = caCertPath();
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new IOException("CA certificate not found at " + path, e);
        }
    }
}
