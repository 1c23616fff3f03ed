package speakermigrator.ca;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Access to the local certificate authority's material.
 *
 * <p>Creating and signing certificates is handled elsewhere; the migrator only
 * needs the CA certificate to install it on devices.
 */
public interface CertificateAuthority {

    Path caCertPath();

    Path caKeyPath();

    /**
     * Reads the PEM-encoded CA certificate.
     *
     * @throws IOException if the certificate cannot be read
     */
    byte[] caCertificatePem() throws IOException;
}
