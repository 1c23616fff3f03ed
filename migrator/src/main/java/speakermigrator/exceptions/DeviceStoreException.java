package speakermigrator.exceptions;

/**
 * Exception thrown when the local device/settings store cannot be read or written.
 *
 * <p>This is an unchecked exception: store failures are local I/O problems that
 * callers usually cannot recover from mid-operation.
 */
public class DeviceStoreException extends RuntimeException {

    public DeviceStoreException(String message) {
        super(message);
    }

    public DeviceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
