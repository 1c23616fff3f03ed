package speakermigrator.device;

import speakermigrator.model.DeviceInfo;

import java.io.IOException;

/**
 * Queries a speaker's live identity endpoint.
 */
@FunctionalInterface
public interface DeviceInfoClient {

    /**
     * Fetches the identity document from the speaker.
     *
     * @param deviceAddress address of the speaker, optionally with a port
     * @throws IOException if the speaker cannot be reached or the response is not an identity document
     */
    DeviceInfo fetch(String deviceAddress) throws IOException;
}
