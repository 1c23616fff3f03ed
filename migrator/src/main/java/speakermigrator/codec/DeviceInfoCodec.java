package speakermigrator.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import speakermigrator.model.DeviceInfo;

import java.io.IOException;
import java.io.InputStream;

/**
 * Parses speaker identity documents ({@code /info} responses and stored
 * {@code DeviceInfo.xml} files).
 */
public final class DeviceInfoCodec {

    private static final XmlMapper XML_MAPPER = new XmlMapper();
    static {
        XML_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private DeviceInfoCodec() {}

    public static DeviceInfo decode(InputStream in) throws IOException {
        return XML_MAPPER.readValue(in, DeviceInfo.class);
    }

    public static DeviceInfo decode(byte[] xml) throws IOException {
        return XML_MAPPER.readValue(xml, DeviceInfo.class);
    }
}
