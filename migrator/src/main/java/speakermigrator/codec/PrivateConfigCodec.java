package speakermigrator.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.PrivateConfig;

import java.util.Optional;

/**
 * Reads and writes the speaker's private configuration document.
 */
public final class PrivateConfigCodec {

    private static final Logger log = LoggerFactory.getLogger(PrivateConfigCodec.class);

    /** Declaration the speaker expects at the top of the document. */
    public static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n";

    private static final XmlMapper XML_MAPPER = new XmlMapper();
    static {
        XML_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        XML_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private PrivateConfigCodec() {}

    /**
     * Serializes a configuration with the document header.
     *
     * @throws MigrateException if the configuration cannot be serialized
     */
    public static String encode(PrivateConfig config) throws MigrateException {
        try {
            return XML_HEADER + XML_MAPPER.writeValueAsString(config).trim();
        } catch (JsonProcessingException e) {
            throw new MigrateException("failed to marshal planned XML: " + e.getOriginalMessage(),
                    null, "encode", null, e);
        }
    }

    /**
     * Parses a configuration document.
     *
     * @param xml document text, may be null
     * @return the parsed configuration, or empty if the text is blank or not a configuration
     */
    public static Optional<PrivateConfig> decode(String xml) {
        if (xml == null || xml.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(XML_MAPPER.readValue(xml.trim(), PrivateConfig.class));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable private config: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
