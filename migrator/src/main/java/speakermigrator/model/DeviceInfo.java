package speakermigrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Speaker identity document, as served by the speaker's {@code /info} endpoint and
 * as stored in the device store's {@code DeviceInfo.xml}.
 *
 * <p>Firmware and serial number are not top-level fields; they come from the
 * {@code components} list (see {@link #firmwareVersion()} and {@link #serialNumber()}).
 */
@JacksonXmlRootElement(localName = "info")
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DeviceInfo {

    public static final String SCM = "SCM";
    public static final String PACKAGED_PRODUCT = "PackagedProduct";

    @JacksonXmlProperty(isAttribute = true, localName = "deviceID")
    private String deviceId;

    @JacksonXmlProperty(localName = "name")
    private String name;

    @JacksonXmlProperty(localName = "type")
    private String type;

    @JacksonXmlProperty(localName = "moduleType")
    private String moduleType;

    @JacksonXmlProperty(localName = "margeAccountUUID")
    private String margeAccountUuid;

    @JacksonXmlElementWrapper(localName = "components")
    @JacksonXmlProperty(localName = "component")
    private List<Component> components = new ArrayList<>();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "networkInfo")
    private List<NetworkInfo> networkInfo = new ArrayList<>();

    public DeviceInfo() {
    }

    public DeviceInfo(String deviceId, String name, String type, String margeAccountUuid, List<Component> components) {
        this.deviceId = deviceId;
        this.name = name;
        this.type = type;
        this.margeAccountUuid = margeAccountUuid;
        this.components = new ArrayList<>(components);
    }

    public String deviceId() { return nullToEmpty(deviceId); }

    public String name() { return nullToEmpty(name); }

    public String type() { return nullToEmpty(type); }

    public String moduleType() { return nullToEmpty(moduleType); }

    public String margeAccountUuid() { return nullToEmpty(margeAccountUuid); }

    public List<Component> components() {
        return components != null ? Collections.unmodifiableList(components) : List.of();
    }

    public List<NetworkInfo> networkInfo() {
        return networkInfo != null ? Collections.unmodifiableList(networkInfo) : List.of();
    }

    /** Software version of the SCM component, or empty. */
    public String firmwareVersion() {
        for (Component c : components()) {
            if (SCM.equals(c.category())) {
                return c.softwareVersion();
            }
        }
        return "";
    }

    /** Serial of the SCM component, else of the packaged product, else empty. */
    public String serialNumber() {
        String scm = componentSerial(SCM);
        return !scm.isEmpty() ? scm : componentSerial(PACKAGED_PRODUCT);
    }

    /** Serial of the first component in the given category, or empty. */
    public String componentSerial(String category) {
        for (Component c : components()) {
            if (category.equals(c.category()) && !c.serialNumber().isEmpty()) {
                return c.serialNumber();
            }
        }
        return "";
    }

    /** IP address reported for the SCM network interface, or empty. */
    public String scmIpAddress() {
        for (NetworkInfo n : networkInfo()) {
            if (SCM.equals(n.type())) {
                return n.ipAddress();
            }
        }
        return "";
    }

    private static String nullToEmpty(String s) {
        return s != null ? s.trim() : "";
    }

    @Override
    public String toString() {
        return "DeviceInfo{id=" + deviceId() + ", name=" + name() + ", type=" + type() + "}";
    }

    /** One {@code components/component} entry. */
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            setterVisibility = JsonAutoDetect.Visibility.NONE)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Component {

        @JacksonXmlProperty(localName = "componentCategory")
        private String category;

        @JacksonXmlProperty(localName = "softwareVersion")
        private String softwareVersion;

        @JacksonXmlProperty(localName = "serialNumber")
        private String serialNumber;

        public Component() {
        }

        public Component(String category, String softwareVersion, String serialNumber) {
            this.category = category;
            this.softwareVersion = softwareVersion;
            this.serialNumber = serialNumber;
        }

        public String category() { return nullToEmpty(category); }

        public String softwareVersion() { return nullToEmpty(softwareVersion); }

        public String serialNumber() { return nullToEmpty(serialNumber); }
    }

    /** One {@code networkInfo} entry. */
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            setterVisibility = JsonAutoDetect.Visibility.NONE)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NetworkInfo {

        @JacksonXmlProperty(isAttribute = true, localName = "type")
        private String type;

        @JacksonXmlProperty(localName = "ipAddress")
        private String ipAddress;

        public NetworkInfo() {
        }

        public String type() { return nullToEmpty(type); }

        public String ipAddress() { return nullToEmpty(ipAddress); }
    }
}
