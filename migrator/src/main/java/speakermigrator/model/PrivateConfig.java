package speakermigrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.Objects;

/**
 * The speaker's cloud endpoint document ({@code SoundTouchSdkPrivateCfg.xml}).
 *
 * <p>Four service URLs and three feature flags. Instances are immutable; use the
 * {@code with*} methods to derive a modified copy.
 */
@JacksonXmlRootElement(localName = "SoundTouchSdkPrivateCfg")
@JsonPropertyOrder({
        "margeServerUrl", "statsServerUrl", "swUpdateUrl",
        "usePandoraProductionServer", "isZeroconfEnabled", "saveMargeCustomerReport",
        "bmxRegistryUrl"})
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PrivateConfig {

    @JsonProperty("margeServerUrl")
    private final String margeServerUrl;
    @JsonProperty("statsServerUrl")
    private final String statsServerUrl;
    @JsonProperty("swUpdateUrl")
    private final String swUpdateUrl;
    @JsonProperty("usePandoraProductionServer")
    private final boolean usePandoraProductionServer;
    @JsonProperty("isZeroconfEnabled")
    private final boolean zeroconfEnabled;
    @JsonProperty("saveMargeCustomerReport")
    private final boolean saveMargeCustomerReport;
    @JsonProperty("bmxRegistryUrl")
    private final String bmxRegistryUrl;

    @JsonCreator
    public PrivateConfig(
            @JsonProperty("margeServerUrl") String margeServerUrl,
            @JsonProperty("statsServerUrl") String statsServerUrl,
            @JsonProperty("swUpdateUrl") String swUpdateUrl,
            @JsonProperty("usePandoraProductionServer") boolean usePandoraProductionServer,
            @JsonProperty("isZeroconfEnabled") boolean zeroconfEnabled,
            @JsonProperty("saveMargeCustomerReport") boolean saveMargeCustomerReport,
            @JsonProperty("bmxRegistryUrl") String bmxRegistryUrl) {
        this.margeServerUrl = nullToEmpty(margeServerUrl);
        this.statsServerUrl = nullToEmpty(statsServerUrl);
        this.swUpdateUrl = nullToEmpty(swUpdateUrl);
        this.usePandoraProductionServer = usePandoraProductionServer;
        this.zeroconfEnabled = zeroconfEnabled;
        this.saveMargeCustomerReport = saveMargeCustomerReport;
        this.bmxRegistryUrl = nullToEmpty(bmxRegistryUrl);
    }

    /**
     * Builds the configuration that points every subsystem straight at the target.
     *
     * @param targetUrl base URL of the substitute service, without trailing slash
     */
    public static PrivateConfig pointingAt(String targetUrl) {
        return new PrivateConfig(
                targetUrl + "/marge",
                targetUrl,
                targetUrl + "/updates/soundtouch",
                true,
                true,
                false,
                targetUrl + "/bmx/registry/v1/services");
    }

    public String margeServerUrl() { return margeServerUrl; }

    public String statsServerUrl() { return statsServerUrl; }

    public String swUpdateUrl() { return swUpdateUrl; }

    public boolean usePandoraProductionServer() { return usePandoraProductionServer; }

    public boolean zeroconfEnabled() { return zeroconfEnabled; }

    public boolean saveMargeCustomerReport() { return saveMargeCustomerReport; }

    public String bmxRegistryUrl() { return bmxRegistryUrl; }

    /** Returns the URL configured for a subsystem, never null. */
    public String url(Subsystem subsystem) {
        switch (subsystem) {
            case MARGE: return margeServerUrl;
            case STATS: return statsServerUrl;
            case SW_UPDATE: return swUpdateUrl;
            case BMX: return bmxRegistryUrl;
            default: throw new IllegalArgumentException("unknown subsystem " + subsystem);
        }
    }

    /** Returns a copy with one subsystem's URL replaced. */
    public PrivateConfig withUrl(Subsystem subsystem, String url) {
        return new PrivateConfig(
                subsystem == Subsystem.MARGE ? url : margeServerUrl,
                subsystem == Subsystem.STATS ? url : statsServerUrl,
                subsystem == Subsystem.SW_UPDATE ? url : swUpdateUrl,
                usePandoraProductionServer,
                zeroconfEnabled,
                saveMargeCustomerReport,
                subsystem == Subsystem.BMX ? url : bmxRegistryUrl);
    }

    /** Returns true if any of the four URLs contains {@code fragment}. */
    public boolean anyUrlContains(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return false;
        }
        for (Subsystem s : Subsystem.values()) {
            if (url(s).contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrivateConfig)) return false;
        PrivateConfig that = (PrivateConfig) o;
        return usePandoraProductionServer == that.usePandoraProductionServer
                && zeroconfEnabled == that.zeroconfEnabled
                && saveMargeCustomerReport == that.saveMargeCustomerReport
                && margeServerUrl.equals(that.margeServerUrl)
                && statsServerUrl.equals(that.statsServerUrl)
                && swUpdateUrl.equals(that.swUpdateUrl)
                && bmxRegistryUrl.equals(that.bmxRegistryUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(margeServerUrl, statsServerUrl, swUpdateUrl,
                usePandoraProductionServer, zeroconfEnabled, saveMargeCustomerReport, bmxRegistryUrl);
    }

    @Override
    public String toString() {
        return "PrivateConfig{marge=" + margeServerUrl
                + ", stats=" + statsServerUrl
                + ", swUpdate=" + swUpdateUrl
                + ", bmx=" + bmxRegistryUrl + "}";
    }
}
