package speakermigrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import speakermigrator.codec.DeviceInfoCodec;
import speakermigrator.exceptions.DeviceStoreException;
import speakermigrator.model.DeviceInfo;
import speakermigrator.model.DeviceRecord;
import speakermigrator.model.DnsSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Device store backed by a data directory.
 *
 * <pre>
 * &lt;dataDir&gt;/
 *   settings.yml
 *   &lt;account&gt;/devices/&lt;device&gt;/DeviceInfo.xml
 *   &lt;account&gt;/devices/DeviceInfo.xml
 * </pre>
 *
 * <p>Unreadable device documents are skipped with a debug log entry.
 */
public final class FileDeviceStore implements DeviceStore {

    private static final Logger log = LoggerFactory.getLogger(FileDeviceStore.class);

    public static final String DEVICES_DIR = "devices";
    public static final String DEVICE_INFO_FILE = "DeviceInfo.xml";
    public static final String SETTINGS_FILE = "settings.yml";

    private final Path dataDir;

    public FileDeviceStore(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path dataDir() {
        return dataDir;
    }

    @Override
    public List<DeviceRecord> listDevices() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        List<DeviceRecord> devices = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Path account : subdirectories(dataDir)) {
            for (DeviceRecord record : listAccount(account)) {
                if (seen.add(record.identityKey())) {
                    devices.add(record);
                }
            }
        }
        return devices;
    }

    private List<DeviceRecord> listAccount(Path accountDir) {
        String accountId = accountDir.getFileName().toString();
        Path devicesDir = accountDir.resolve(DEVICES_DIR);
        if (!Files.isDirectory(devicesDir)) {
            return List.of();
        }
        List<DeviceRecord> records = new ArrayList<>();
        try (Stream<Path> entries = Files.list(devicesDir)) {
            for (Path entry : entries.sorted().collect(Collectors.toList())) {
                Path infoFile;
                if (Files.isDirectory(entry)) {
                    infoFile = entry.resolve(DEVICE_INFO_FILE);
                } else if (DEVICE_INFO_FILE.equals(entry.getFileName().toString())) {
                    infoFile = entry;
                } else {
                    continue;
                }
                parse(infoFile).ifPresent(info -> records.add(DeviceRecord.from(info, accountId)));
            }
        } catch (IOException e) {
            log.debug("Cannot list {}: {}", devicesDir, e.getMessage());
        }
        return records;
    }

    private Optional<DeviceInfo> parse(Path infoFile) {
        if (!Files.isRegularFile(infoFile)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(infoFile)) {
            return Optional.of(DeviceInfoCodec.decode(in));
        } catch (IOException e) {
            log.debug("Skipping unreadable {}: {}", infoFile, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Path> subdirectories(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new DeviceStoreException("Cannot list data directory " + dir, e);
        }
    }

    @Override
    public Path accountDeviceDir(String account, String device) {
        return dataDir.resolve(account).resolve(DEVICES_DIR).resolve(device);
    }

    @Override
    public DnsSettings getDnsSettings() {
        Map<String, Object> root = readSettings();
        Object dns = root.get("dns");
        if (!(dns instanceof Map)) {
            return DnsSettings.DEFAULTS;
        }
        Map<?, ?> section = (Map<?, ?>) dns;
        boolean enabled = Boolean.parseBoolean(String.valueOf(section.get("enabled")));
        Object bind = section.get("bindAddr");
        return new DnsSettings(enabled, bind != null ? bind.toString() : null);
    }

    @Override
    public void saveDnsSettings(DnsSettings settings) {
        Map<String, Object> root = readSettings();
        Map<String, Object> dns = new LinkedHashMap<>();
        dns.put("enabled", settings.enabled());
        dns.put("bindAddr", settings.bindAddr());
        root.put("dns", dns);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Path file = dataDir.resolve(SETTINGS_FILE);
        try {
            Files.createDirectories(dataDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                new Yaml(options).dump(root, w);
            }
        } catch (IOException e) {
            throw new DeviceStoreException("Cannot write " + file, e);
        }
        log.info("Saved DNS settings: enabled={} bindAddr={}", settings.enabled(), settings.bindAddr());
    }

    private Map<String, Object> readSettings() {
        Path file = dataDir.resolve(SETTINGS_FILE);
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Object loaded = new Yaml().load(in);
            if (loaded == null) {
                return new LinkedHashMap<>();
            }
            if (!(loaded instanceof Map)) {
                throw new DeviceStoreException("Settings file " + file + " is not a mapping");
            }
            Map<String, Object> root = new LinkedHashMap<>();
            ((Map<?, ?>) loaded).forEach((k, v) -> root.put(String.valueOf(k), v));
            return root;
        } catch (IOException | YAMLException e) {
            throw new DeviceStoreException("Cannot read " + file, e);
        }
    }
}
