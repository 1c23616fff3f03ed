package speakermigrator.device;

import speakermigrator.shell.ShellCommand;

/**
 * Shell commands the migrator issues on the speaker.
 */
public final class DeviceCommands {

    private DeviceCommands() {}

    /** Makes the root file system writable: {@code (rw || mount -o remount,rw /)}. */
    public static ShellCommand writeAccess() {
        return ShellCommand.of("rw")
                .or(ShellCommand.of("mount", "-o", "remount,rw", "/"))
                .group();
    }

    /** Runs {@code command} once the file system is writable. */
    public static ShellCommand withWriteAccess(ShellCommand command) {
        return writeAccess().and(command);
    }

    public static ShellCommand isFile(String path) {
        return ShellCommand.test("-f", path);
    }

    public static ShellCommand exists(String path) {
        return ShellCommand.test("-e", path);
    }

    public static ShellCommand cat(String path) {
        return ShellCommand.of("cat", path);
    }

    public static ShellCommand copy(String from, String to) {
        return ShellCommand.of("cp", from, to);
    }

    public static ShellCommand remove(String path) {
        return ShellCommand.of("rm", path);
    }

    /** {@code grep -F <text> <path>}: fixed-string search. */
    public static ShellCommand grepFixed(String text, String path) {
        return ShellCommand.of("grep", "-F", text, path);
    }
}
