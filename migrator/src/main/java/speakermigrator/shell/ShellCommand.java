package speakermigrator.shell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structured POSIX shell command.
 *
 * <p>Commands are built from a program name and arguments and composed with
 * {@link #and}, {@link #or}, {@link #pipe} and {@link #group}. The command is
 * turned into a shell string only by {@link #render()}, which the transport calls
 * right before sending it. Arguments are single-quoted when they contain anything
 * other than plain path/URL characters.
 *
 * <pre>
 * ShellCommand.of("rw").or(ShellCommand.of("mount", "-o", "remount,rw", "/"))
 *     .group()
 *     .and(ShellCommand.of("cp", "/etc/hosts", "/etc/hosts.original"))
 *     .render();
 * // (rw || mount -o remount,rw /) &amp;&amp; cp /etc/hosts /etc/hosts.original
 * </pre>
 */
public final class ShellCommand {

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    private final List<String> words;
    private final String rendered;

    private ShellCommand(List<String> words, String rendered) {
        this.words = words;
        this.rendered = rendered;
    }

    /**
     * Creates a simple command.
     *
     * @param program the program to run
     * @param args its arguments, quoted as needed when rendered
     * @return the command
     */
    public static ShellCommand of(String program, String... args) {
        Objects.requireNonNull(program, "program");
        List<String> words = new ArrayList<>(args.length + 1);
        words.add(program);
        Collections.addAll(words, args);
        StringBuilder sb = new StringBuilder(quoteProgram(program));
        for (String arg : args) {
            sb.append(' ').append(quote(Objects.requireNonNull(arg, "arg")));
        }
        return new ShellCommand(List.copyOf(words), sb.toString());
    }

    /**
     * Shorthand for the shell test builtin, e.g. {@code test("-f", path)} renders
     * as {@code [ -f path ]}.
     */
    public static ShellCommand test(String flag, String path) {
        Objects.requireNonNull(path, "path");
        String rendered = "[ " + quote(flag) + " " + quote(path) + " ]";
        return new ShellCommand(List.of("[", flag, path, "]"), rendered);
    }

    /** Runs {@code other} only if this command succeeds. */
    public ShellCommand and(ShellCommand other) {
        return compose(" && ", other);
    }

    /** Runs {@code other} only if this command fails. */
    public ShellCommand or(ShellCommand other) {
        return compose(" || ", other);
    }

    /** Feeds this command's stdout to {@code other}. */
    public ShellCommand pipe(ShellCommand other) {
        return compose(" | ", other);
    }

    /** Wraps this command in a subshell so it composes as one unit. */
    public ShellCommand group() {
        return new ShellCommand(words, "(" + rendered + ")");
    }

    /**
     * Returns the program and arguments of a simple command. For composed
     * commands this is the first command's words only.
     */
    public List<String> words() {
        return words;
    }

    /**
     * Serializes the command for the transport.
     *
     * @return the shell string
     */
    public String render() {
        return rendered;
    }

    private ShellCommand compose(String operator, ShellCommand other) {
        Objects.requireNonNull(other, "other");
        return new ShellCommand(words, rendered + operator + other.rendered);
    }

    static String quote(String arg) {
        if (arg.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(arg).matches()) {
            return arg;
        }
        return "'" + arg.replace("'", "'\\''") + "'";
    }

    private static String quoteProgram(String program) {
        return "[".equals(program) ? program : quote(program);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShellCommand)) return false;
        return rendered.equals(((ShellCommand) o).rendered);
    }

    @Override
    public int hashCode() {
        return rendered.hashCode();
    }

    @Override
    public String toString() {
        return rendered;
    }
}
