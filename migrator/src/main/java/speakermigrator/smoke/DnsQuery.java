package speakermigrator.smoke;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Hand-built DNS A query sent over TCP from the speaker with {@code nc}, since
 * BusyBox {@code nslookup} cannot always target a custom port.
 */
final class DnsQuery {

    private static final int TRANSACTION_ID = 0xAAAA;
    private static final int FLAGS_STANDARD_QUERY = 0x0100;
    private static final int TYPE_A = 1;
    private static final int CLASS_IN = 1;

    private DnsQuery() {}

    /**
     * Encodes a query for {@code name} with the two-byte TCP length prefix.
     */
    static byte[] tcpQuery(String name) {
        ByteArrayOutputStream msg = new ByteArrayOutputStream();
        writeShort(msg, TRANSACTION_ID);
        writeShort(msg, FLAGS_STANDARD_QUERY);
        writeShort(msg, 1);
        writeShort(msg, 0);
        writeShort(msg, 0);
        writeShort(msg, 0);
        for (String label : name.split("\\.")) {
            byte[] bytes = label.getBytes(StandardCharsets.US_ASCII);
            if (bytes.length == 0 || bytes.length > 63) {
                throw new IllegalArgumentException("invalid DNS label in " + name);
            }
            msg.write(bytes.length);
            msg.write(bytes, 0, bytes.length);
        }
        msg.write(0);
        writeShort(msg, TYPE_A);
        writeShort(msg, CLASS_IN);

        byte[] body = msg.toByteArray();
        ByteArrayOutputStream framed = new ByteArrayOutputStream(body.length + 2);
        writeShort(framed, body.length);
        framed.write(body, 0, body.length);
        return framed.toByteArray();
    }

    /** Renders bytes as {@code \xNN} escapes for {@code echo -ne}. */
    static String echoEscaped(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 4);
        for (byte b : bytes) {
            sb.append(String.format("\\x%02x", b & 0xff));
        }
        return sb.toString();
    }

    /**
     * Reads the address from {@code od -An -tu1} output of the last four response
     * bytes, e.g. {@code " 192 168 1 10"}.
     *
     * @return the dotted address, or null if the output is not four numbers
     */
    static String addressFromOd(String output) {
        String[] fields = output.trim().split("\\s+");
        if (fields.length != 4) {
            return null;
        }
        for (String f : fields) {
            if (!f.matches("\\d{1,3}")) {
                return null;
            }
        }
        return String.join(".", fields);
    }

    private static void writeShort(ByteArrayOutputStream out, int value) {
        out.write((value >> 8) & 0xff);
        out.write(value & 0xff);
    }
}
