package speakermigrator.patch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HostsFileEditor")
class HostsFileEditorTest {

    private static final List<String> DOMAINS = List.of("streaming.bose.com", "updates.bose.com");

    @Nested
    @DisplayName("redirect")
    class Redirect {

        @Test
        @DisplayName("should append missing domains after existing entries")
        void shouldAppendMissingDomains() {
            String result = HostsFileEditor.redirect("127.0.0.1 localhost", "10.0.0.9", DOMAINS);

            assertThat(result).isEqualTo("127.0.0.1 localhost\n"
                    + "10.0.0.9\tstreaming.bose.com\n"
                    + "10.0.0.9\tupdates.bose.com\n");
        }

        @Test
        @DisplayName("should rewrite existing entries in place")
        void shouldRewriteInPlace() {
            String current = "# comment\n1.2.3.4   streaming.bose.com\n\n127.0.0.1 localhost\n";

            String result = HostsFileEditor.redirect(current, "10.0.0.9", DOMAINS);

            assertThat(result).isEqualTo("# comment\n10.0.0.9\tstreaming.bose.com\n\n127.0.0.1 localhost\n"
                    + "10.0.0.9\tupdates.bose.com\n");
        }

        @Test
        @DisplayName("should be stable when applied twice")
        void shouldBeStable() {
            String once = HostsFileEditor.redirect("127.0.0.1 localhost\n", "10.0.0.9", DOMAINS);

            assertThat(HostsFileEditor.redirect(once, "10.0.0.9", DOMAINS)).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("withEntry and without should add and remove a single domain")
    void withEntryAndWithout() {
        String added = HostsFileEditor.withEntry("127.0.0.1 localhost\n", "10.0.0.9", "test.local");

        assertThat(added).isEqualTo("127.0.0.1 localhost\n10.0.0.9\ttest.local\n");
        assertThat(HostsFileEditor.without(added, "test.local")).isEqualTo("127.0.0.1 localhost\n");
    }

    @Test
    @DisplayName("plannedEntries should list one tab-separated entry per domain")
    void plannedEntries() {
        assertThat(HostsFileEditor.plannedEntries("10.0.0.9", DOMAINS))
                .isEqualTo("10.0.0.9\tstreaming.bose.com\n10.0.0.9\tupdates.bose.com");
    }
}
