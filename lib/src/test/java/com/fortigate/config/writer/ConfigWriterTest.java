package com.fortigate.config.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fortigate.config.loader.FortiConfigLoader;
import com.fortigate.config.testing.TestConfigs;
import com.fortigate.config.tree.FortiConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigWriterTest {

    private final ConfigWriter writer = new ConfigWriter();
    private final FortiConfigLoader loader = new FortiConfigLoader();

    @Test
    void writesCanonicalLayout() throws Exception {
        FortiConfig config =
                TestConfigs.parse(
                        "config system interface",
                        "  edit \"port1\"",
                        "set ip 10.1.1.10 255.255.255.0",
                        "      unset description",
                        "    config ipv6",
                        "        set ip6-mode static",
                        "    end",
                        "  next",
                        "end");

        assertEquals(
                String.join(
                        "\n",
                        "config system interface",
                        "    edit \"port1\"",
                        "        set ip 10.1.1.10 255.255.255.0",
                        "        unset description",
                        "        config ipv6",
                        "            set ip6-mode static",
                        "        end",
                        "    next",
                        "end"),
                writer.toText(config));
    }

    @Test
    void indentIsConfigurable() throws Exception {
        FortiConfig config = TestConfigs.parse("config system global", "set timezone 12", "end");

        assertEquals(
                List.of("config system global", "  set timezone 12", "end"),
                new ConfigWriter(2).lines(config, null, null));
    }

    @Test
    void standaloneRoundTrips() throws Exception {
        FortiConfig original = TestConfigs.load(TestConfigs.STANDALONE);
        StringBuilder text = new StringBuilder();
        writer.write(original, text, true);

        FortiConfig reparsed = loader.parseString(text.toString());

        assertEquals(original.getRoot(), reparsed.getRoot());
        assertEquals(original.getComments().getLines(), reparsed.getComments().getLines());
        assertTrue(text.toString().contains("set comments \"Quoted \\\"inner\\\" words\""));
    }

    @Test
    void headerCommentsAreOptional() throws Exception {
        FortiConfig config = TestConfigs.load(TestConfigs.STANDALONE);
        StringBuilder without = new StringBuilder();
        writer.write(config, without, false);
        StringBuilder with = new StringBuilder();
        writer.write(config, with, true);

        assertFalse(without.toString().lines().anyMatch(line -> line.startsWith("#")));
        assertTrue(with.toString().startsWith("#config-version=FGT60E-6.4.5"));
        assertEquals(writer.toText(config) + "\n", without.toString());
        assertTrue(loader.parseString(without.toString()).getComments().isEmpty());
    }

    @Test
    void multiVdomRoundTrips() throws Exception {
        FortiConfig original = TestConfigs.load(TestConfigs.MULTI_VDOM);
        StringBuilder text = new StringBuilder();
        writer.write(original, text, true);

        FortiConfig reparsed = loader.parseString(text.toString());

        assertTrue(reparsed.isMultiVdom());
        assertEquals(original.getRoot(), reparsed.getRoot());
        assertEquals(original.getVdoms(), reparsed.getVdoms());
        assertEquals(original.getComments().getLines(), reparsed.getComments().getLines());
    }

    @Test
    void multiVdomLayout() throws Exception {
        List<String> lines = writer.lines(TestConfigs.load(TestConfigs.MULTI_VDOM), null, null);

        assertEquals(
                List.of(
                        "",
                        "config vdom",
                        "edit root",
                        "next",
                        "edit dmz",
                        "next",
                        "end",
                        "",
                        "config global",
                        "config system global",
                        "    set admintimeout 480"),
                lines.subList(0, 11));
        assertEquals(List.of("end", ""), lines.subList(lines.size() - 2, lines.size()));
        assertTrue(lines.contains("edit dmz"));
    }

    @Test
    void filterDropsLeavesAndSubtreesWithoutTouchingTheTree() throws Exception {
        FortiConfig config = TestConfigs.load(TestConfigs.STANDALONE);
        FortiConfig untouched = TestConfigs.load(TestConfigs.STANDALONE);
        ItemFilter<String> filter =
                (item, context, excluded) -> !item.getKey().equals(excluded) && !item.getKey().equals("password");

        String text = String.join("\n", writer.lines(config, filter, "system admin"));

        assertFalse(text.contains("config system admin"));
        assertFalse(text.contains("\"auditor\""));
        assertFalse(text.contains("set password"));
        assertTrue(text.contains("config vpn certificate local"));
        assertTrue(text.contains("        set comments \"Quoted \\\"inner\\\" words\""));
        assertEquals(untouched.getRoot(), config.getRoot());
    }

    @Test
    void acceptAllFilterMatchesUnfilteredOutput() throws Exception {
        FortiConfig config = TestConfigs.load(TestConfigs.STANDALONE);

        assertEquals(writer.lines(config, null, null), writer.lines(config, ItemFilter.all(), null));
    }

    @Test
    void writesSingleSection() throws Exception {
        FortiConfig config = TestConfigs.load(TestConfigs.STANDALONE);
        StringBuilder out = new StringBuilder();
        writer.writeSection("router static", config.getRoot().getTable("router static"), out, null, null);

        assertEquals(
                "config router static\n"
                        + "    edit 1\n"
                        + "        set gateway 10.1.1.254\n"
                        + "        set device \"wan1\"\n"
                        + "    next\n"
                        + "end\n",
                out.toString());
    }

    @Test
    void overwrittenSetKeepsFirstPosition() throws Exception {
        FortiConfig config =
                TestConfigs.parse("config test", "    set a 1", "    set b 2", "    set a 3", "end");

        assertEquals(List.of("config test", "    set a 3", "    set b 2", "end"), writer.lines(config, null, null));
    }
}
