package com.fortigate.config.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class FortiConfigTokenizerTest {

    private final FortiConfigTokenizer tokenizer = new FortiConfigTokenizer();

    @Test
    void classifiesEveryLine() throws Exception {
        List<ConfigLine> lines =
                tokenizer.tokenize(
                        "test",
                        String.join(
                                "\n",
                                "#config-version=FGT60E-6.4.5",
                                "",
                                "config firewall address",
                                "    edit \"DMZ\"",
                                "        set subnet 172.16.1.0 255.255.255.0",
                                "        unset comment",
                                "    next",
                                "end",
                                "bogus"));

        assertEquals(9, lines.size());
        assertEquals(LineKind.COMMENT, lines.get(0).getKind());
        assertEquals("#config-version=FGT60E-6.4.5", lines.get(0).getText());
        assertEquals(LineKind.BLANK, lines.get(1).getKind());
        assertEquals(LineKind.CONFIG, lines.get(2).getKind());
        assertEquals(List.of("firewall", "address"), lines.get(2).getArguments());
        assertEquals(LineKind.EDIT, lines.get(3).getKind());
        assertEquals(List.of("\"DMZ\""), lines.get(3).getArguments());
        assertEquals(LineKind.SET, lines.get(4).getKind());
        assertEquals(List.of("subnet", "172.16.1.0", "255.255.255.0"), lines.get(4).getArguments());
        assertEquals(5, lines.get(4).getLineNumber());
        assertEquals("set subnet 172.16.1.0 255.255.255.0", lines.get(4).getText());
        assertEquals(LineKind.UNSET, lines.get(5).getKind());
        assertEquals(LineKind.NEXT, lines.get(6).getKind());
        assertEquals(LineKind.END, lines.get(7).getKind());
        assertEquals(LineKind.UNKNOWN, lines.get(8).getKind());
        assertEquals("bogus", lines.get(8).getKeyword());
    }

    @Test
    void quotedArgumentsKeepQuotesAndEscapes() throws Exception {
        List<ConfigLine> lines =
                tokenizer.tokenize("test", "set comments \"say \\\"hi\\\" now\" plain \"two words\"\n");

        assertEquals(1, lines.size());
        assertEquals(
                List.of("comments", "\"say \\\"hi\\\" now\"", "plain", "\"two words\""),
                lines.get(0).getArguments());
    }

    @Test
    void multiLineQuotedValueIsOneLogicalLine() throws Exception {
        List<ConfigLine> lines =
                tokenizer.tokenize("test", "set certificate \"line one\nline two\"\nnext\n");

        assertEquals(2, lines.size());
        assertEquals(List.of("certificate", "\"line one\nline two\""), lines.get(0).getArguments());
        assertEquals(1, lines.get(0).getLineNumber());
        assertEquals(LineKind.NEXT, lines.get(1).getKind());
        assertEquals(3, lines.get(1).getLineNumber());
    }

    @Test
    void windowsLineEndingsAreAccepted() throws Exception {
        List<ConfigLine> lines = tokenizer.tokenize("test", "config test\r\n    set a b\r\nend\r\n");

        assertEquals(3, lines.size());
        assertEquals(List.of("a", "b"), lines.get(1).getArguments());
    }

    @Test
    void unterminatedQuoteIsReportedWithItsLine() {
        FortiConfigParseException ex =
                assertThrows(
                        FortiConfigParseException.class,
                        () -> tokenizer.tokenize("test", "config test\n    edit \"opt1\n    next\nend\n"));

        assertEquals(2, ex.getLineNumber());
        assertTrue(ex.getMessage().contains("unterminated quoted string"), ex.getMessage());
        assertTrue(ex.getLineText().startsWith("edit \"opt1"), ex.getLineText());
    }

    @Test
    void debugFlagCapturesTokenDump() throws Exception {
        System.setProperty("fgtconfig.debugTokens", "true");
        try {
            DebugFlags.startCapture();
            tokenizer.tokenize("test", "config test\nend\n");
            List<String> captured = DebugFlags.drainCapturedTokens();
            assertTrue(captured.get(0).startsWith("CONFIG_KEY"), captured.toString());

            tokenizer.tokenize("test", "config test\nend\n");
            assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
        } finally {
            System.clearProperty("fgtconfig.debugTokens");
        }
    }
}
