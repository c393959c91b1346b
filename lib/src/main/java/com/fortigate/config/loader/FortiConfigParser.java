package com.fortigate.config.loader;

import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.ConfigNode;
import com.fortigate.config.tree.ContainerNode;
import com.fortigate.config.tree.FortiConfig;
import com.fortigate.config.tree.HeaderComments;
import com.fortigate.config.tree.ObjectNode;
import com.fortigate.config.tree.RootNode;
import com.fortigate.config.tree.RootScope;
import com.fortigate.config.tree.TableNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;

/**
 * Builds a {@link FortiConfig} from configuration text.
 *
 * <p>The accepted grammar is
 *
 * <pre>
 * file        = comment* section*
 * section     = "config" name+ NL ( body | entry* ) "end"
 * entry       = "edit" id NL body "next"
 * body        = ( "set" key value+ NL | "unset" key NL | section )*
 * </pre>
 *
 * A section whose first command is {@code edit} is a table, any other section is an object.
 * Inside the top-level {@code config vdom} table an entry may also be closed by {@code end},
 * which then closes the table as well.</p>
 *
 * <p>Open sections are kept on an explicit stack. Parameter names and values are not checked;
 * only the structure is.</p>
 */
public final class FortiConfigParser {
    private static final Logger LOGGER = Logger.getLogger(FortiConfigParser.class.getName());
    static final String VDOM_SECTION = "vdom";
    static final String GLOBAL_SECTION = "global";

    public FortiConfig parse(String sourceName, String input) throws FortiConfigParseException {
        Objects.requireNonNull(input, "input");
        return parse(sourceName, CharStreams.fromString(input, sourceName));
    }

    public FortiConfig parse(String sourceName, CharStream input) throws FortiConfigParseException {
        List<ConfigLine> lines = new FortiConfigTokenizer().tokenize(sourceName, input);
        return new ParseRun(sourceName, lines).run();
    }

    private enum FrameType {
        OBJECT,
        TABLE,
        EDIT
    }

    private static final class Frame {
        final FrameType type;
        final String key;
        final ContainerNode node;
        final ConfigLine openedBy;
        final boolean vdom;

        Frame(FrameType type, String key, ContainerNode node, ConfigLine openedBy, boolean vdom) {
            this.type = type;
            this.key = key;
            this.node = node;
            this.openedBy = openedBy;
            this.vdom = vdom;
        }
    }

    private static final class ParseRun {
        private final String sourceName;
        private final List<ConfigLine> lines;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<String> comments = new ArrayList<>();
        private final ObjectNode topLevel = new ObjectNode();
        private final Map<String, ConfigLine> topLevelLines = new HashMap<>();
        private final Map<String, ObjectNode> vdoms = new LinkedHashMap<>();
        private boolean inHeader = true;

        ParseRun(String sourceName, List<ConfigLine> lines) {
            this.sourceName = sourceName;
            this.lines = lines;
        }

        FortiConfig run() throws FortiConfigParseException {
            for (int i = 0; i < lines.size(); i++) {
                ConfigLine line = lines.get(i);
                switch (line.getKind()) {
                    case BLANK:
                        break;
                    case COMMENT:
                        if (inHeader) {
                            comments.add(line.getText());
                        } else {
                            LOGGER.log(Level.FINE, "Skipping comment at line {0}", line.getLineNumber());
                        }
                        break;
                    case CONFIG:
                        inHeader = false;
                        openSection(line, startsTable(i));
                        break;
                    case EDIT:
                        inHeader = false;
                        openEntry(line);
                        break;
                    case NEXT:
                        inHeader = false;
                        closeEntry(line);
                        break;
                    case END:
                        inHeader = false;
                        closeSection(line);
                        break;
                    case SET:
                        inHeader = false;
                        assign(line);
                        break;
                    case UNSET:
                        inHeader = false;
                        unassign(line);
                        break;
                    default:
                        throw error(line, stack.isEmpty()
                                ? "unexpected top-level keyword '" + line.getKeyword() + "'"
                                : "unknown command '" + line.getKeyword() + "'");
                }
            }
            if (!stack.isEmpty()) {
                Frame open = stack.peek();
                throw error(open.openedBy, "unexpected end of input, '" + open.key + "' is not closed");
            }
            return build();
        }

        /** Looks past comments and blank lines for an {@code edit} command. */
        private boolean startsTable(int index) {
            for (int j = index + 1; j < lines.size(); j++) {
                LineKind kind = lines.get(j).getKind();
                if (kind.isStructural()) {
                    return kind == LineKind.EDIT;
                }
            }
            return false;
        }

        private void openSection(ConfigLine line, boolean table) throws FortiConfigParseException {
            if (line.getArguments().isEmpty()) {
                throw error(line, "config command without a section name");
            }
            String name = String.join(" ", line.getArguments());
            ContainerNode section = table ? new TableNode() : new ObjectNode();
            boolean vdomTable = false;
            if (stack.isEmpty()) {
                if (table && VDOM_SECTION.equals(name)) {
                    vdomTable = true;
                } else {
                    topLevel.put(name, section);
                    topLevelLines.put(name, line);
                }
            } else {
                currentObject(line, "config").put(name, section);
            }
            stack.push(new Frame(table ? FrameType.TABLE : FrameType.OBJECT, name, section, line, vdomTable));
        }

        private void openEntry(ConfigLine line) throws FortiConfigParseException {
            Frame top = stack.peek();
            if (top == null || top.type != FrameType.TABLE) {
                throw error(line, "edit outside a table");
            }
            if (line.getArguments().size() != 1) {
                throw error(line, "edit expects exactly one identifier");
            }
            String id = line.getArguments().get(0);
            ObjectNode body = new ObjectNode();
            ((TableNode) top.node).putEntry(id, body);
            if (top.vdom) {
                vdoms.put(id, body);
            }
            stack.push(new Frame(FrameType.EDIT, id, body, line, top.vdom));
        }

        private void closeEntry(ConfigLine line) throws FortiConfigParseException {
            requireNoArguments(line);
            Frame top = stack.peek();
            if (top == null || top.type != FrameType.EDIT) {
                throw error(line, "next without a matching edit");
            }
            stack.pop();
        }

        private void closeSection(ConfigLine line) throws FortiConfigParseException {
            requireNoArguments(line);
            Frame top = stack.peek();
            if (top == null) {
                throw error(line, "end without a matching config");
            }
            if (top.type == FrameType.EDIT) {
                if (!top.vdom) {
                    throw error(line, "end inside edit '" + top.key + "', expected next");
                }
                // A vdom body is closed together with its table.
                stack.pop();
            }
            stack.pop();
        }

        private void assign(ConfigLine line) throws FortiConfigParseException {
            List<String> arguments = line.getArguments();
            if (arguments.size() < 2) {
                throw error(line, "set command without a value");
            }
            currentObject(line, "set").assign(arguments.get(0), arguments.subList(1, arguments.size()));
        }

        private void unassign(ConfigLine line) throws FortiConfigParseException {
            if (line.getArguments().size() != 1) {
                throw error(line, "unset expects exactly one parameter name");
            }
            currentObject(line, "unset").unassign(line.getArguments().get(0));
        }

        private ObjectNode currentObject(ConfigLine line, String command) throws FortiConfigParseException {
            Frame top = stack.peek();
            if (top == null) {
                throw error(line, "unexpected top-level keyword '" + command + "'");
            }
            if (top.type == FrameType.TABLE) {
                throw error(line, command + " inside table '" + top.key + "' outside an edit block");
            }
            if (top.type == FrameType.EDIT && top.vdom && !"config".equals(command)) {
                throw error(line, command + " directly inside vdom '" + top.key + "'");
            }
            return (ObjectNode) top.node;
        }

        private FortiConfig build() throws FortiConfigParseException {
            HeaderComments header = new HeaderComments(comments);
            if (vdoms.isEmpty()) {
                return new FortiConfig(header, RootNode.of(RootScope.CONFIG, "", topLevel), Map.of());
            }

            ConfigNode globalNode = topLevel.find(GLOBAL_SECTION).orElse(null);
            if (globalNode == null) {
                throw error(null, "configuration defines vdoms but has no 'config global' section");
            }
            if (!(globalNode instanceof ObjectNode global)) {
                throw error(topLevelLines.get(GLOBAL_SECTION), "config global must be an object, not a table");
            }
            for (ConfigItem item : global.entries()) {
                if (!item.getNode().isContainer()) {
                    throw error(
                            topLevelLines.get(GLOBAL_SECTION),
                            item.getNode().getKind() + " '" + item.getKey() + "' directly inside config global");
                }
            }
            for (String key : topLevel.keys()) {
                if (!GLOBAL_SECTION.equals(key)) {
                    LOGGER.warning(() -> sourceName + ": ignoring top-level section '" + key
                            + "' outside config global and config vdom");
                }
            }

            Map<String, RootNode> vdomRoots = new LinkedHashMap<>();
            for (Map.Entry<String, ObjectNode> vdom : vdoms.entrySet()) {
                vdomRoots.put(vdom.getKey(), RootNode.of(RootScope.VDOM, vdom.getKey(), vdom.getValue()));
            }
            return new FortiConfig(header, RootNode.of(RootScope.GLOBAL, GLOBAL_SECTION, global), vdomRoots);
        }

        private void requireNoArguments(ConfigLine line) throws FortiConfigParseException {
            if (!line.getArguments().isEmpty()) {
                throw error(line, line.getKeyword() + " takes no arguments");
            }
        }

        private FortiConfigParseException error(ConfigLine line, String message) {
            if (line == null) {
                int last = lines.isEmpty() ? 0 : lines.get(lines.size() - 1).getLineNumber();
                return new FortiConfigParseException(sourceName, last, "", message);
            }
            return new FortiConfigParseException(sourceName, line.getLineNumber(), line.getText(), message);
        }
    }
}
