package com.fortigate.config.traversal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fortigate.config.testing.TestConfigs;
import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.ObjectNode;
import com.fortigate.config.tree.RootNode;
import com.fortigate.config.tree.SetNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigTraverserTest {

    private static RootNode nested() throws Exception {
        return TestConfigs.parse(
                        "config level1.1",
                        "    config level2.1.1",
                        "    end",
                        "    config level2.1.2",
                        "        set param1 value1",
                        "    end",
                        "end",
                        "config level1.2",
                        "    config level2.2.1",
                        "        config level3.2.1",
                        "            set param1 value1",
                        "            set param2 value2",
                        "        end",
                        "    end",
                        "end")
                .getRoot();
    }

    @Test
    void visitsDepthFirstInSourceOrder() throws Exception {
        List<String> visited = new ArrayList<>();
        ConfigTraverser.traverse(
                nested(),
                (enter, item, context, trail) -> {
                    trail.add((enter ? "+" : "-") + item.getKey());
                    return VisitResult.CONTINUE;
                },
                visited);

        assertEquals(
                List.of(
                        "+level1.1",
                        "+level2.1.1",
                        "-level2.1.1",
                        "+level2.1.2",
                        "+param1",
                        "-param1",
                        "-level2.1.2",
                        "-level1.1",
                        "+level1.2",
                        "+level2.2.1",
                        "+level3.2.1",
                        "+param1",
                        "-param1",
                        "+param2",
                        "-param2",
                        "-level3.2.1",
                        "-level2.2.1",
                        "-level1.2"),
                visited);
    }

    @Test
    void contextHoldsAncestors() throws Exception {
        List<String> paths = new ArrayList<>();
        ConfigTraverser.traverse(
                nested(),
                (enter, item, context, trail) -> {
                    if (enter && item.getNode() instanceof SetNode) {
                        trail.add(context.path("/") + "/" + item.getKey());
                        assertTrue(context.parentNode().orElseThrow() instanceof ObjectNode);
                    }
                    return VisitResult.CONTINUE;
                },
                paths);

        assertEquals(
                List.of(
                        "level1.1/level2.1.2/param1",
                        "level1.2/level2.2.1/level3.2.1/param1",
                        "level1.2/level2.2.1/level3.2.1/param2"),
                paths);
    }

    @Test
    void skippedSubtreeStillGetsExitCall() throws Exception {
        List<String> visited = new ArrayList<>();
        ConfigTraverser.traverse(
                nested(),
                (enter, item, context, trail) -> {
                    trail.add((enter ? "+" : "-") + item.getKey());
                    return "level1.2".equals(item.getKey()) ? VisitResult.SKIP_SUBTREE : VisitResult.CONTINUE;
                },
                visited);

        assertEquals(List.of("+level1.2", "-level1.2"), visited.subList(visited.size() - 2, visited.size()));
    }

    @Test
    void traversingANodeReportsTheNodeItself() throws Exception {
        RootNode root = nested();
        TraversalContext context = new TraversalContext();
        List<String> visited = new ArrayList<>();
        ConfigTraverser.traverse(
                "level2.1.2",
                root.at("level1.1", "level2.1.2"),
                (enter, item, ctx, trail) -> {
                    if (enter) {
                        trail.add(item.getKey());
                    }
                    return VisitResult.CONTINUE;
                },
                context,
                visited);

        assertEquals(List.of("level2.1.2", "param1"), visited);
        assertTrue(context.isEmpty());
    }

    @Test
    void visitorMayRewriteValues() throws Exception {
        RootNode root = nested();
        ConfigTraverser.traverse(
                root,
                (enter, item, context, suffix) -> {
                    if (enter && item.getNode() instanceof SetNode set) {
                        set.setValue(0, set.first() + suffix);
                    }
                    return VisitResult.CONTINUE;
                },
                "-changed");

        assertEquals("value2-changed", root.paramAt("level1.2", "level2.2.1", "level3.2.1", "param2"));
        assertEquals("value1-changed", root.paramAt("level1.1", "level2.1.2", "param1"));
    }

    @Test
    void keysRemovedDuringTheWalkAreSkipped() throws Exception {
        RootNode root = nested();
        List<String> visited = new ArrayList<>();
        ConfigTraverser.traverse(
                root,
                (enter, item, context, trail) -> {
                    if (enter) {
                        trail.add(item.getKey());
                        if ("level1.1".equals(item.getKey())) {
                            root.remove("level1.2");
                        }
                    }
                    return VisitResult.CONTINUE;
                },
                visited);

        assertEquals(List.of("level1.1", "level2.1.1", "level2.1.2", "param1"), visited);
    }

    @Test
    void contextPopsAfterEachContainer() {
        TraversalContext context = new TraversalContext();
        ConfigItem item = new ConfigItem("a", new ObjectNode());
        context.push(item);

        assertTrue(context.isWithin("a"));
        assertEquals(item, context.pop());
        assertTrue(context.parent().isEmpty());
    }
}
