package com.fortigate.config.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.ConfigNode;
import com.fortigate.config.tree.ContainerNode;
import com.fortigate.config.tree.FortiConfig;
import com.fortigate.config.tree.Quoting;
import com.fortigate.config.tree.RootNode;
import com.fortigate.config.tree.SetNode;
import com.fortigate.config.tree.TableNode;
import com.fortigate.config.tree.UnsetNode;
import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Converts a configuration to JSON:
 *
 * <pre>
 * {"comments": [...], "root": {...}, "vdoms": {"root": {...}}}
 * </pre>
 *
 * Sections become JSON objects, edit blocks are keyed by their unquoted identifier (the raw
 * identifier when the unquoted one is already taken in the same table), a
 * {@code set} becomes an array of its raw tokens and an {@code unset} an empty object.
 */
public final class JsonExporter {
    private final ObjectMapper mapper;

    public JsonExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toTree(FortiConfig config) {
        ObjectNode json = mapper.createObjectNode();
        ArrayNode comments = json.putArray("comments");
        for (String line : config.getComments().getLines()) {
            comments.add(line);
        }
        json.set("root", toTree(config.getRoot()));
        ObjectNode vdoms = json.putObject("vdoms");
        for (Map.Entry<String, RootNode> vdom : config.getVdoms().entrySet()) {
            vdoms.set(vdom.getKey(), toTree(vdom.getValue()));
        }
        return json;
    }

    public ObjectNode toTree(ContainerNode container) {
        ObjectNode json = mapper.createObjectNode();
        boolean table = container instanceof TableNode;
        for (ConfigItem item : container.entries()) {
            String key = table ? Quoting.unquote(item.getKey()) : item.getKey();
            if (json.has(key)) {
                // edit 1 and edit "1" unquote to the same id
                key = item.getKey();
            }
            json.set(key, toValue(item.getNode()));
        }
        return json;
    }

    public String toJson(FortiConfig config) throws JsonProcessingException {
        return mapper.writeValueAsString(toTree(config));
    }

    public void write(FortiConfig config, Writer out) throws IOException {
        out.write(toJson(config));
    }

    private JsonNode toValue(ConfigNode node) {
        if (node instanceof SetNode set) {
            ArrayNode values = mapper.createArrayNode();
            for (String token : set.getValues()) {
                values.add(token);
            }
            return values;
        }
        if (node instanceof UnsetNode) {
            return mapper.createObjectNode();
        }
        return toTree((ContainerNode) node);
    }
}
