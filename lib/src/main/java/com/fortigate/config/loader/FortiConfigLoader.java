package com.fortigate.config.loader;

import com.fortigate.config.tree.FortiConfig;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;

/** Entry point for loading FortiGate configuration backups from files, readers or strings. */
public final class FortiConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(FortiConfigLoader.class.getName());
    private static final String STRING_SOURCE = "<string>";

    private final FortiConfigParser parser = new FortiConfigParser();

    public FortiConfig load(Path configPath) throws LoaderException {
        return load(configPath, StandardCharsets.UTF_8);
    }

    public FortiConfig load(Path configPath, Charset charset) throws LoaderException {
        CharStream input;
        try {
            input = CharStreams.fromPath(configPath, charset);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read configuration " + configPath, ex);
        }
        FortiConfig config = parser.parse(configPath.toString(), input);
        LOGGER.log(Level.FINE, "Loaded {0} ({1} vdoms)", new Object[] {configPath, config.getVdoms().size()});
        return config;
    }

    public FortiConfig load(Reader reader, String sourceName) throws LoaderException {
        CharStream input;
        try {
            input = CharStreams.fromReader(reader, sourceName);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read configuration " + sourceName, ex);
        }
        return parser.parse(sourceName, input);
    }

    public FortiConfig parseString(String config) throws FortiConfigParseException {
        return parser.parse(STRING_SOURCE, config);
    }
}
