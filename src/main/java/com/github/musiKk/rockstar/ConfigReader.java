package com.github.musiKk.rockstar;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.ToString;

public class ConfigReader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigReader.class);

    static final String CONFIG_FILE = "rockstar.cfg";

    static Config readConfig() {
        return readConfig(Path.of(CONFIG_FILE));
    }

    static Config readConfig(Path path) {
        var config = new Config();
        if (!Files.isRegularFile(path)) {
            LOG.warn("no configuration found at {}, using defaults", path);
            return config;
        }

        Properties properties = new Properties();
        try (var in = Files.newInputStream(path)) {
            properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }

        Arrays.stream(properties.getProperty("lookupPath", "").split(","))
            .map(String::strip)
            .filter(entry -> !entry.isEmpty())
            .forEach(config.lookupPath::add);
        config.keepStringQuotes = Boolean.parseBoolean(properties.getProperty("keepStringQuotes", "false"));
        config.printState = Boolean.parseBoolean(properties.getProperty("printState", "true"));
        LOG.debug("read {}: {}", path, config);
        return config;
    }

    @ToString
    static class Config {
        List<String> lookupPath = new ArrayList<>();
        boolean keepStringQuotes = false;
        boolean printState = true;

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath);
            ct.setKeepStringQuotes(keepStringQuotes);
            ct.setPrintState(printState);
        }
    }

    interface ConfigTarget {
        void setLookupPath(List<String> lookupPath);
        void setKeepStringQuotes(boolean keepStringQuotes);
        void setPrintState(boolean printState);
    }

}
