package org.dxworks.alhconverter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.alhconverter.export.AlhExportFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class AlhConverterConfig {

    private static final String CONFIG_FILE_NAME = "alh-converter-config.yml";
    private static final int DEFAULT_XML_INDENT = 2;

    private final String edmCommand;
    private final String defaultConfigName;
    private final int xmlIndent;

    private AlhConverterConfig(String edmCommand, String defaultConfigName, int xmlIndent) {
        this.edmCommand = edmCommand;
        this.defaultConfigName = defaultConfigName;
        this.xmlIndent = xmlIndent;
    }

    /** Command that opens EDM displays in exported alarm handler files. */
    public String getEdmCommand() {
        return edmCommand;
    }

    /** Configuration name used when none is given on the command line; null for the input base name. */
    public String getDefaultConfigName() {
        return defaultConfigName;
    }

    public int getXmlIndent() {
        return xmlIndent;
    }

    public static AlhConverterConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static AlhConverterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                String edmCommand = (yamlConfig.edmCommand != null && !yamlConfig.edmCommand.isBlank())
                        ? yamlConfig.edmCommand.strip()
                        : AlhExportFormat.DEFAULT_EDM_COMMAND;
                String defaultConfigName = (yamlConfig.defaultConfigName != null && !yamlConfig.defaultConfigName.isBlank())
                        ? yamlConfig.defaultConfigName.strip()
                        : null;
                int xmlIndent = (yamlConfig.xmlIndent != null && yamlConfig.xmlIndent > 0)
                        ? yamlConfig.xmlIndent
                        : DEFAULT_XML_INDENT;

                return new AlhConverterConfig(edmCommand, defaultConfigName, xmlIndent);
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static AlhConverterConfig defaults() {
        return new AlhConverterConfig(AlhExportFormat.DEFAULT_EDM_COMMAND, null, DEFAULT_XML_INDENT);
    }

    private static class YamlConfig {
        public String edmCommand;
        public String defaultConfigName;
        public Integer xmlIndent;
    }
}
