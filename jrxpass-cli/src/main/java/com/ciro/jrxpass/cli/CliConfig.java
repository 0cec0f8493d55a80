package com.ciro.jrxpass.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuración de la línea de comandos. Se lee de {@code jrxpass-config.json};
 * si no existe, o le faltan claves, se usan los valores por defecto.
 */
public class CliConfig {

    static final String CONFIG_FILE_NAME = "jrxpass-config.json";

    static final String DEFAULT_BOOT_SCRIPT_TYPE = "jrx-boot";
    static final String DEFAULT_FRAMEWORK_SCRIPT = "_framework/jrx.js";
    static final String DEFAULT_CONTENT_ROOT = "_content";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private final String bootScriptType;
    private final String frameworkScript;
    private final String contentRoot;

    CliConfig(String bootScriptType, String frameworkScript, String contentRoot) {
        this.bootScriptType = bootScriptType;
        this.frameworkScript = frameworkScript;
        this.contentRoot = contentRoot;
    }

    public static CliConfig defaults() {
        return new CliConfig(DEFAULT_BOOT_SCRIPT_TYPE, DEFAULT_FRAMEWORK_SCRIPT, DEFAULT_CONTENT_ROOT);
    }

    /** Busca el archivo en el directorio de trabajo. */
    public static CliConfig load() throws IOException {
        Path configPath = Paths.get(CONFIG_FILE_NAME);
        if (!Files.exists(configPath)) {
            return defaults();
        }
        return load(configPath);
    }

    /** Un archivo pasado explícitamente tiene que existir y ser JSON válido. */
    public static CliConfig load(Path configPath) throws IOException {
        JsonConfig json = MAPPER.readValue(configPath.toFile(), JsonConfig.class);
        if (json == null) {
            return defaults();
        }
        return new CliConfig(
            orDefault(json.bootScriptType, DEFAULT_BOOT_SCRIPT_TYPE),
            orDefault(json.frameworkScript, DEFAULT_FRAMEWORK_SCRIPT),
            orDefault(json.contentRoot, DEFAULT_CONTENT_ROOT));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public String getBootScriptType() {
        return bootScriptType;
    }

    public String getFrameworkScript() {
        return frameworkScript;
    }

    public String getContentRoot() {
        return contentRoot;
    }

    static class JsonConfig {
        public String bootScriptType;
        public String frameworkScript;
        public String contentRoot;
    }
}
