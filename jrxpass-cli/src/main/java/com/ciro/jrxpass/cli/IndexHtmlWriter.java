package com.ciro.jrxpass.cli;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Genera la página de arranque: sustituye el {@code <script type="jrx-boot">} del
 * shell por el script del framework con los datos de la aplicación.
 */
public final class IndexHtmlWriter {

    private static final Logger log = LoggerFactory.getLogger(IndexHtmlWriter.class);

    private IndexHtmlWriter() {}

    public static void updateIndex(
            CliConfig config,
            Path htmlPage,
            Path mainJar,
            List<String> referencesSources,
            List<String> embeddedResourcesSources,
            boolean linkerEnabled,
            Path output) throws IOException {

        String template = Files.readString(htmlPage);
        String entryPoint = readEntryPoint(mainJar);

        List<String> references = new ArrayList<>();
        for (String reference : referencesSources) {
            references.add(Paths.get(reference).getFileName().toString());
        }

        List<Path> embeddedJars = new ArrayList<>();
        for (String source : embeddedResourcesSources) {
            embeddedJars.add(Paths.get(source));
        }
        List<EmbeddedResources.Resource> resources = EmbeddedResources.scan(embeddedJars);

        String html = getIndexHtmlContents(
            config, template, mainJar.getFileName().toString(), entryPoint, references, resources, linkerEnabled);

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, html);
        log.info("Wrote {} ({} reference(s), {} embedded resource(s))", output, references.size(), resources.size());
    }

    static String getIndexHtmlContents(
            CliConfig config,
            String template,
            String mainJarName,
            String entryPoint,
            List<String> references,
            List<EmbeddedResources.Resource> resources,
            boolean linkerEnabled) {

        Document doc = Jsoup.parse(template);
        doc.outputSettings().prettyPrint(false);

        Element boot = findBootScript(doc, config.getBootScriptType());
        if (boot == null) {
            // Sin script de arranque no hay nada que inyectar
            log.warn("No <script type=\"{}\"> found, page copied unchanged", config.getBootScriptType());
            return template;
        }

        for (EmbeddedResources.Resource resource : resources) {
            boot.before(resourceTag(config, resource));
        }

        Element script = new Element("script");
        for (Attribute attribute : boot.attributes()) {
            if (!attribute.getKey().equalsIgnoreCase("type")) {
                script.attr(attribute.getKey(), attribute.getValue());
            }
        }
        script.attr("src", config.getFrameworkScript());
        script.attr("main", mainJarName);
        script.attr("entrypoint", entryPoint);
        script.attr("references", String.join(",", references));
        if (linkerEnabled) {
            script.attr("linker-enabled", "true");
        }

        boot.replaceWith(script);
        return doc.outerHtml();
    }

    static String readEntryPoint(Path mainJar) throws IOException {
        try (JarFile jar = new JarFile(mainJar.toFile())) {
            Manifest manifest = jar.getManifest();
            String mainClass = manifest == null
                ? null
                : manifest.getMainAttributes().getValue(java.util.jar.Attributes.Name.MAIN_CLASS);
            if (mainClass == null || mainClass.isBlank()) {
                throw new IllegalStateException("No Main-Class in the manifest of " + mainJar);
            }
            return mainClass.trim();
        }
    }

    private static Element findBootScript(Document doc, String bootType) {
        for (Element script : doc.getElementsByTag("script")) {
            if (script.attr("type").equalsIgnoreCase(bootType)) {
                return script;
            }
        }
        return null;
    }

    private static Element resourceTag(CliConfig config, EmbeddedResources.Resource resource) {
        String url = config.getContentRoot() + "/" + resource.library() + "/" + resource.path();
        return switch (resource.kind()) {
            case STYLESHEET -> new Element("link").attr("rel", "stylesheet").attr("href", url);
            case SCRIPT -> new Element("script").attr("src", url);
        };
    }
}
