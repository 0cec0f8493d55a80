package com.ciro.jrxpass.cli;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexHtmlWriterTest {

    private static final String SHELL = """
        <!DOCTYPE html>
        <html>
        <head><title>App</title></head>
        <body>
        <app>Loading...</app>
        <script type="jrx-boot" data-env="dev"></script>
        </body>
        </html>
        """;

    @TempDir
    Path dir;

    @Test
    void replacesBootScriptWithFrameworkScript() {
        String html = IndexHtmlWriter.getIndexHtmlContents(
            CliConfig.defaults(), SHELL, "app.jar", "com.acme.App",
            List.of("lib-a.jar", "lib-b.jar"), List.of(), false);

        Document doc = Jsoup.parse(html);
        Element script = singleScriptWithSrc(doc, "_framework/jrx.js");
        assertEquals("app.jar", script.attr("main"));
        assertEquals("com.acme.App", script.attr("entrypoint"));
        assertEquals("lib-a.jar,lib-b.jar", script.attr("references"));
        assertEquals("dev", script.attr("data-env"));
        assertFalse(script.hasAttr("type"));
        assertFalse(script.hasAttr("linker-enabled"));
        assertTrue(doc.select("script[type=jrx-boot]").isEmpty());
        assertEquals("Loading...", doc.selectFirst("app").text());
    }

    @Test
    void marksLinkerWhenEnabled() {
        String html = IndexHtmlWriter.getIndexHtmlContents(
            CliConfig.defaults(), SHELL, "app.jar", "com.acme.App", List.of(), List.of(), true);

        Element script = singleScriptWithSrc(Jsoup.parse(html), "_framework/jrx.js");
        assertEquals("true", script.attr("linker-enabled"));
        assertEquals("", script.attr("references"));
    }

    @Test
    void injectsEmbeddedResourcesBeforeTheBootScript() {
        List<EmbeddedResources.Resource> resources = List.of(
            new EmbeddedResources.Resource("widgets", "css/widgets.css", EmbeddedResources.Kind.STYLESHEET),
            new EmbeddedResources.Resource("widgets", "widgets.js", EmbeddedResources.Kind.SCRIPT));

        String html = IndexHtmlWriter.getIndexHtmlContents(
            CliConfig.defaults(), SHELL, "app.jar", "com.acme.App", List.of(), resources, false);

        Document doc = Jsoup.parse(html);
        Element link = doc.selectFirst("link[rel=stylesheet]");
        assertEquals("_content/widgets/css/widgets.css", link.attr("href"));

        Elements scripts = doc.select("script[src]");
        assertEquals(2, scripts.size());
        assertEquals("_content/widgets/widgets.js", scripts.get(0).attr("src"));
        assertEquals("_framework/jrx.js", scripts.get(1).attr("src"));
    }

    @Test
    void pageWithoutBootScriptIsReturnedAsIs() {
        String shell = "<html><body><script src=\"other.js\"></script></body></html>";

        String html = IndexHtmlWriter.getIndexHtmlContents(
            CliConfig.defaults(), shell, "app.jar", "com.acme.App", List.of("a.jar"), List.of(), true);

        assertEquals(shell, html);
    }

    @Test
    void honoursConfiguredBootTypeAndPaths() {
        CliConfig config = new CliConfig("app-boot", "/static/boot.js", "/libs");
        String shell = "<html><body><script type=\"APP-BOOT\"></script></body></html>";
        List<EmbeddedResources.Resource> resources = List.of(
            new EmbeddedResources.Resource("ui", "ui.css", EmbeddedResources.Kind.STYLESHEET));

        String html = IndexHtmlWriter.getIndexHtmlContents(
            config, shell, "app.jar", "com.acme.App", List.of(), resources, false);

        Document doc = Jsoup.parse(html);
        singleScriptWithSrc(doc, "/static/boot.js");
        assertEquals("/libs/ui/ui.css", doc.selectFirst("link").attr("href"));
    }

    @Test
    void updateIndexReadsJarsAndWritesTheOutput() throws IOException {
        Path page = Files.writeString(dir.resolve("index.html"), SHELL);
        Path mainJar = TestJars.jar(dir.resolve("app.jar"), "com.acme.App", Map.of());
        Path widgets = TestJars.jar(dir.resolve("widgets.jar"), null, Map.of(
            "META-INF/resources/jrx/widgets.js", "console.log('w');",
            "META-INF/resources/jrx/css/widgets.css", "p{}",
            "META-INF/resources/jrx/readme.txt", "ignored",
            "com/acme/Widget.class", "x"));
        Path output = dir.resolve("out/wwwroot/index.html");

        IndexHtmlWriter.updateIndex(
            CliConfig.defaults(), page, mainJar,
            List.of(dir.resolve("libs/lib-a.jar").toString(), "lib-b.jar"),
            List.of(widgets.toString()),
            false, output);

        Document doc = Jsoup.parse(Files.readString(output));
        Element script = singleScriptWithSrc(doc, "_framework/jrx.js");
        assertEquals("app.jar", script.attr("main"));
        assertEquals("com.acme.App", script.attr("entrypoint"));
        assertEquals("lib-a.jar,lib-b.jar", script.attr("references"));
        assertEquals("_content/widgets/css/widgets.css", doc.selectFirst("link").attr("href"));
        assertEquals(1, doc.select("script[src=_content/widgets/widgets.js]").size());
    }

    @Test
    void mainJarWithoutMainClassIsAnError() throws IOException {
        Path mainJar = TestJars.jar(dir.resolve("lib.jar"), null, Map.of());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
            () -> IndexHtmlWriter.readEntryPoint(mainJar));
        assertTrue(ex.getMessage().contains("Main-Class"));
    }

    @Test
    void scansOnlyStylesAndScriptsUnderTheResourceRoot() throws IOException {
        Path jar = TestJars.jar(dir.resolve("ui-1.0.jar"), null, Map.of(
            "META-INF/resources/jrx/b.js", "",
            "META-INF/resources/jrx/a.css", "",
            "META-INF/resources/jrx/img/logo.png", "",
            "static/c.js", ""));

        List<EmbeddedResources.Resource> resources = EmbeddedResources.scan(List.of(jar));

        assertEquals(List.of(
            new EmbeddedResources.Resource("ui-1.0", "a.css", EmbeddedResources.Kind.STYLESHEET),
            new EmbeddedResources.Resource("ui-1.0", "b.js", EmbeddedResources.Kind.SCRIPT)), resources);
    }

    private static Element singleScriptWithSrc(Document doc, String src) {
        Elements scripts = doc.getElementsByAttributeValue("src", src);
        assertEquals(1, scripts.size(), doc::outerHtml);
        return scripts.first();
    }
}
