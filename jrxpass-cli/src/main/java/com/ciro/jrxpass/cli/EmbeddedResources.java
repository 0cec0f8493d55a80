package com.ciro.jrxpass.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Recursos estáticos (.css / .js) que una librería publica dentro de su jar,
 * bajo {@value #RESOURCE_ROOT}.
 */
final class EmbeddedResources {

    static final String RESOURCE_ROOT = "META-INF/resources/jrx/";

    enum Kind { STYLESHEET, SCRIPT }

    record Resource(String library, String path, Kind kind) {}

    private EmbeddedResources() {}

    static List<Resource> scan(List<Path> jars) throws IOException {
        List<Resource> found = new ArrayList<>();
        for (Path jarPath : jars) {
            String library = libraryName(jarPath);
            List<Resource> inJar = new ArrayList<>();

            try (JarFile jar = new JarFile(jarPath.toFile())) {
                for (JarEntry entry : Collections.list(jar.entries())) {
                    String name = entry.getName();
                    if (entry.isDirectory() || !name.startsWith(RESOURCE_ROOT)) continue;

                    String path = name.substring(RESOURCE_ROOT.length());
                    if (path.endsWith(".css")) {
                        inJar.add(new Resource(library, path, Kind.STYLESHEET));
                    } else if (path.endsWith(".js")) {
                        inJar.add(new Resource(library, path, Kind.SCRIPT));
                    }
                }
            }

            // El orden de las entradas del zip no es estable entre herramientas
            inJar.sort((a, b) -> a.path().compareTo(b.path()));
            found.addAll(inJar);
        }
        return found;
    }

    static String libraryName(Path jarPath) {
        String fileName = jarPath.getFileName().toString();
        return fileName.endsWith(".jar") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }
}
