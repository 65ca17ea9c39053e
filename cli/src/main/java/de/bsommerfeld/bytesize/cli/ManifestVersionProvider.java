package de.bsommerfeld.bytesize.cli;

import picocli.CommandLine.IVersionProvider;

import java.io.InputStream;
import java.util.Objects;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

/**
 * Reads {@code --version} output from the jar manifest.
 */
public class ManifestVersionProvider implements IVersionProvider {

    @Override
    public String[] getVersion() throws Exception {
        Package pkg = ByteSizeCli.class.getPackage();
        if (pkg != null && pkg.getImplementationVersion() != null) {
            return new String[]{format(pkg.getImplementationTitle(), pkg.getImplementationVersion())};
        }
        try (InputStream is = ByteSizeCli.class.getResourceAsStream("/META-INF/MANIFEST.MF")) {
            if (is == null) {
                return new String[]{"Version information not available"};
            }
            Attributes attrs = new Manifest(is).getMainAttributes();
            return new String[]{format(attrs.getValue("Implementation-Title"), attrs.getValue("Implementation-Version"))};
        }
    }

    static String format(String title, String version) {
        return String.format("%s version %s",
                Objects.requireNonNullElse(title, "bytesize"),
                Objects.requireNonNullElse(version, "unknown-version"));
    }
}
