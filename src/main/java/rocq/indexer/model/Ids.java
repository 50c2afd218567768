package rocq.indexer.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

public final class Ids {

    public static final String TOP_LEVEL = "Top-level";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Ids() {
    }

    /**
     * Path of {@code file} relative to {@code root}, with '/' separators.
     * Files outside the root keep their own path.
     */
    public static String relativeFile(Path root, Path file) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");
        final Path absRoot = root.toAbsolutePath().normalize();
        final Path absFile = file.toAbsolutePath().normalize();
        final Path rel = absFile.startsWith(absRoot) ? absRoot.relativize(absFile) : file.normalize();
        return rel.toString().replace('\\', '/');
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
