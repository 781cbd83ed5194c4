package org.stackfall.utils;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * System properties are checked first, then environment variables, so
 * {@code ${user.home}/.stackfall/replays} and {@code ${STACKFALL_HOME}/replays} both work.
 *
 * @see org.stackfall.replay.storage.FileReplayRepository
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class
    }

    /**
     * Expands all variables in a path.
     * <pre>
     * expandPath("${user.home}/replays")        → "/home/player/replays"
     * expandPath("${user.home}/${GAME}/saves")  → "/home/player/stackfall/saves"
     * expandPath("/absolute/path")              → "/absolute/path"
     * </pre>
     *
     * @param path the path, possibly containing variables
     * @return the expanded path; {@code null} if {@code path} is {@code null}
     * @throws IllegalArgumentException if a variable is undefined or a reference is unclosed
     */
    public static String expandPath(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < path.length()) {
            int start = path.indexOf("${", pos);
            if (start == -1) {
                result.append(path, pos, path.length());
                break;
            }
            result.append(path, pos, start);

            int end = path.indexOf('}', start + 2);
            if (end == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }

            String name = path.substring(start + 2, end);
            String value = resolve(name);
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + name + "}' in path: " + path);
            }
            result.append(value);
            pos = end + 1;
        }
        return result.toString();
    }

    private static String resolve(String name) {
        String value = System.getProperty(name);
        return value != null ? value : System.getenv(name);
    }
}
