package com.seqdraft.core.parser;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the line forms of the sequence diagram notation.
 *
 * <p>All patterns are matched against trimmed lines and are anchored at both ends.
 * Keywords are case-sensitive.
 */
public final class LinePatterns {

    public static final String HEADER = "sequenceDiagram";
    public static final String COMMENT_PREFIX = "%%";
    public static final String AUTONUMBER = "autonumber";
    public static final String END = "end";

    public static final Pattern IDENTIFIER = Pattern.compile("\\w+");

    // %%{init: {...}}%%
    public static final Pattern DIRECTIVE = Pattern.compile("^%%\\{(.*)}%%$");

    public static final Pattern PARTICIPANT =
        Pattern.compile("^(participant|actor)\\s+(\\w+)(?:\\s+as\\s+(.+))?$");

    public static final Pattern CREATE =
        Pattern.compile("^create\\s+(participant|actor)\\s+(\\w+)(?:\\s+as\\s+(.+))?$");

    public static final Pattern DESTROY = Pattern.compile("^destroy\\s+(\\w+)$");

    public static final Pattern ACTIVATION = Pattern.compile("^(activate|deactivate)\\s+(\\w+)$");

    public static final Pattern NOTE =
        Pattern.compile("^Note\\s+(left of|right of|over)\\s+([^:]+?)\\s*:\\s*(.*)$");

    public static final Pattern LINK = Pattern.compile("^link\\s+(\\w+)\\s*:\\s*(.+?)\\s*@\\s*(\\S.*)$");

    public static final Pattern LINKS = Pattern.compile("^links\\s+(\\w+)\\s*:\\s*(\\{.*})$");

    public static final Pattern BLOCK_OPENER =
        Pattern.compile("^(loop|alt|opt|par|critical|break|rect)(?:\\s+(.*))?$");

    public static final Pattern SEPARATOR = Pattern.compile("^(else|and|option)(?:\\s+(.*))?$");

    public static final Pattern BOX = Pattern.compile("^box(?:\\s+(.*))?$");

    // transparent, rgb(...), rgba(...) followed by an optional description
    public static final Pattern BOX_COLOR =
        Pattern.compile("^(transparent|rgba?\\([^)]*\\))(?:\\s+(.*))?$");

    private static final Set<String> NAMED_COLORS = Set.of(
        "aqua", "aquamarine", "azure", "beige", "bisque", "black", "blue", "brown", "chartreuse",
        "coral", "crimson", "cyan", "fuchsia", "gold", "goldenrod", "gray", "green", "grey", "indigo",
        "ivory", "khaki", "lavender", "lightblue", "lightgray", "lightgreen", "lightgrey", "lightpink",
        "lightyellow", "lime", "linen", "magenta", "maroon", "navy", "olive", "orange", "orchid",
        "pink", "plum", "purple", "red", "salmon", "silver", "skyblue", "tan", "teal", "thistle",
        "tomato", "turquoise", "violet", "wheat", "white", "yellow"
    );

    private LinePatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Checks whether a word is a CSS color name accepted as a box color.
     *
     * @param word candidate word
     * @return true for a known color name, case-insensitive
     */
    public static boolean isNamedColor(String word) {
        return word != null && NAMED_COLORS.contains(word.toLowerCase(Locale.ROOT));
    }

    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }
}
