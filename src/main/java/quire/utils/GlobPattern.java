package quire.utils;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translates KEYS glob patterns into regular expressions.
 * Supports {@code *}, {@code ?}, character classes ({@code [abc]}, {@code [a-z]},
 * {@code [^a]}) and backslash escapes.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static Pattern compile(String glob) {
        try {
            return Pattern.compile(toRegex(glob), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            // Inverted ranges such as [z-a]: fall back to a literal match.
            return Pattern.compile(Pattern.quote(glob), Pattern.DOTALL);
        }
    }

    static String toRegex(String glob) {
        StringBuilder re = new StringBuilder();
        int n = glob.length();
        for (int i = 0; i < n; i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    re.append(".*");
                    break;
                case '?':
                    re.append('.');
                    break;
                case '\\':
                    if (i + 1 < n) i++;
                    re.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    break;
                case '[': {
                    int end = classEnd(glob, i + 1);
                    if (end < 0) {
                        re.append(Pattern.quote("["));
                        break;
                    }
                    re.append(charClass(glob, i + 1, end));
                    i = end;
                    break;
                }
                default:
                    re.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return re.toString();
    }

    private static int classEnd(String glob, int from) {
        for (int j = from; j < glob.length(); j++) {
            char d = glob.charAt(j);
            if (d == '\\') j++;
            else if (d == ']') return j;
        }
        return -1;
    }

    private static String charClass(String glob, int from, int end) {
        boolean negate = from < end && glob.charAt(from) == '^';
        if (negate) from++;
        StringBuilder cls = new StringBuilder();
        for (int j = from; j < end; j++) {
            char d = glob.charAt(j);
            if (d == '\\' && j + 1 < end) {
                classChar(cls, glob.charAt(++j));
            } else if (d == '-' && cls.length() > 0 && j + 1 < end) {
                cls.append('-');
            } else {
                classChar(cls, d);
            }
        }
        if (cls.length() == 0) return negate ? "." : "[^\\s\\S]";
        return "[" + (negate ? "^" : "") + cls + "]";
    }

    private static void classChar(StringBuilder cls, char d) {
        if ("\\[]^-&".indexOf(d) >= 0) cls.append('\\');
        cls.append(d);
    }
}
