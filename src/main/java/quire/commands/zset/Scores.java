package quire.commands.zset;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Score parsing and formatting shared by the sorted set commands.
 */
final class Scores {
    static final String NOT_A_FLOAT = "ERR value is not a valid float";

    private Scores() {
    }

    /** @return the parsed score, or null if {@code arg} is not a number */
    static Double parse(byte[] arg) {
        String s = new String(arg, StandardCharsets.UTF_8).trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        try {
            double d = Double.parseDouble(s);
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String format(double score) {
        if (Double.isInfinite(score)) return score > 0 ? "inf" : "-inf";
        if (score == Math.rint(score) && Math.abs(score) < 1e17) return String.valueOf((long) score);
        return new BigDecimal(Double.toString(score)).stripTrailingZeros().toPlainString();
    }
}
