package work.lcod.recli.reflect;

/**
 * Field name to command name conversions.
 */
public final class NameConverters {
    private NameConverters() {}

    /**
     * {@code listenAddress} becomes {@code listen-address}. A capital directly following another
     * capital, or closing the name, does not start a new word, so {@code timeoutMS} becomes
     * {@code timeout-ms} and {@code sizeB} becomes {@code sizeb}.
     */
    public static String toLowerDashCase(String name) {
        var output = new StringBuilder(name.length() + 4);
        int[] codePoints = name.codePoints().toArray();
        boolean previousUppercase = false;
        for (int i = 0; i < codePoints.length; i++) {
            int cp = codePoints[i];
            boolean uppercase = Character.isUpperCase(cp);
            if (i == 0) {
                output.appendCodePoint(Character.toLowerCase(cp));
            } else if (uppercase) {
                if (!previousUppercase && i != codePoints.length - 1) {
                    output.append('-');
                }
                output.appendCodePoint(Character.toLowerCase(cp));
            } else {
                output.appendCodePoint(cp);
            }
            previousUppercase = uppercase;
        }
        return output.toString();
    }
}
