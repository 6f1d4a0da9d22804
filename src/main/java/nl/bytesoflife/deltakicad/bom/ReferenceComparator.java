package nl.bytesoflife.deltakicad.bom;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders reference designators by alphabetic prefix, then numeric suffix, so
 * that R2 sorts before R10. References without a numeric suffix sort before
 * numbered ones with the same prefix.
 */
public final class ReferenceComparator implements Comparator<String> {

    public static final ReferenceComparator INSTANCE = new ReferenceComparator();

    private static final Pattern DESIGNATOR = Pattern.compile("^(.*?)(\\d+)$");

    private ReferenceComparator() {
    }

    @Override
    public int compare(String a, String b) {
        Matcher ma = DESIGNATOR.matcher(a);
        Matcher mb = DESIGNATOR.matcher(b);
        String prefixA = ma.matches() ? ma.group(1) : a;
        String prefixB = mb.matches() ? mb.group(1) : b;
        int result = prefixA.compareTo(prefixB);
        if (result != 0) {
            return result;
        }
        boolean numberedA = ma.matches();
        boolean numberedB = mb.matches();
        if (numberedA != numberedB) {
            return numberedA ? 1 : -1;
        }
        if (numberedA) {
            // compare digit strings by length first to avoid overflow on long suffixes
            String digitsA = stripLeadingZeros(ma.group(2));
            String digitsB = stripLeadingZeros(mb.group(2));
            result = Integer.compare(digitsA.length(), digitsB.length());
            if (result == 0) {
                result = digitsA.compareTo(digitsB);
            }
        }
        return result != 0 ? result : a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
