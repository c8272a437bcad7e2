package com.phillippitts.lineaccuracy.service.align;

/**
 * How much deviation an attempt may contain and still pass, scaled by line length.
 *
 * <table>
 *   <caption>Bands (non-strict)</caption>
 *   <tr><th>scored words</th><th>missing</th><th>extra</th><th>min accuracy</th></tr>
 *   <tr><td>&gt; 20</td><td>3</td><td>3</td><td>85</td></tr>
 *   <tr><td>11..20</td><td>2</td><td>2</td><td>90</td></tr>
 *   <tr><td>&le; 10</td><td>1</td><td>1</td><td>90</td></tr>
 * </table>
 *
 * <p>Strict mode allows nothing: no missing or extra words and 100% accuracy.
 *
 * @param allowedMissing maximum missing words
 * @param allowedExtra   maximum extra words
 * @param minAccuracy    minimum accuracy percentage
 */
public record ToleranceBands(int allowedMissing, int allowedExtra, int minAccuracy) {

    static final ToleranceBands STRICT = new ToleranceBands(0, 0, 100);
    static final ToleranceBands LONG = new ToleranceBands(3, 3, 85);
    static final ToleranceBands MEDIUM = new ToleranceBands(2, 2, 90);
    static final ToleranceBands SHORT = new ToleranceBands(1, 1, 90);

    /**
     * Picks the band for a line.
     *
     * @param effectiveWordCount scored words in the line
     * @param strict             whether strict mode is on
     * @return tolerance band
     */
    public static ToleranceBands forWordCount(int effectiveWordCount, boolean strict) {
        if (strict) {
            return STRICT;
        }
        if (effectiveWordCount > 20) {
            return LONG;
        }
        if (effectiveWordCount > 10) {
            return MEDIUM;
        }
        return SHORT;
    }
}
