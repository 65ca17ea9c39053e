package de.bsommerfeld.bytesize.extract;

/**
 * A size found in free text.
 *
 * @param value number as written, with a comma read as decimal point
 * @param unit  unit as written, {@code "B"} when the text had none
 * @param bytes byte count of the whole match
 * @param input matched text
 * @param start offset of the first matched character
 * @param end   offset after the last matched character
 */
public record ExtractedMatch(double value, String unit, double bytes, String input, int start, int end) {
}
