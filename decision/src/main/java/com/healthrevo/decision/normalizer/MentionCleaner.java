package com.healthrevo.decision.normalizer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a raw medication mention to the part that names the drug: lower case, without
 * strengths, frequencies, dosage forms or list numbering.
 */
public final class MentionCleaner {

    private static final Pattern LIST_NUMBERING = Pattern.compile("^\\s*\\d+\\s*[.)]\\s*");
    private static final Pattern STRENGTH = Pattern.compile(
        "\\b\\d+(?:[.,]\\d+)?\\s*(?:mg|mcg|µg|ug|g|gm|ml|l|iu|units?|%)(?=\\W|$)");
    private static final Pattern BARE_NUMBER = Pattern.compile("\\b\\d+(?:[.,]\\d+)?\\b");
    private static final Pattern DOSAGE_FORM = Pattern.compile(
        "\\b(?:tabs?|tablets?|caps?|capsules?|syr|syrup|inj|injection|susp|suspension|oint|ointment|drops?|sachets?)\\b\\.?");
    private static final Pattern FREQUENCY = Pattern.compile(
        "\\b(?:od|bd|bid|tid|tds|qid|qds|qhs|hs|prn|sos|stat|once|twice|thrice|daily|weekly|nightly|"
            + "morning|evening|night|times|x|per|day|every|hours?|hrs?)\\b");
    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MentionCleaner() {
    }

    public static String clean(String rawName) {
        if (rawName == null) {
            return "";
        }
        String value = rawName.toLowerCase(Locale.ROOT);
        value = LIST_NUMBERING.matcher(value).replaceFirst("");
        value = STRENGTH.matcher(value).replaceAll(" ");
        value = DOSAGE_FORM.matcher(value).replaceAll(" ");
        value = FREQUENCY.matcher(value).replaceAll(" ");
        value = BARE_NUMBER.matcher(value).replaceAll(" ");
        value = NON_NAME_CHARS.matcher(value).replaceAll(" ");
        value = WHITESPACE.matcher(value).replaceAll(" ").trim();
        return value.replaceAll("^-+|-+$", "").trim();
    }

    /**
     * Lower-cases and collapses whitespace of a vocabulary term so it compares like a cleaned mention.
     */
    public static String normalizeTerm(String term) {
        return WHITESPACE.matcher(term.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s-]", " ")).replaceAll(" ").trim();
    }

    /**
     * Replaces digits that OCR commonly produces in place of letters.
     */
    public static String foldOcrDigits(String cleaned) {
        return cleaned.replace('0', 'o').replace('1', 'l').replace('5', 's').replace('8', 'b');
    }

    /**
     * @return true when the cleaned value contains at least two letters
     */
    public static boolean looksLikeName(String cleaned) {
        int letters = 0;
        for (int i = 0; i < cleaned.length(); i++) {
            if (Character.isLetter(cleaned.charAt(i)) && ++letters >= 2) {
                return true;
            }
        }
        return false;
    }
}
