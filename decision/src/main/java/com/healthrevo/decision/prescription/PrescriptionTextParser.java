package com.healthrevo.decision.prescription;

import com.healthrevo.decision.model.MedicationMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits free prescription text (typed, or returned by OCR) into medication mentions.
 *
 * <p>Lines that open with list numbering, a dosage form or a name-like word start a new mention.
 * Follow-up lines are attached to the current mention as dose, frequency or instructions. Strength
 * and frequency written on the name line itself are extracted as well.
 */
public class PrescriptionTextParser {

    private static final Logger logger = LoggerFactory.getLogger(PrescriptionTextParser.class);

    private static final Pattern LIST_NUMBERING = Pattern.compile("^\\s*\\d+\\s*[.)]\\s*");
    private static final Pattern DOSAGE_FORM_PREFIX = Pattern.compile(
        "^(?i)(?:tab|tablet|cap|capsule|syr|syrup|inj|injection)s?\\b\\.?\\s*");
    private static final Pattern STRENGTH = Pattern.compile(
        "(?i)\\b\\d+(?:[.,]\\d+)?\\s*(?:mg|mcg|µg|ug|g|gm|ml|iu|units?)(?=\\W|$)(?:\\s*/\\s*\\d*\\s*(?:ml|tab))?");
    private static final Pattern FREQUENCY = Pattern.compile(
        "(?i)\\b(?:(?:once|twice|thrice|(?:two|three|four|\\d+)\\s+times)(?:\\s+(?:a|per))?(?:\\s+(?:day|daily|week))?"
            + "|every\\s+\\d+\\s*(?:hours?|hrs?|h)\\b"
            + "|(?:od|bd|bid|tid|tds|qid|qds|qhs|hs|prn|sos|stat)\\b"
            + "|\\d-\\d-\\d"
            + "|(?:at\\s+)?(?:bedtime|night)"
            + "|daily)");
    private static final Pattern INSTRUCTION = Pattern.compile(
        "(?i)\\b(?:with|after|before|meals?|food|as needed|gargle|apply|avoid|empty stomach)\\b");
    private static final Set<String> NON_NAME_WORDS = Set.of(
        "take", "give", "apply", "with", "after", "before", "once", "twice", "thrice", "every", "as",
        "strength", "dose", "dosage", "sig", "qty", "quantity", "refill", "refills", "advice", "diet",
        "note", "notes", "dr", "doctor", "patient", "name", "date", "rx", "age", "sex", "review",
        "follow", "signature", "daily", "at", "for", "three", "four", "two", "one", "od", "bd", "tds",
        "tid", "bid", "qid", "prn", "sos", "hs", "avoid", "gargle", "continue", "stop", "days", "weeks");

    public List<MedicationMention> parse(String text) {
        List<MedicationMention> mentions = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return mentions;
        }
        Draft current = null;
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (startsMedication(line)) {
                if (current != null) {
                    mentions.add(current.toMention());
                }
                current = Draft.fromNameLine(line);
            } else if (current == null) {
                logger.debug("Ignoring preamble line: {}", line);
            } else if (STRENGTH.matcher(line).find() && current.dose == null) {
                current.dose = line;
            } else if (FREQUENCY.matcher(line).find() && current.frequency == null) {
                current.frequency = line;
            } else if (INSTRUCTION.matcher(line).find()) {
                current.instructions = current.instructions == null ? line : current.instructions + " " + line;
            } else {
                logger.debug("Ignoring line: {}", line);
            }
        }
        if (current != null) {
            mentions.add(current.toMention());
        }
        logger.debug("Parsed {} medication mentions from prescription text", mentions.size());
        return mentions;
    }

    private static boolean startsMedication(String line) {
        if (LIST_NUMBERING.matcher(line).find() || DOSAGE_FORM_PREFIX.matcher(line).find()) {
            return true;
        }
        String firstWord = line.split("[\\s:,.]+", 2)[0].toLowerCase(Locale.ROOT);
        if (firstWord.length() < 3 || !Character.isLetter(firstWord.charAt(0))) {
            return false;
        }
        return !NON_NAME_WORDS.contains(firstWord);
    }

    private static final class Draft {
        private String name;
        private String dose;
        private String frequency;
        private String instructions;

        static Draft fromNameLine(String line) {
            Draft draft = new Draft();
            String name = LIST_NUMBERING.matcher(line).replaceFirst("");
            name = DOSAGE_FORM_PREFIX.matcher(name).replaceFirst("");

            Matcher strength = STRENGTH.matcher(name);
            if (strength.find()) {
                draft.dose = strength.group().trim();
                name = name.substring(0, strength.start()) + " " + name.substring(strength.end());
            }
            Matcher frequency = FREQUENCY.matcher(name);
            if (frequency.find()) {
                draft.frequency = name.substring(frequency.start()).trim();
                name = name.substring(0, frequency.start());
            }
            draft.name = name.replaceAll("[\\s,;-]+$", "").replaceAll("\\s+", " ").trim();
            return draft;
        }

        MedicationMention toMention() {
            return MedicationMention.builder()
                .rawName(name)
                .dose(dose == null ? "" : dose)
                .frequency(frequency == null ? "" : frequency)
                .instructions(instructions)
                .build();
        }
    }
}
