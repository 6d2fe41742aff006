package com.embedbot.ingest;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits raw document text into ordered segments of a few consecutive sentences.
 *
 * <p>Text is cleaned of control characters and repeated whitespace, split into sentences,
 * stripped of sentences that carry too few words, then packed greedily up to the sentence
 * ceiling and the character budget. A sentence longer than the budget is cut at word
 * boundaries.
 */
public class Segmenter {
    private static final Logger log = LoggerFactory.getLogger(Segmenter.class);
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final SegmenterSettings settings;

    public Segmenter(SegmenterSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws EmptyInputException when the text is blank or has no informative sentence
     */
    public SegmentSequence segment(String rawText) {
        String text = clean(rawText);
        if (text.isEmpty()) {
            throw new EmptyInputException("The document contains no text.");
        }
        List<String> units = new ArrayList<>();
        int dropped = 0;
        for (String sentence : sentences(text)) {
            if (!isInformative(sentence)) {
                dropped++;
                continue;
            }
            units.addAll(splitLongSentence(sentence));
        }
        if (units.isEmpty()) {
            throw new EmptyInputException("The document contains no usable sentences.");
        }
        log.debug("segmenter.sentences kept={} dropped={}", units.size(), dropped);
        return new SegmentSequence(units, settings.maxSentences(), settings.maxCharacters());
    }

    static String clean(String rawText) {
        if (rawText == null) {
            return "";
        }
        String withoutControl = CONTROL.matcher(rawText).replaceAll(" ");
        return WHITESPACE.matcher(withoutControl).replaceAll(" ").trim();
    }

    private List<String> sentences(String text) {
        BreakIterator iterator = BreakIterator.getSentenceInstance(settings.locale());
        iterator.setText(text);
        List<String> sentences = new ArrayList<>();
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            String sentence = text.substring(start, end).trim();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    boolean isInformative(String sentence) {
        int words = 0;
        for (String token : TOKEN_SEPARATOR.split(sentence)) {
            if (!token.isEmpty() && token.chars().allMatch(Character::isLetter)) {
                words++;
            }
        }
        if (words < settings.minWords()) {
            return false;
        }
        int alphanumeric = 0;
        int alphabetic = 0;
        for (int i = 0; i < sentence.length(); i++) {
            char c = sentence.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                alphanumeric++;
                if (Character.isLetter(c)) {
                    alphabetic++;
                }
            }
        }
        return alphanumeric > 0 && (double) alphabetic / alphanumeric >= settings.minAlphaRatio();
    }

    private List<String> splitLongSentence(String sentence) {
        int budget = settings.maxCharacters();
        if (sentence.length() <= budget) {
            return List.of(sentence);
        }
        List<String> pieces = new ArrayList<>();
        StringBuilder piece = new StringBuilder();
        for (String word : sentence.split(" ")) {
            if (piece.length() > 0 && piece.length() + 1 + word.length() > budget) {
                pieces.add(piece.toString());
                piece.setLength(0);
            }
            if (piece.length() > 0) {
                piece.append(' ');
            }
            piece.append(word);
        }
        if (piece.length() > 0) {
            pieces.add(piece.toString());
        }
        return pieces;
    }
}
