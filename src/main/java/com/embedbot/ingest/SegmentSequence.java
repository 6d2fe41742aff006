package com.embedbot.ingest;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Ordered segments packed on demand from cleaned sentences. Each iteration packs from the
 * start again and yields the same segments.
 */
public final class SegmentSequence implements Iterable<String> {
    private final List<String> units;
    private final int maxSentences;
    private final int maxCharacters;

    SegmentSequence(List<String> units, int maxSentences, int maxCharacters) {
        this.units = List.copyOf(units);
        this.maxSentences = maxSentences;
        this.maxCharacters = maxCharacters;
    }

    @Override
    public Iterator<String> iterator() {
        return new PackingIterator();
    }

    public List<String> toList() {
        List<String> segments = new ArrayList<>();
        for (String segment : this) {
            segments.add(segment);
        }
        return segments;
    }

    private final class PackingIterator implements Iterator<String> {
        private int position;

        @Override
        public boolean hasNext() {
            return position < units.size();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StringBuilder segment = new StringBuilder(units.get(position++));
            int sentences = 1;
            while (position < units.size() && sentences < maxSentences) {
                String candidate = units.get(position);
                if (segment.length() + 1 + candidate.length() > maxCharacters) {
                    break;
                }
                segment.append(' ').append(candidate);
                sentences++;
                position++;
            }
            return segment.toString();
        }
    }
}
