package com.contract.checker.analysis;

import com.contract.checker.model.InputDomain;
import com.contract.checker.model.VariableRange;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Enumerates every input assignment of a bounded domain.
 *
 * Variables are ordered by name and the Cartesian product is walked like an
 * odometer: each range runs from min to max, and the last variable varies
 * fastest. Every call to {@link #iterator()} restarts the same sequence.
 * A domain without variables yields exactly one empty assignment.
 */
public class DomainEnumerator implements Iterable<Map<String, Long>> {

    private final List<VariableRange> ranges;

    /**
     * @param domain The domain to enumerate. Its ranges were validated when
     *               they were built, so an {@code InvalidRangeException} has
     *               already surfaced before any input is produced.
     */
    public DomainEnumerator(InputDomain domain) {
        this.ranges = domain.getRanges();
    }

    @Override
    public Iterator<Map<String, Long>> iterator() {
        return new OdometerIterator();
    }

    private final class OdometerIterator implements Iterator<Map<String, Long>> {

        private final long[] current = new long[ranges.size()];
        private boolean hasNext = true;

        OdometerIterator() {
            for (int i = 0; i < current.length; i++) {
                current[i] = ranges.get(i).getMin();
            }
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public Map<String, Long> next() {
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            Map<String, Long> input = new LinkedHashMap<>();
            for (int i = 0; i < current.length; i++) {
                input.put(ranges.get(i).getName(), current[i]);
            }
            advance();
            return Collections.unmodifiableMap(input);
        }

        private void advance() {
            for (int i = current.length - 1; i >= 0; i--) {
                if (current[i] < ranges.get(i).getMax()) {
                    current[i]++;
                    return;
                }
                current[i] = ranges.get(i).getMin();
            }
            // every digit wrapped around
            hasNext = false;
        }
    }
}
