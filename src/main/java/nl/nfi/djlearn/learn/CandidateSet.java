package nl.nfi.djlearn.learn;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Set of candidates with constant time add and remove. Removal moves the last element into
 * the freed slot, so iteration order is insertion order only until the first removal.
 */
public final class CandidateSet extends AbstractSet<Candidate> {

    private final List<Candidate> candidates = new ArrayList<>();
    private final Map<Candidate, Integer> positions = new HashMap<>();

    public CandidateSet() {
    }

    public CandidateSet(final Collection<Candidate> candidates) {
        addAll(candidates);
    }

    @Override
    public boolean add(final Candidate candidate) {
        if (positions.containsKey(candidate)) {
            return false;
        }
        positions.put(candidate, candidates.size());
        candidates.add(candidate);
        return true;
    }

    @Override
    public boolean remove(final Object o) {
        final Integer position = positions.remove(o);
        if (position == null) {
            return false;
        }
        final Candidate last = candidates.remove(candidates.size() - 1);
        if (position < candidates.size()) {
            candidates.set(position, last);
            positions.put(last, position);
        }
        return true;
    }

    @Override
    public boolean contains(final Object o) {
        return positions.containsKey(o);
    }

    @Override
    public int size() {
        return candidates.size();
    }

    @Override
    public void clear() {
        candidates.clear();
        positions.clear();
    }

    @Override
    public Iterator<Candidate> iterator() {
        return new Iterator<>() {

            private int index;
            private boolean removable;

            @Override
            public boolean hasNext() {
                return index < candidates.size();
            }

            @Override
            public Candidate next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                removable = true;
                return candidates.get(index++);
            }

            @Override
            public void remove() {
                if (!removable) {
                    throw new IllegalStateException();
                }
                removable = false;
                // the last element moves into the current slot and still has to be visited
                CandidateSet.this.remove(candidates.get(--index));
            }
        };
    }
}
